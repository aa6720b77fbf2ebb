package com.flamingo.ai.knowledge.config;

import com.flamingo.ai.knowledge.domain.entity.IngestionJob;
import com.flamingo.ai.knowledge.domain.enums.JobStatus;
import com.flamingo.ai.knowledge.domain.repository.IngestionJobRepository;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Fails jobs left PENDING or IN_PROGRESS by a previous process. Their requests lived in memory
 * only, so they can never finish; callers see them as retryable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IngestionJobRecoveryStartupBean implements CommandLineRunner {

  private final IngestionJobRepository jobRepository;
  private final Clock clock;

  @Override
  public void run(String... args) {
    List<IngestionJob> interrupted =
        jobRepository.findByStatusIn(EnumSet.of(JobStatus.PENDING, JobStatus.IN_PROGRESS));
    if (interrupted.isEmpty()) {
      return;
    }
    for (IngestionJob job : interrupted) {
      job.fail("Interrupted by a restart, please resubmit", true, clock.instant());
    }
    jobRepository.saveAll(interrupted);
    log.info("Marked {} interrupted ingestion jobs as failed", interrupted.size());
  }
}
