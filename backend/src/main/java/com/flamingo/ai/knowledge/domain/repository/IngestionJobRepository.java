package com.flamingo.ai.knowledge.domain.repository;

import com.flamingo.ai.knowledge.domain.entity.IngestionJob;
import com.flamingo.ai.knowledge.domain.enums.JobStatus;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for IngestionJob entities. */
@Repository
public interface IngestionJobRepository extends JpaRepository<IngestionJob, String> {

  /** Finds the jobs of an owner, newest first. */
  List<IngestionJob> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

  /** Finds jobs in any of the given states. */
  List<IngestionJob> findByStatusIn(Collection<JobStatus> statuses);
}
