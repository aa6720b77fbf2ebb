package com.flamingo.ai.knowledge.store;

import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.SourceType;
import com.flamingo.ai.knowledge.exception.ChunkStoreException;
import com.flamingo.ai.knowledge.exception.OwnerIsolationViolationException;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Chunk store on a relational table (SQLite by default).
 *
 * <p>{@code chunk_id} carries a unique constraint and writes use {@code INSERT ... ON CONFLICT DO
 * UPDATE}, so a re-upsert replaces the row in place. The update is guarded by {@code owner_id}: a
 * conflicting row of another owner is left untouched and the batch is rolled back.
 *
 * <p>Similarity is computed in Java while streaming rows. When the table has no index leading with
 * {@code owner_id}, search scans every row and filters by owner afterwards.
 */
@Service
@ConditionalOnProperty(
    name = "knowledge.store.backend",
    havingValue = "jdbc",
    matchIfMissing = true)
@Slf4j
public class JdbcChunkStore implements ChunkStore {

  private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private static final String COLUMNS =
      "chunk_id, owner_id, document_id, text, source_type, source_link, source_title,"
          + " page_number, section_title, embedding, chunk_index, chunk_size, degraded,"
          + " created_at, updated_at";

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final String table;
  private final int dimension;

  private volatile boolean ownerIndexPresent;

  @Autowired
  public JdbcChunkStore(
      JdbcTemplate jdbcTemplate,
      PlatformTransactionManager transactionManager,
      KnowledgeConfig knowledgeConfig,
      MeterRegistry meterRegistry,
      Clock clock) {
    this(
        jdbcTemplate,
        transactionManager,
        meterRegistry,
        clock,
        knowledgeConfig.getStore().getTableName(),
        knowledgeConfig.getEmbedding().getDimension());
  }

  /** Constructor for testing - allows setting table name and dimension directly. */
  @VisibleForTesting
  public JdbcChunkStore(
      JdbcTemplate jdbcTemplate,
      PlatformTransactionManager transactionManager,
      MeterRegistry meterRegistry,
      Clock clock,
      String table,
      int dimension) {
    if (!SAFE_IDENTIFIER.matcher(table).matches()) {
      throw new IllegalArgumentException("Invalid chunk table name: " + table);
    }
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.table = table;
    this.dimension = dimension;
  }

  @PostConstruct
  public void initSchema() {
    try {
      jdbcTemplate.execute(
          "CREATE TABLE IF NOT EXISTS "
              + table
              + " ("
              + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
              + "chunk_id TEXT NOT NULL UNIQUE, "
              + "owner_id TEXT NOT NULL, "
              + "document_id TEXT NOT NULL, "
              + "text TEXT NOT NULL CHECK (length(text) > 0), "
              + "source_type TEXT NOT NULL, "
              + "source_link TEXT, "
              + "source_title TEXT, "
              + "page_number INTEGER, "
              + "section_title TEXT NOT NULL DEFAULT '', "
              + "embedding BLOB NOT NULL, "
              + "chunk_index INTEGER NOT NULL, "
              + "chunk_size INTEGER NOT NULL, "
              + "degraded INTEGER NOT NULL DEFAULT 0, "
              + "created_at INTEGER NOT NULL, "
              + "updated_at INTEGER NOT NULL)");
      jdbcTemplate.execute(
          "CREATE INDEX IF NOT EXISTS idx_" + table + "_owner ON " + table + " (owner_id)");
      jdbcTemplate.execute(
          "CREATE INDEX IF NOT EXISTS idx_"
              + table
              + "_owner_document ON "
              + table
              + " (owner_id, document_id)");
      jdbcTemplate.execute(
          "CREATE INDEX IF NOT EXISTS idx_" + table + "_degraded ON " + table + " (degraded)");
      refreshIndexState();
      log.info("Chunk table '{}' ready (dimension={})", table, dimension);
    } catch (DataAccessException e) {
      log.error("Failed to initialize chunk table '{}': {}", table, e.getMessage(), e);
      throw new IllegalStateException("Failed to initialize chunk table '" + table + "'", e);
    }
  }

  /** Re-reads the table's indexes and decides between owner-indexed search and full scans. */
  public void refreshIndexState() {
    List<String> indexNames =
        jdbcTemplate.query(
            "PRAGMA index_list('" + table + "')", (rs, rowNum) -> rs.getString("name"));
    boolean found = false;
    for (String indexName : indexNames) {
      List<String> columns =
          jdbcTemplate.query(
              "PRAGMA index_info('" + indexName + "')", (rs, rowNum) -> rs.getString("name"));
      if (!columns.isEmpty() && "owner_id".equals(columns.get(0))) {
        found = true;
        break;
      }
    }
    ownerIndexPresent = found;
    if (!found) {
      log.warn(
          "StoreIndexMissing: no index on {}.owner_id, search falls back to full scans", table);
      meterRegistry.counter("chunk_store.index_missing").increment();
    }
  }

  public boolean isOwnerIndexPresent() {
    return ownerIndexPresent;
  }

  @Override
  @Timed(value = "chunk_store.upsert", description = "Time to upsert chunks")
  public void upsert(String ownerId, List<Chunk> chunks) {
    ChunkStoreSupport.validateBatch(ownerId, chunks, dimension);
    if (chunks.isEmpty()) {
      return;
    }
    long now = clock.instant().toEpochMilli();
    String sql =
        "INSERT INTO "
            + table
            + " ("
            + COLUMNS
            + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT(chunk_id) DO UPDATE SET "
            + "document_id = excluded.document_id, text = excluded.text, "
            + "source_type = excluded.source_type, source_link = excluded.source_link, "
            + "source_title = excluded.source_title, page_number = excluded.page_number, "
            + "section_title = excluded.section_title, embedding = excluded.embedding, "
            + "chunk_index = excluded.chunk_index, chunk_size = excluded.chunk_size, "
            + "degraded = excluded.degraded, updated_at = excluded.updated_at "
            + "WHERE "
            + table
            + ".owner_id = excluded.owner_id";

    withStore(
        "upsert",
        () -> {
          transactionTemplate.executeWithoutResult(
              status -> {
                for (Chunk chunk : chunks) {
                  int changed = jdbcTemplate.update(sql, ps -> bindChunk(ps, chunk, now));
                  if (changed == 0) {
                    throw new OwnerIsolationViolationException(
                        ownerId,
                        chunk.getChunkId(),
                        "Chunk id " + chunk.getChunkId() + " is owned by another owner");
                  }
                }
              });
          return null;
        });
    meterRegistry.counter("chunk_store.upserted").increment(chunks.size());
    log.debug("Upserted {} chunks for owner {}", chunks.size(), ownerId);
  }

  private void bindChunk(PreparedStatement ps, Chunk chunk, long now) throws SQLException {
    ps.setString(1, chunk.getChunkId());
    ps.setString(2, chunk.getOwnerId());
    ps.setString(3, chunk.getDocumentId());
    ps.setString(4, chunk.getText());
    ps.setString(5, chunk.getSourceType().name());
    ps.setString(6, chunk.getSourceLink());
    ps.setString(7, chunk.getSourceTitle());
    if (chunk.getPageNumber() != null) {
      ps.setInt(8, chunk.getPageNumber());
    } else {
      ps.setNull(8, Types.INTEGER);
    }
    ps.setString(9, chunk.getSectionTitle() == null ? "" : chunk.getSectionTitle());
    ps.setBytes(10, ChunkStoreSupport.encode(chunk.getEmbedding()));
    ps.setInt(11, chunk.getChunkIndex());
    ps.setInt(12, chunk.getText().length());
    ps.setInt(13, chunk.isDegraded() ? 1 : 0);
    ps.setLong(14, now);
    ps.setLong(15, now);
  }

  @Override
  @Timed(value = "chunk_store.search", description = "Time for similarity search")
  public List<ScoredChunk> search(
      String ownerId, List<Float> queryVector, int topK, ChunkFilter extraFilter) {
    ChunkStoreSupport.requireOwner(ownerId);
    ChunkStoreSupport.validateQueryVector(queryVector, dimension);
    if (topK <= 0) {
      return List.of();
    }
    ChunkFilter filter = extraFilter == null ? ChunkFilter.none() : extraFilter;
    boolean indexed = ownerIndexPresent;

    // Worst hit at the head so it can be evicted once the heap holds topK.
    PriorityQueue<ScoredChunk> best = new PriorityQueue<>(ChunkStoreSupport.RANKING.reversed());
    String sql = "SELECT " + COLUMNS + " FROM " + table + (indexed ? " WHERE owner_id = ?" : "");
    Object[] args = indexed ? new Object[] {ownerId} : new Object[0];

    withStore(
        "search",
        () -> {
          jdbcTemplate.query(
              sql,
              rs -> {
                if (!ownerId.equals(rs.getString("owner_id"))) {
                  return;
                }
                Chunk chunk = mapChunk(rs, false);
                if (!filter.matches(chunk)) {
                  return;
                }
                double score =
                    ChunkStoreSupport.cosine(
                        queryVector, ChunkStoreSupport.decode(rs.getBytes("embedding")));
                if (!filter.acceptsScore(score)) {
                  return;
                }
                best.add(new ScoredChunk(chunk, score));
                if (best.size() > topK) {
                  best.poll();
                }
              },
              args);
          return null;
        });

    List<ScoredChunk> hits = new ArrayList<>(best);
    hits.sort(ChunkStoreSupport.RANKING);
    ChunkStoreSupport.verifyOwnership(ownerId, hits);
    meterRegistry
        .counter("chunk_store.search", "mode", indexed ? "indexed" : "full_scan")
        .increment();
    log.debug(
        "Search for owner {} returned {} hits (topK={}, indexed={})",
        ownerId,
        hits.size(),
        topK,
        indexed);
    return hits;
  }

  @Override
  @Timed(value = "chunk_store.delete", description = "Time to delete a document's chunks")
  public int deleteByDocument(String ownerId, String documentId) {
    ChunkStoreSupport.requireOwner(ownerId);
    int deleted =
        withStore(
            "delete",
            () ->
                jdbcTemplate.update(
                    "DELETE FROM " + table + " WHERE owner_id = ? AND document_id = ?",
                    ownerId,
                    documentId));
    log.info("Deleted {} chunks of document {} for owner {}", deleted, documentId, ownerId);
    meterRegistry.counter("chunk_store.deleted").increment(deleted);
    return deleted;
  }

  @Override
  public int pruneDocument(String ownerId, String documentId, Set<String> keepChunkIds) {
    ChunkStoreSupport.requireOwner(ownerId);
    List<String> stale =
        withStore(
            "prune",
            () ->
                jdbcTemplate.queryForList(
                    "SELECT chunk_id FROM " + table + " WHERE owner_id = ? AND document_id = ?",
                    String.class,
                    ownerId,
                    documentId));
    stale.removeIf(keepChunkIds::contains);
    if (stale.isEmpty()) {
      return 0;
    }
    List<Object[]> args = new ArrayList<>();
    for (String chunkId : stale) {
      args.add(new Object[] {ownerId, chunkId});
    }
    withStore(
        "prune",
        () ->
            jdbcTemplate.batchUpdate(
                "DELETE FROM " + table + " WHERE owner_id = ? AND chunk_id = ?", args));
    log.info(
        "Pruned {} stale chunks of document {} for owner {}", stale.size(), documentId, ownerId);
    return stale.size();
  }

  @Override
  public boolean replaceDegradedEmbedding(
      String ownerId, String chunkId, String expectedText, List<Float> embedding) {
    ChunkStoreSupport.requireOwner(ownerId);
    ChunkStoreSupport.validateEmbedding(chunkId, embedding, dimension);
    long now = clock.instant().toEpochMilli();
    int changed =
        withStore(
            "replaceEmbedding",
            () ->
                jdbcTemplate.update(
                    "UPDATE "
                        + table
                        + " SET embedding = ?, degraded = 0, updated_at = ?"
                        + " WHERE owner_id = ? AND chunk_id = ? AND degraded = 1 AND text = ?",
                    ChunkStoreSupport.encode(embedding),
                    now,
                    ownerId,
                    chunkId,
                    expectedText));
    if (changed == 0) {
      log.debug("Chunk {} changed since it was read, embedding not replaced", chunkId);
    }
    return changed > 0;
  }

  @Override
  public List<Chunk> findDegraded(int limit) {
    return withStore(
        "findDegraded",
        () ->
            jdbcTemplate.query(
                "SELECT "
                    + COLUMNS
                    + " FROM "
                    + table
                    + " WHERE degraded = 1 ORDER BY updated_at ASC LIMIT ?",
                (rs, rowNum) -> mapChunk(rs, true),
                limit));
  }

  @Override
  public Optional<Chunk> findById(String ownerId, String chunkId) {
    ChunkStoreSupport.requireOwner(ownerId);
    List<Chunk> rows =
        withStore(
            "findById",
            () ->
                jdbcTemplate.query(
                    "SELECT "
                        + COLUMNS
                        + " FROM "
                        + table
                        + " WHERE owner_id = ? AND chunk_id = ?",
                    (rs, rowNum) -> mapChunk(rs, true),
                    ownerId,
                    chunkId));
    return rows.stream().findFirst();
  }

  @Override
  public long count(String ownerId) {
    ChunkStoreSupport.requireOwner(ownerId);
    Long count =
        withStore(
            "count",
            () ->
                jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM " + table + " WHERE owner_id = ?", Long.class, ownerId));
    return count == null ? 0 : count;
  }

  @Override
  public ChunkStats stats(String ownerId) {
    ChunkStoreSupport.requireOwner(ownerId);
    return withStore(
        "stats",
        () ->
            jdbcTemplate.queryForObject(
                "SELECT COUNT(*) AS total, COUNT(DISTINCT document_id) AS documents,"
                    + " COALESCE(SUM(degraded), 0) AS degraded,"
                    + " COALESCE(AVG(chunk_size), 0) AS avg_size,"
                    + " COALESCE(MIN(chunk_size), 0) AS min_size,"
                    + " COALESCE(MAX(chunk_size), 0) AS max_size,"
                    + " COALESCE(SUM(chunk_size), 0) AS total_chars FROM "
                    + table
                    + " WHERE owner_id = ?",
                (rs, rowNum) ->
                    new ChunkStats(
                        ownerId,
                        rs.getLong("total"),
                        rs.getLong("documents"),
                        rs.getLong("degraded"),
                        rs.getDouble("avg_size"),
                        rs.getInt("min_size"),
                        rs.getInt("max_size"),
                        rs.getLong("total_chars")),
                ownerId));
  }

  private Chunk mapChunk(ResultSet rs, boolean withEmbedding) throws SQLException {
    int page = rs.getInt("page_number");
    Integer pageNumber = rs.wasNull() ? null : page;
    return Chunk.builder()
        .chunkId(rs.getString("chunk_id"))
        .ownerId(rs.getString("owner_id"))
        .documentId(rs.getString("document_id"))
        .text(rs.getString("text"))
        .sourceType(SourceType.valueOf(rs.getString("source_type")))
        .sourceLink(rs.getString("source_link"))
        .sourceTitle(rs.getString("source_title"))
        .pageNumber(pageNumber)
        .sectionTitle(rs.getString("section_title"))
        .embedding(
            withEmbedding
                ? ChunkStoreSupport.toList(ChunkStoreSupport.decode(rs.getBytes("embedding")))
                : null)
        .chunkIndex(rs.getInt("chunk_index"))
        .chunkSize(rs.getInt("chunk_size"))
        .degraded(rs.getInt("degraded") == 1)
        .createdAt(Instant.ofEpochMilli(rs.getLong("created_at")))
        .updatedAt(Instant.ofEpochMilli(rs.getLong("updated_at")))
        .build();
  }

  private <T> T withStore(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessException e) {
      log.error("Chunk store {} failed on '{}': {}", operation, table, e.getMessage(), e);
      meterRegistry.counter("chunk_store.errors", "operation", operation).increment();
      throw new ChunkStoreException("Chunk store " + operation + " failed", e);
    }
  }
}
