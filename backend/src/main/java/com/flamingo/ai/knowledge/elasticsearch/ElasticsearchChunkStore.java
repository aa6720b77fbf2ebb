package com.flamingo.ai.knowledge.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.aggregations.StatsAggregate;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.MgetResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.get.GetResult;
import co.elastic.clients.elasticsearch.core.mget.MultiGetResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.knowledge.config.KnowledgeConfig;
import com.flamingo.ai.knowledge.domain.enums.SourceType;
import com.flamingo.ai.knowledge.exception.ChunkStoreException;
import com.flamingo.ai.knowledge.exception.OwnerIsolationViolationException;
import com.flamingo.ai.knowledge.store.Chunk;
import com.flamingo.ai.knowledge.store.ChunkFilter;
import com.flamingo.ai.knowledge.store.ChunkStats;
import com.flamingo.ai.knowledge.store.ChunkStore;
import com.flamingo.ai.knowledge.store.ChunkStoreSupport;
import com.flamingo.ai.knowledge.store.ScoredChunk;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Chunk store backed by an Elasticsearch index with a cosine {@code dense_vector} field.
 *
 * <p>The chunk id is the document {@code _id}, so indexing the same id replaces the document.
 * Every query carries an {@code ownerId} term filter. Elasticsearch reports cosine kNN scores as
 * {@code (1 + cos) / 2}; hits are converted back to plain cosine before ranking.
 */
@Service
@ConditionalOnProperty(name = "knowledge.store.backend", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchChunkStore extends AbstractElasticsearchIndexService<Chunk>
    implements ChunkStore {

  private final Clock clock;
  private final String indexName;
  private final int vectorDimensions;

  @Autowired
  public ElasticsearchChunkStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      KnowledgeConfig knowledgeConfig,
      Clock clock) {
    this(
        elasticsearchClient,
        meterRegistry,
        clock,
        knowledgeConfig.getStore().getIndexName(),
        knowledgeConfig.getEmbedding().getDimension());
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public ElasticsearchChunkStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      Clock clock,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.clock = clock;
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected int getVectorDimensions() {
    return vectorDimensions;
  }

  @Override
  protected String getMetricPrefix() {
    return "chunk_store";
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // Filter fields MUST be keyword type for exact term matching
    properties.put("ownerId", Property.of(p -> p.keyword(k -> k)));
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceType", Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceLink", Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceTitle", Property.of(p -> p.keyword(k -> k)));
    properties.put("sectionTitle", Property.of(p -> p.keyword(k -> k)));
    properties.put("text", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("pageNumber", Property.of(p -> p.integer(i -> i)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("chunkSize", Property.of(p -> p.integer(i -> i)));
    properties.put("degraded", Property.of(p -> p.boolean_(b -> b)));
    properties.put("createdAt", Property.of(p -> p.long_(l -> l)));
    properties.put("updatedAt", Property.of(p -> p.long_(l -> l)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(Chunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("ownerId", chunk.getOwnerId());
    document.put("documentId", chunk.getDocumentId());
    document.put("text", chunk.getText());
    document.put("sourceType", chunk.getSourceType().name());
    if (chunk.getSourceLink() != null) {
      document.put("sourceLink", chunk.getSourceLink());
    }
    if (chunk.getSourceTitle() != null) {
      document.put("sourceTitle", chunk.getSourceTitle());
    }
    if (chunk.getPageNumber() != null) {
      document.put("pageNumber", chunk.getPageNumber());
    }
    document.put("sectionTitle", chunk.getSectionTitle() == null ? "" : chunk.getSectionTitle());
    document.put("embedding", chunk.getEmbedding());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("chunkSize", chunk.getText().length());
    document.put("degraded", chunk.isDegraded());
    document.put("createdAt", chunk.getCreatedAt().toEpochMilli());
    document.put("updatedAt", chunk.getUpdatedAt().toEpochMilli());
    return document;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected Chunk convertFromDocument(Map<String, Object> source) {
    Chunk.ChunkBuilder builder =
        Chunk.builder()
            .chunkId((String) source.get("id"))
            .ownerId((String) source.get("ownerId"))
            .documentId((String) source.get("documentId"))
            .text((String) source.get("text"))
            .sourceType(SourceType.valueOf((String) source.get("sourceType")))
            .sourceLink((String) source.get("sourceLink"))
            .sourceTitle((String) source.get("sourceTitle"))
            .sectionTitle((String) source.getOrDefault("sectionTitle", ""))
            .chunkIndex(((Number) source.get("chunkIndex")).intValue())
            .chunkSize(((Number) source.get("chunkSize")).intValue())
            .degraded(Boolean.TRUE.equals(source.get("degraded")))
            .createdAt(Instant.ofEpochMilli(((Number) source.get("createdAt")).longValue()))
            .updatedAt(Instant.ofEpochMilli(((Number) source.get("updatedAt")).longValue()));
    if (source.get("pageNumber") != null) {
      builder.pageNumber(((Number) source.get("pageNumber")).intValue());
    }
    if (source.get("embedding") instanceof List<?> values) {
      List<Float> embedding = new ArrayList<>(values.size());
      for (Object value : values) {
        embedding.add(((Number) value).floatValue());
      }
      builder.embedding(embedding);
    }
    return builder.build();
  }

  @Override
  protected String getDocumentId(Chunk entity) {
    return entity.getChunkId();
  }

  @Override
  public void upsert(String ownerId, List<Chunk> chunks) {
    ChunkStoreSupport.validateBatch(ownerId, chunks, vectorDimensions);
    if (chunks.isEmpty()) {
      return;
    }
    Map<String, Instant> existingCreatedAt = loadExistingCreatedAt(ownerId, chunks);
    Instant now = clock.instant();
    List<Chunk> stamped = new ArrayList<>(chunks.size());
    for (Chunk chunk : chunks) {
      stamped.add(
          chunk.toBuilder()
              .chunkSize(chunk.getText().length())
              .createdAt(existingCreatedAt.getOrDefault(chunk.getChunkId(), now))
              .updatedAt(now)
              .build());
    }
    indexDocuments(stamped);
  }

  /** Reads already stored chunks so re-upserts keep createdAt and never take over a foreign id. */
  @SuppressWarnings("rawtypes")
  private Map<String, Instant> loadExistingCreatedAt(String ownerId, List<Chunk> chunks) {
    List<String> ids = chunks.stream().map(Chunk::getChunkId).toList();
    Map<String, Instant> createdAt = new HashMap<>();
    try {
      MgetResponse<Map> response =
          elasticsearchClient.mget(m -> m.index(indexName).ids(ids), Map.class);
      for (MultiGetResponseItem<Map> item : response.docs()) {
        if (!item.isResult()) {
          continue;
        }
        GetResult<Map> result = item.result();
        if (!result.found() || result.source() == null) {
          continue;
        }
        Object storedOwner = result.source().get("ownerId");
        if (!ownerId.equals(storedOwner)) {
          throw new OwnerIsolationViolationException(
              ownerId, result.id(), "Chunk id " + result.id() + " is owned by another owner");
        }
        Object created = result.source().get("createdAt");
        if (created instanceof Number millis) {
          createdAt.put(result.id(), Instant.ofEpochMilli(millis.longValue()));
        }
      }
    } catch (IOException e) {
      log.error("Failed to read existing chunks from {}: {}", indexName, e.getMessage(), e);
      throw new ChunkStoreException("Failed to read existing chunks", e);
    }
    return createdAt;
  }

  @Override
  @SuppressWarnings("rawtypes")
  public List<ScoredChunk> search(
      String ownerId, List<Float> queryVector, int topK, ChunkFilter extraFilter) {
    ChunkStoreSupport.requireOwner(ownerId);
    ChunkStoreSupport.validateQueryVector(queryVector, vectorDimensions);
    if (topK <= 0) {
      return List.of();
    }
    ChunkFilter filter = extraFilter == null ? ChunkFilter.none() : extraFilter;

    List<Query> filters = new ArrayList<>();
    filters.add(ownerQuery(ownerId));
    if (!filter.documentIds().isEmpty()) {
      filters.add(termsQuery("documentId", filter.documentIds().stream().toList()));
    }
    if (!filter.sourceTypes().isEmpty()) {
      filters.add(
          termsQuery(
              "sourceType", filter.sourceTypes().stream().map(SourceType::name).toList()));
    }

    List<ScoredChunk> hits = new ArrayList<>();
    for (Hit<Map> hit : vectorSearch(filters, queryVector, topK)) {
      List<Chunk> mapped = mapHitsToDocuments(List.of(hit));
      if (mapped.isEmpty() || hit.score() == null) {
        continue;
      }
      Chunk chunk = mapped.get(0);
      chunk.setEmbedding(null);
      double cosine = 2 * hit.score() - 1;
      if (filter.acceptsScore(cosine)) {
        hits.add(new ScoredChunk(chunk, cosine));
      }
    }
    hits.sort(ChunkStoreSupport.RANKING);
    ChunkStoreSupport.verifyOwnership(ownerId, hits);
    return hits;
  }

  @Override
  public int deleteByDocument(String ownerId, String documentId) {
    ChunkStoreSupport.requireOwner(ownerId);
    Query query =
        Query.of(
            q ->
                q.bool(
                    b ->
                        b.filter(ownerQuery(ownerId))
                            .filter(f -> f.term(t -> t.field("documentId").value(documentId)))));
    return (int) deleteBy(query);
  }

  @Override
  public int pruneDocument(String ownerId, String documentId, Set<String> keepChunkIds) {
    ChunkStoreSupport.requireOwner(ownerId);
    List<String> keep = List.copyOf(keepChunkIds);
    Query query =
        Query.of(
            q ->
                q.bool(
                    b ->
                        b.filter(ownerQuery(ownerId))
                            .filter(f -> f.term(t -> t.field("documentId").value(documentId)))
                            .mustNot(m -> m.ids(i -> i.values(keep)))));
    return (int) deleteBy(query);
  }

  /**
   * Reads the chunk with its sequence number and writes it back with {@code if_seq_no}, so a write
   * that landed in between turns the replacement into a version conflict instead of a lost update.
   */
  @Override
  @SuppressWarnings({"rawtypes", "unchecked"})
  public boolean replaceDegradedEmbedding(
      String ownerId, String chunkId, String expectedText, List<Float> embedding) {
    ChunkStoreSupport.requireOwner(ownerId);
    ChunkStoreSupport.validateEmbedding(chunkId, embedding, vectorDimensions);
    try {
      GetResponse<Map> current =
          elasticsearchClient.get(g -> g.index(indexName).id(chunkId), Map.class);
      if (!current.found() || current.source() == null) {
        return false;
      }
      Map<String, Object> source = current.source();
      if (!ownerId.equals(source.get("ownerId"))) {
        log.warn("Refusing to repair chunk {} on behalf of a different owner", chunkId);
        return false;
      }
      boolean degraded = Boolean.TRUE.equals(source.get("degraded"));
      if (!degraded || !expectedText.equals(source.get("text"))) {
        return false;
      }
      source.put("embedding", embedding);
      source.put("degraded", false);
      source.put("updatedAt", clock.instant().toEpochMilli());
      elasticsearchClient.index(
          i ->
              i.index(indexName)
                  .id(chunkId)
                  .document(source)
                  .ifSeqNo(current.seqNo())
                  .ifPrimaryTerm(current.primaryTerm())
                  .refresh(Refresh.WaitFor));
      return true;
    } catch (ElasticsearchException e) {
      if (e.status() == 409) {
        log.debug("Chunk {} changed since it was read, embedding not replaced", chunkId);
        return false;
      }
      throw new ChunkStoreException("Failed to replace embedding of chunk " + chunkId, e);
    } catch (IOException e) {
      throw new ChunkStoreException("Failed to replace embedding of chunk " + chunkId, e);
    }
  }

  @Override
  @SuppressWarnings("rawtypes")
  public List<Chunk> findDegraded(int limit) {
    try {
      SearchResponse<Map> response =
          elasticsearchClient.search(
              s ->
                  s.index(indexName)
                      .query(q -> q.term(t -> t.field("degraded").value(true)))
                      .sort(o -> o.field(f -> f.field("updatedAt").order(SortOrder.Asc)))
                      .size(limit),
              Map.class);
      return mapHitsToDocuments(response.hits().hits());
    } catch (IOException e) {
      throw new ChunkStoreException("Failed to list degraded chunks", e);
    }
  }

  @Override
  @SuppressWarnings({"rawtypes", "unchecked"})
  public Optional<Chunk> findById(String ownerId, String chunkId) {
    ChunkStoreSupport.requireOwner(ownerId);
    try {
      var response = elasticsearchClient.get(g -> g.index(indexName).id(chunkId), Map.class);
      if (!response.found() || response.source() == null) {
        return Optional.empty();
      }
      Map<String, Object> source = response.source();
      if (!ownerId.equals(source.get("ownerId"))) {
        return Optional.empty();
      }
      source.put("id", chunkId);
      return Optional.of(convertFromDocument(source));
    } catch (IOException e) {
      throw new ChunkStoreException("Failed to read chunk " + chunkId, e);
    }
  }

  @Override
  public long count(String ownerId) {
    ChunkStoreSupport.requireOwner(ownerId);
    try {
      return elasticsearchClient.count(c -> c.index(indexName).query(ownerQuery(ownerId))).count();
    } catch (IOException e) {
      throw new ChunkStoreException("Failed to count chunks", e);
    }
  }

  @Override
  @SuppressWarnings("rawtypes")
  public ChunkStats stats(String ownerId) {
    ChunkStoreSupport.requireOwner(ownerId);
    try {
      SearchResponse<Map> response =
          elasticsearchClient.search(
              s ->
                  s.index(indexName)
                      .size(0)
                      .query(ownerQuery(ownerId))
                      .aggregations("sizes", a -> a.stats(st -> st.field("chunkSize")))
                      .aggregations("documents", a -> a.cardinality(c -> c.field("documentId")))
                      .aggregations(
                          "degraded",
                          a -> a.filter(f -> f.term(t -> t.field("degraded").value(true)))),
              Map.class);
      StatsAggregate sizes = response.aggregations().get("sizes").stats();
      if (sizes.count() == 0) {
        return ChunkStats.empty(ownerId);
      }
      long documents = response.aggregations().get("documents").cardinality().value();
      long degraded = response.aggregations().get("degraded").filter().docCount();
      return new ChunkStats(
          ownerId,
          sizes.count(),
          documents,
          degraded,
          sizes.avg() == null ? 0.0 : sizes.avg(),
          sizes.min() == null ? 0 : sizes.min().intValue(),
          sizes.max() == null ? 0 : sizes.max().intValue(),
          (long) sizes.sum());
    } catch (IOException e) {
      throw new ChunkStoreException("Failed to compute chunk stats", e);
    }
  }

  private static Query ownerQuery(String ownerId) {
    return Query.of(q -> q.term(t -> t.field("ownerId").value(ownerId)));
  }

  private static Query termsQuery(String field, List<String> values) {
    List<FieldValue> fieldValues = values.stream().map(FieldValue::of).toList();
    return Query.of(q -> q.terms(t -> t.field(field).terms(v -> v.value(fieldValues))));
  }
}
