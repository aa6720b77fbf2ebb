package com.flamingo.ai.knowledge.elasticsearch;

import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.search.Hit;
import java.util.List;
import java.util.Map;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T> {

  /**
   * Initializes the index with appropriate mappings.
   *
   * <p>Creates the index if it doesn't exist, using the schema defined by the implementation.
   */
  void initIndex();

  /**
   * Indexes multiple documents in bulk. Fails if any single document is rejected.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Performs approximate kNN search restricted by filter queries.
   *
   * @param filters filter queries every hit must match
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @return raw hits ordered by similarity
   */
  List<Hit<Map>> vectorSearch(List<Query> filters, List<Float> queryEmbedding, int topK);

  /**
   * Deletes documents matching the query.
   *
   * @return number of deleted documents
   */
  long deleteBy(Query query);

  /**
   * Refreshes the index to make recent changes visible for search.
   *
   * <p>Useful after bulk indexing operations to ensure documents are immediately searchable.
   */
  void refresh();

  /**
   * Gets the name of the Elasticsearch index.
   *
   * @return the index name
   */
  String getIndexName();
}
