package com.flamingo.ai.knowledge.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.knowledge.domain.model.IngestionIssue;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** JPA converter for persisting ingestion issues as a JSON array in a TEXT column. */
@Converter
@Slf4j
public class IngestionIssueListConverter
    implements AttributeConverter<List<IngestionIssue>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<IngestionIssue>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<IngestionIssue> attribute) {
    if (attribute == null || attribute.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize ingestion issues: {}", e.getMessage());
      return null;
    }
  }

  @Override
  public List<IngestionIssue> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return Collections.emptyList();
    }
    try {
      return MAPPER.readValue(dbData, LIST_TYPE);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize ingestion issues: {}", e.getMessage());
      return Collections.emptyList();
    }
  }
}
