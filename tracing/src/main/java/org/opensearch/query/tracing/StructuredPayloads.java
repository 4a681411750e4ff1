/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.tracing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;

/** Encodes and decodes the payloads carried by {@link StructuredRecord}s. */
@UtilityClass
public class StructuredPayloads {

  private static final ObjectMapper MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  /** The type name a payload class is recorded under. */
  public static String typeName(Class<?> type) {
    return type.getSimpleName();
  }

  /**
   * Encodes a payload.
   *
   * @throws IllegalArgumentException if the payload cannot be serialized
   */
  public static StructuredRecord encode(long timeMillis, Object payload) {
    try {
      return new StructuredRecord(
          timeMillis, typeName(payload.getClass()), MAPPER.writeValueAsString(payload));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Unable to encode structured payload of type " + payload.getClass().getName(), e);
    }
  }

  /**
   * Decodes the payload of a record.
   *
   * @throws JsonProcessingException if the payload is not a valid document for {@code type}
   */
  public static <T> T decode(StructuredRecord record, Class<T> type)
      throws JsonProcessingException {
    return MAPPER.readValue(record.getPayload(), type);
  }

  /** Serializes a whole recording as a JSON document. */
  public static String toJson(Recording recording) {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(recording.getSpans());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize recording", e);
    }
  }
}
