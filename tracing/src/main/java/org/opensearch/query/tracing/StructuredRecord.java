/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.tracing;

import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * A structured payload recorded into a span, kept in its encoded form: the payload type name and
 * its JSON document. Consumers decode the payloads they understand with {@link
 * StructuredPayloads#decode(StructuredRecord, Class)}.
 */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class StructuredRecord {
  private final long timeMillis;
  private final String payloadType;

  @JsonRawValue private final String payload;

  /** Returns true if this record holds a payload of the given class. */
  public boolean isOfType(Class<?> type) {
    return StructuredPayloads.typeName(type).equals(payloadType);
  }
}
