/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.tracing;

import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Immutable snapshot of one span. */
@Getter
@EqualsAndHashCode
@ToString
public class RecordedSpan {

  private final long traceId;
  private final long spanId;

  /** Zero for root spans. */
  private final long parentSpanId;

  private final String operation;
  private final long startTimeMillis;

  /** Negative while the span is still open. */
  private final long durationNanos;

  private final Map<String, String> tags;
  private final List<LogRecord> logs;
  private final List<StructuredRecord> structuredRecords;

  public RecordedSpan(
      long traceId,
      long spanId,
      long parentSpanId,
      String operation,
      long startTimeMillis,
      long durationNanos,
      Map<String, String> tags,
      List<LogRecord> logs,
      List<StructuredRecord> structuredRecords) {
    this.traceId = traceId;
    this.spanId = spanId;
    this.parentSpanId = parentSpanId;
    this.operation = operation;
    this.startTimeMillis = startTimeMillis;
    this.durationNanos = durationNanos;
    this.tags = Map.copyOf(tags);
    this.logs = List.copyOf(logs);
    this.structuredRecords = List.copyOf(structuredRecords);
  }

  /** Returns true if the span had been finished when this snapshot was taken. */
  public boolean isFinished() {
    return durationNanos >= 0;
  }
}
