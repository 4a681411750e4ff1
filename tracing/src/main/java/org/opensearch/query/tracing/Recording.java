/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.tracing;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.EqualsAndHashCode;

/**
 * The spans collected under one span: the span itself first, then its descendants (local children
 * and imported remote spans) in the order they were opened.
 */
@EqualsAndHashCode
public class Recording implements Iterable<RecordedSpan> {

  private static final Recording EMPTY = new Recording(List.of());

  private final List<RecordedSpan> spans;

  public Recording(List<RecordedSpan> spans) {
    this.spans = ImmutableList.copyOf(spans);
  }

  public static Recording empty() {
    return EMPTY;
  }

  public List<RecordedSpan> getSpans() {
    return spans;
  }

  public boolean isEmpty() {
    return spans.isEmpty();
  }

  @Override
  public Iterator<RecordedSpan> iterator() {
    return spans.iterator();
  }

  /** Renders the recording as indented human-readable text, one line per span event. */
  public String toVerboseString() {
    StringBuilder sb = new StringBuilder();
    for (RecordedSpan span : spans) {
      sb.append("=== operation:").append(span.getOperation());
      Map<String, String> sortedTags = new TreeMap<>(span.getTags());
      sortedTags.forEach((k, v) -> sb.append(' ').append(k).append(':').append(v));
      sb.append(" span:").append(span.getSpanId());
      if (span.getParentSpanId() != 0) {
        sb.append(" parent:").append(span.getParentSpanId());
      }
      sb.append('\n');
      for (LogRecord log : span.getLogs()) {
        sb.append("    event:").append(log.getMessage()).append('\n');
      }
      for (StructuredRecord record : span.getStructuredRecords()) {
        sb.append("    structured:")
            .append(record.getPayloadType())
            .append(' ')
            .append(record.getPayload())
            .append('\n');
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "Recording{spans=" + spans.size() + "}";
  }
}
