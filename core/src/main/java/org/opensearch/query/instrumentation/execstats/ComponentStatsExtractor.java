/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.HashMap;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.opensearch.query.instrumentation.exception.TraceExtractionException;
import org.opensearch.query.tracing.RecordedSpan;
import org.opensearch.query.tracing.StructuredPayloads;
import org.opensearch.query.tracing.StructuredRecord;

/** Pulls the {@link ComponentStats} payloads out of recorded spans. */
@Log4j2
public final class ComponentStatsExtractor {

  private ComponentStatsExtractor() {}

  /**
   * Returns the statistics of every component found in {@code spans}, in a single pass. Payloads
   * reported more than once for the same component are unioned. Undecodable payloads are skipped.
   *
   * @param makeDeterministic overwrite timing and size statistics with fixed values
   */
  public static Map<ComponentId, ComponentStats> extractStatsFromSpans(
      Iterable<RecordedSpan> spans, boolean makeDeterministic) {
    return extract(spans, makeDeterministic, false);
  }

  /**
   * Same as {@link #extractStatsFromSpans(Iterable, boolean)} but fails on the first payload that
   * cannot be decoded.
   *
   * @throws TraceExtractionException if a component statistics payload is malformed
   */
  public static Map<ComponentId, ComponentStats> extractStatsFromSpansStrict(
      Iterable<RecordedSpan> spans, boolean makeDeterministic) {
    return extract(spans, makeDeterministic, true);
  }

  private static Map<ComponentId, ComponentStats> extract(
      Iterable<RecordedSpan> spans, boolean makeDeterministic, boolean failOnMalformed) {
    Map<ComponentId, ComponentStats> statsMap = new HashMap<>();
    for (RecordedSpan span : spans) {
      for (StructuredRecord record : span.getStructuredRecords()) {
        if (!record.isOfType(ComponentStats.class)) {
          continue;
        }
        ComponentStats stats;
        try {
          stats = StructuredPayloads.decode(record, ComponentStats.class);
        } catch (JsonProcessingException e) {
          if (failOnMalformed) {
            throw new TraceExtractionException(
                "malformed component stats in span " + span.getOperation(), e);
          }
          log.debug("skipping malformed component stats in span {}", span.getOperation(), e);
          continue;
        }
        if (stats.getComponent() == null) {
          if (failOnMalformed) {
            throw new TraceExtractionException(
                "component stats without component id in span " + span.getOperation());
          }
          continue;
        }
        if (makeDeterministic) {
          stats.makeDeterministic();
        }
        ComponentStats existing = statsMap.get(stats.getComponent());
        if (existing == null) {
          statsMap.put(stats.getComponent(), stats);
        } else {
          existing.union(stats);
        }
      }
    }
    return statsMap;
  }
}
