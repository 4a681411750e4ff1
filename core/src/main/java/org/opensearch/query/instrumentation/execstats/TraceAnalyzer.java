/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.opensearch.query.instrumentation.exception.TraceExtractionException;
import org.opensearch.query.tracing.Recording;

/**
 * Computes {@link QueryLevelStats} for the flows of one physical plan from a statement's trace.
 *
 * <p>Components of flows outside the plan are ignored, since a recording may also hold the spans
 * of subqueries or of other statements in the same transaction.
 */
public class TraceAnalyzer {

  private final FlowsMetadata flowsMetadata;
  private final Map<Integer, ComponentStats> processorStats = new HashMap<>();
  private final Map<Integer, ComponentStats> streamStats = new HashMap<>();
  private final Map<Integer, ComponentStats> flowStats = new HashMap<>();

  public TraceAnalyzer(FlowsMetadata flowsMetadata) {
    this.flowsMetadata = flowsMetadata;
  }

  /**
   * Computes the statistics of a statement as the sum over all its plans. Either every plan is
   * analyzed successfully and the sum is returned, or nothing is returned.
   *
   * @throws TraceExtractionException if any plan's statistics cannot be computed; the message
   *     lists every failure
   */
  public static QueryLevelStats getQueryLevelStats(
      Recording trace, boolean makeDeterministic, List<FlowsMetadata> flowsMetadata) {
    Map<ComponentId, ComponentStats> statsMap =
        ComponentStatsExtractor.extractStatsFromSpansStrict(trace, makeDeterministic);
    QueryLevelStats queryLevelStats = new QueryLevelStats();
    List<String> errors = new ArrayList<>();
    for (FlowsMetadata metadata : flowsMetadata) {
      TraceAnalyzer analyzer = new TraceAnalyzer(metadata);
      try {
        analyzer.addStats(statsMap);
        queryLevelStats.accumulate(analyzer.processStats());
      } catch (TraceExtractionException e) {
        errors.add(e.getMessage());
      }
    }
    if (!errors.isEmpty()) {
      throw new TraceExtractionException(
          "error analyzing trace statistics: " + String.join("; ", errors));
    }
    return queryLevelStats;
  }

  /** Associates the extracted component statistics with this plan's components. */
  public void addStats(Map<ComponentId, ComponentStats> statsMap) {
    for (Map.Entry<ComponentId, ComponentStats> entry : statsMap.entrySet()) {
      ComponentId component = entry.getKey();
      if (!flowsMetadata.containsFlow(component.getFlowId())) {
        continue;
      }
      switch (component.getType()) {
        case PROCESSOR:
          if (!flowsMetadata.containsProcessor(component.getId())) {
            throw new TraceExtractionException(
                String.format(
                    "stats for unknown processor %d in flow %s",
                    component.getId(), component.getFlowId()));
          }
          processorStats.put(component.getId(), entry.getValue());
          break;
        case STREAM:
          if (!flowsMetadata.containsStream(component.getId())) {
            throw new TraceExtractionException(
                String.format(
                    "stats for unknown stream %d in flow %s",
                    component.getId(), component.getFlowId()));
          }
          streamStats.put(component.getId(), entry.getValue());
          break;
        case FLOW:
          flowStats.put(component.getSqlInstanceId(), entry.getValue());
          break;
        default:
          throw new TraceExtractionException("unknown component type " + component.getType());
      }
    }
  }

  /** Computes the statistics of this plan from the components added so far. */
  public QueryLevelStats processStats() {
    QueryLevelStats stats = new QueryLevelStats();
    for (ComponentStats processor : processorStats.values()) {
      stats.setKvBytesRead(stats.getKvBytesRead() + processor.getKv().getBytesRead().orZero());
      stats.setKvRowsRead(stats.getKvRowsRead() + processor.getKv().getTuplesRead().orZero());
      stats.setKvTime(stats.getKvTime() + processor.getKv().getKvTime().orZero());
      stats.setContentionTime(
          stats.getContentionTime() + processor.getKv().getContentionTime().orZero());
    }
    for (Map.Entry<Integer, ComponentStats> entry : streamStats.entrySet()) {
      stats.setNetworkBytesSent(
          stats.getNetworkBytesSent() + networkBytes(entry.getKey(), entry.getValue()));
      stats.setNetworkMessages(
          stats.getNetworkMessages() + networkMessages(entry.getKey(), entry.getValue()));
    }
    for (ComponentStats flow : flowStats.values()) {
      stats.setMaxMemUsage(
          Math.max(stats.getMaxMemUsage(), flow.getFlowStats().getMaxMemUsage().orZero()));
      stats.setMaxDiskUsage(
          Math.max(stats.getMaxDiskUsage(), flow.getFlowStats().getMaxDiskUsage().orZero()));
    }
    return stats;
  }

  private static long networkBytes(int streamId, ComponentStats stats) {
    if (stats.getNetRx().getBytesReceived().isSet()) {
      return stats.getNetRx().getBytesReceived().getValue();
    }
    if (stats.getNetTx().getBytesSent().isSet()) {
      return stats.getNetTx().getBytesSent().getValue();
    }
    throw new TraceExtractionException(
        String.format(
            "could not get network bytes for stream %d: neither bytes received nor sent is set",
            streamId));
  }

  private static long networkMessages(int streamId, ComponentStats stats) {
    if (stats.getNetRx().getMessagesReceived().isSet()) {
      return stats.getNetRx().getMessagesReceived().getValue();
    }
    if (stats.getNetTx().getMessagesSent().isSet()) {
      return stats.getNetTx().getMessagesSent().getValue();
    }
    throw new TraceExtractionException(
        String.format(
            "could not get network messages for stream %d: neither messages received nor sent is"
                + " set",
            streamId));
  }
}
