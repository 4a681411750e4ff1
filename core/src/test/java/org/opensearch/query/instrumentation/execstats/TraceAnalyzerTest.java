/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.opensearch.query.instrumentation.execstats.TraceFixtures.flowStats;
import static org.opensearch.query.instrumentation.execstats.TraceFixtures.processorStats;
import static org.opensearch.query.instrumentation.execstats.TraceFixtures.recordingOf;
import static org.opensearch.query.instrumentation.execstats.TraceFixtures.streamStats;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.query.instrumentation.exception.TraceExtractionException;
import org.opensearch.query.tracing.Recording;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class TraceAnalyzerTest {

  private final FlowsMetadata metadata =
      new FlowsMetadata().addFlow("f1", 1, List.of(1, 2), List.of(7));

  @Test
  void should_compute_query_level_stats_of_one_plan() {
    // Given
    Recording trace =
        recordingOf(
            processorStats("f1", 1, 1, 10),
            processorStats("f1", 2, 1, 5),
            streamStats("f1", 7, 1, 300, 3),
            flowStats("f1", 1, 2048, 0),
            flowStats("f1", 2, 4096, 512));

    // When
    QueryLevelStats stats = TraceAnalyzer.getQueryLevelStats(trace, false, List.of(metadata));

    // Then
    assertEquals(15, stats.getKvRowsRead());
    assertEquals(150, stats.getKvBytesRead());
    assertEquals(2_000_000, stats.getKvTime());
    assertEquals(300, stats.getNetworkBytesSent());
    assertEquals(3, stats.getNetworkMessages());
    assertEquals(4096, stats.getMaxMemUsage());
    assertEquals(512, stats.getMaxDiskUsage());
  }

  @Test
  void should_sum_statistics_across_plans() {
    FlowsMetadata subquery = new FlowsMetadata().addFlow("f2", 2, List.of(5), List.of());
    Recording trace = recordingOf(processorStats("f1", 1, 1, 10), processorStats("f2", 5, 2, 7));

    QueryLevelStats stats =
        TraceAnalyzer.getQueryLevelStats(trace, false, List.of(metadata, subquery));

    assertEquals(17, stats.getKvRowsRead());
  }

  @Test
  void should_ignore_components_of_flows_outside_the_plan() {
    Recording trace = recordingOf(processorStats("other", 99, 1, 1000));

    QueryLevelStats stats = TraceAnalyzer.getQueryLevelStats(trace, false, List.of(metadata));

    assertEquals(0, stats.getKvRowsRead());
  }

  @Test
  void should_fall_back_to_sent_bytes_for_outbound_streams() {
    ComponentStats outbound = new ComponentStats(ComponentId.stream("f1", 7, 1));
    outbound.getNetTx().setBytesSent(StatValue.of(64));
    outbound.getNetTx().setMessagesSent(StatValue.of(2));

    QueryLevelStats stats =
        TraceAnalyzer.getQueryLevelStats(recordingOf(outbound), false, List.of(metadata));

    assertEquals(64, stats.getNetworkBytesSent());
    assertEquals(2, stats.getNetworkMessages());
  }

  @Test
  void should_fail_on_stream_without_network_statistics() {
    Recording trace = recordingOf(new ComponentStats(ComponentId.stream("f1", 7, 1)));

    TraceExtractionException e =
        assertThrows(
            TraceExtractionException.class,
            () -> TraceAnalyzer.getQueryLevelStats(trace, false, List.of(metadata)));

    assertTrue(e.getMessage().startsWith("error analyzing trace statistics: "), e.getMessage());
    assertTrue(e.getMessage().contains("stream 7"), e.getMessage());
  }

  @Test
  void should_fail_on_unknown_processor_of_a_known_flow() {
    Recording trace = recordingOf(processorStats("f1", 42, 1, 1));

    TraceExtractionException e =
        assertThrows(
            TraceExtractionException.class,
            () -> TraceAnalyzer.getQueryLevelStats(trace, false, List.of(metadata)));

    assertTrue(e.getMessage().contains("unknown processor 42"), e.getMessage());
  }

  @Test
  void should_fail_on_undecodable_component_stats() {
    Recording trace = recordingOf(new Broken.ComponentStats());

    assertThrows(
        TraceExtractionException.class,
        () -> TraceAnalyzer.getQueryLevelStats(trace, false, List.of(metadata)));
  }

  @Test
  void should_accumulate_into_an_existing_aggregate() {
    QueryLevelStats total = new QueryLevelStats();
    total.setKvRowsRead(5);
    total.setMaxMemUsage(10_000);
    QueryLevelStats stats =
        TraceAnalyzer.getQueryLevelStats(
            recordingOf(processorStats("f1", 1, 1, 10), flowStats("f1", 1, 2048, 0)),
            false,
            List.of(metadata));

    total.accumulate(stats);

    assertEquals(15, total.getKvRowsRead());
    assertEquals(10_000, total.getMaxMemUsage());
  }

  /** Payloads that share the statistics type name but not its shape. */
  static class Broken {
    /** Recorded under the same type name as the real statistics. */
    public static class ComponentStats {
      public String component = "not a component id";
    }
  }
}
