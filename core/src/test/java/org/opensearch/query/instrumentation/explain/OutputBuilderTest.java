/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.explain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.query.instrumentation.execstats.ExecutionStats;
import org.opensearch.query.instrumentation.execstats.StatValue;
import org.opensearch.query.instrumentation.plan.ExplainFlags;
import org.opensearch.query.instrumentation.plan.ExplainPlan;
import org.opensearch.query.instrumentation.plan.ExplainTreePlanNode;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class OutputBuilderTest {

  @Test
  void should_render_fields_then_the_annotated_tree() {
    // Given
    ExplainPlan plan = joinPlan();
    plan.annotate(0, scanStats());
    OutputBuilder ob = new OutputBuilder(ExplainFlags.defaults());
    ob.addDistribution("local");
    ob.addVectorized(true);
    ob.setPlan(plan);

    // When
    List<String> rows = ob.buildStringRows();

    // Then
    assertEquals(
        List.of(
            "distribution: local",
            "vectorized: true",
            "",
            "• hash join",
            "│ equality: (k) = (k)",
            "│",
            "├── • scan",
            "│     nodes: n1",
            "│     actual row count: 10",
            "│     KV rows read: 10",
            "│     KV bytes read: 100 B",
            "│     estimated row count: 10",
            "│     table: t",
            "│     spans: /1-/2",
            "│",
            "└── • scan",
            "      table: u"),
        rows);
  }

  @Test
  void should_hide_literal_values() {
    OutputBuilder ob = new OutputBuilder(new ExplainFlags(false, false, true, false));
    ob.setPlan(joinPlan());

    List<String> rows = ob.buildStringRows();

    assertTrue(rows.contains("│     spans: _"), rows.toString());
    assertTrue(rows.contains("│     table: t"), rows.toString());
  }

  @Test
  void should_render_columns_and_extra_statistics_when_verbose() {
    ExplainPlan plan = joinPlan();
    ExecutionStats stats = scanStats();
    stats.setVectorizedBatchCount(StatValue.of(2));
    stats.setStepCount(StatValue.of(4));
    plan.annotate(0, stats);
    OutputBuilder ob = new OutputBuilder(ExplainFlags.forBundle());
    ob.setPlan(plan);

    List<String> rows = ob.buildStringRows();

    assertTrue(rows.contains("│     vectorized batch count: 2"), rows.toString());
    assertTrue(rows.contains("│     MVCC step count (ext/int): 4/0"), rows.toString());
    assertTrue(rows.contains("│     columns: (k INT8)"), rows.toString());
  }

  @Test
  void should_leave_out_verbose_only_statistics_by_default() {
    ExplainPlan plan = joinPlan();
    ExecutionStats stats = scanStats();
    stats.setVectorizedBatchCount(StatValue.of(2));
    plan.annotate(0, stats);
    OutputBuilder ob = new OutputBuilder(ExplainFlags.defaults());
    ob.setPlan(plan);

    String output = ob.buildString();

    assertTrue(!output.contains("vectorized batch count"), output);
    assertTrue(!output.contains("columns:"), output);
  }

  @Test
  void should_hide_timings_when_deflaked() {
    OutputBuilder ob = new OutputBuilder(ExplainFlags.defaults().deflaked());

    ob.addPlanningTime(1_500_000);
    ob.addExecutionTime(2_000_000_000L);
    ob.addKvTime(15_000);

    assertEquals(
        List.of(
            "planning time: <hidden>",
            "execution time: <hidden>",
            "cumulative time spent in KV: 15µs"),
        ob.buildStringRows());
  }

  @Test
  void should_format_top_level_statistics() {
    OutputBuilder ob = new OutputBuilder(ExplainFlags.defaults());

    ob.addPlanningTime(1_500_000);
    ob.addKvReadStats(1_234, 1536);
    ob.addNetworkStats(3, 2048);
    ob.addMaxDiskUsage(0);
    ob.addRegionsStats(List.of("us-east", "us-west"));

    assertEquals(
        "planning time: 1.5ms\n"
            + "rows read from KV: 1,234 (1.5 KiB)\n"
            + "network usage: 2.0 KiB (3 messages)\n"
            + "max sql temp disk usage: 0 B\n"
            + "regions: us-east, us-west\n",
        ob.buildString());
  }

  @Test
  void should_render_subqueries_checks_warnings_and_recommendations() {
    ExplainPlan.Builder builder = ExplainPlan.builder();
    int root = builder.node("values").add();
    int subquery = builder.node("scan").attribute("table", "s").add();
    int check = builder.node("lookup join").add();
    ExplainPlan plan = builder.root(root).subquery(subquery).check(check).build();
    OutputBuilder ob = new OutputBuilder(ExplainFlags.defaults());
    ob.addWarning("table statistics are not available for this plan");
    ob.addIndexRecommendations(List.of("creation: CREATE INDEX ON t (k);"));
    ob.setPlan(plan);

    assertEquals(
        List.of(
            "WARNING: table statistics are not available for this plan",
            "",
            "• values",
            "",
            "• subquery",
            "└── • scan",
            "      table: s",
            "",
            "• constraint-check",
            "└── • lookup join",
            "",
            "index recommendations: 1",
            "1. creation: CREATE INDEX ON t (k);"),
        ob.buildStringRows());
  }

  @Test
  void should_build_a_tree_with_top_level_fields_on_the_root() {
    OutputBuilder ob = new OutputBuilder(ExplainFlags.forStats());
    ob.addDistribution("full");
    ob.setPlan(joinPlan());

    ExplainTreePlanNode tree = ob.buildTree();

    assertEquals("hash join", tree.getName());
    assertEquals(
        List.of(
            new ExplainTreePlanNode.Attribute("distribution", "full"),
            new ExplainTreePlanNode.Attribute("equality", "(k) = (k)")),
        tree.getAttrs());
    assertEquals(2, tree.getChildren().size());
    assertEquals(
        new ExplainTreePlanNode.Attribute("spans", "_"),
        tree.getChildren().get(0).getAttrs().get(1));
  }

  @Test
  void should_build_no_tree_without_a_plan() {
    assertNull(new OutputBuilder(ExplainFlags.defaults()).buildTree());
  }

  private static ExplainPlan joinPlan() {
    ExplainPlan.Builder builder = ExplainPlan.builder();
    int left =
        builder
            .node("scan")
            .attribute("table", "t")
            .literal("spans", "/1-/2")
            .column("k", "INT8")
            .estimatedRowCount(10)
            .add();
    int right = builder.node("scan").attribute("table", "u").add();
    int join =
        builder
            .node("hash join")
            .attribute("equality", "(k) = (k)")
            .column("k", "INT8")
            .children(left, right)
            .add();
    return builder.root(join).build();
  }

  private static ExecutionStats scanStats() {
    ExecutionStats stats = new ExecutionStats();
    stats.setNodes(List.of("n1"));
    stats.setRowCount(StatValue.of(10));
    stats.setKvRowsRead(StatValue.of(10));
    stats.setKvBytesRead(StatValue.of(100));
    return stats;
  }
}
