/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.query.instrumentation.execstats.ExecutionStats;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExplainPlanTest {

  @Test
  void should_link_nodes_by_index() {
    // Given
    ExplainPlan.Builder builder = ExplainPlan.builder();
    int scan = builder.node("scan").attribute("table", "t").estimatedRowCount(3).add();
    int filter = builder.node("filter").literal("filter", "k = 1").children(scan).add();

    // When
    ExplainPlan plan = builder.root(filter).build();

    // Then
    assertEquals("filter", plan.getRoot().getOperator());
    assertEquals(List.of(plan.getNode(scan)), plan.getChildren(plan.getRoot()));
    assertEquals(3.0, plan.getNode(scan).getEstimatedRowCount());
    assertTrue(plan.getNode(filter).getAttributes().get(0).isLiteral());
    assertEquals("_", plan.getNode(filter).getAttributes().get(0).render(true));
  }

  @Test
  void should_only_reference_nodes_added_before() {
    ExplainPlan.Builder builder = ExplainPlan.builder();

    assertThrows(IndexOutOfBoundsException.class, () -> builder.node("join").children(0).add());
    assertThrows(IndexOutOfBoundsException.class, () -> builder.root(0));
  }

  @Test
  void should_require_a_root() {
    ExplainPlan.Builder builder = ExplainPlan.builder();
    builder.node("values").add();

    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void should_replace_annotations_of_a_node() {
    ExplainPlan.Builder builder = ExplainPlan.builder();
    ExplainPlan plan = builder.root(builder.node("values").add()).build();
    ExecutionStats later = new ExecutionStats();

    plan.annotate(0, new ExecutionStats());
    plan.annotate(0, later);

    assertSame(later, plan.getAnnotation(0).orElseThrow());
    assertThrows(IndexOutOfBoundsException.class, () -> plan.annotate(1, later));
  }
}
