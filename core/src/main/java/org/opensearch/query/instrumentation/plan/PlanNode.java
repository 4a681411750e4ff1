/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.plan;

import java.util.List;
import lombok.Getter;

/**
 * One operator of an {@link ExplainPlan}. Nodes live in the plan's arena and refer to their
 * children by index, so per-node side tables can be keyed by {@link #getIndex()}.
 */
@Getter
public class PlanNode {

  private final int index;
  private final String operator;
  private final List<PlanAttribute> attributes;
  private final List<PlanColumn> columns;
  private final List<Integer> children;

  /** Optimizer row count estimate, or null if the optimizer had none. */
  private final Double estimatedRowCount;

  PlanNode(
      int index,
      String operator,
      List<PlanAttribute> attributes,
      List<PlanColumn> columns,
      List<Integer> children,
      Double estimatedRowCount) {
    this.index = index;
    this.operator = operator;
    this.attributes = List.copyOf(attributes);
    this.columns = List.copyOf(columns);
    this.children = List.copyOf(children);
    this.estimatedRowCount = estimatedRowCount;
  }

  public int getChildCount() {
    return children.size();
  }

  @Override
  public String toString() {
    return "PlanNode{" + index + ":" + operator + ", children=" + children + "}";
  }
}
