/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.plan;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.opensearch.query.instrumentation.execstats.ExecutionStats;

/**
 * The plan of a statement as it is explained: an arena of {@link PlanNode}s addressed by index, the
 * main query root, the roots of subqueries and the roots of constraint checks run after the main
 * query. Execution statistics are attached through a side table keyed by node index.
 *
 * <p>Build with {@link #builder()}; children must be added before their parents.
 */
public class ExplainPlan {

  private final List<PlanNode> nodes;
  private final int root;
  private final List<Integer> subqueryRoots;
  private final List<Integer> checkRoots;
  private final Map<Integer, ExecutionStats> annotations = new HashMap<>();

  private ExplainPlan(
      List<PlanNode> nodes, int root, List<Integer> subqueryRoots, List<Integer> checkRoots) {
    this.nodes = Collections.unmodifiableList(nodes);
    this.root = root;
    this.subqueryRoots = List.copyOf(subqueryRoots);
    this.checkRoots = List.copyOf(checkRoots);
  }

  public static Builder builder() {
    return new Builder();
  }

  public PlanNode getNode(int index) {
    return nodes.get(index);
  }

  public List<PlanNode> getNodes() {
    return nodes;
  }

  public PlanNode getRoot() {
    return nodes.get(root);
  }

  public List<PlanNode> getSubqueryRoots() {
    return subqueryRoots.stream().map(nodes::get).collect(Collectors.toList());
  }

  public List<PlanNode> getCheckRoots() {
    return checkRoots.stream().map(nodes::get).collect(Collectors.toList());
  }

  public List<PlanNode> getChildren(PlanNode node) {
    List<PlanNode> children = new ArrayList<>(node.getChildCount());
    for (int child : node.getChildren()) {
      children.add(nodes.get(child));
    }
    return children;
  }

  /** Attaches execution statistics to a node, replacing earlier ones. */
  public void annotate(int index, ExecutionStats stats) {
    Preconditions.checkElementIndex(index, nodes.size(), "plan node index");
    annotations.put(index, stats);
  }

  public Optional<ExecutionStats> getAnnotation(int index) {
    return Optional.ofNullable(annotations.get(index));
  }

  /** Builds an {@link ExplainPlan} bottom-up. */
  public static class Builder {

    private final List<PlanNode> nodes = new ArrayList<>();
    private final List<Integer> subqueryRoots = new ArrayList<>();
    private final List<Integer> checkRoots = new ArrayList<>();
    private Integer root;

    /** Starts a node; finish it with {@link NodeBuilder#add()}. */
    public NodeBuilder node(String operator) {
      return new NodeBuilder(this, operator);
    }

    public Builder root(int index) {
      checkIndex(index);
      this.root = index;
      return this;
    }

    public Builder subquery(int index) {
      checkIndex(index);
      subqueryRoots.add(index);
      return this;
    }

    public Builder check(int index) {
      checkIndex(index);
      checkRoots.add(index);
      return this;
    }

    public ExplainPlan build() {
      Preconditions.checkState(root != null, "plan root was not set");
      return new ExplainPlan(new ArrayList<>(nodes), root, subqueryRoots, checkRoots);
    }

    private int add(NodeBuilder node) {
      node.children.forEach(this::checkIndex);
      int index = nodes.size();
      nodes.add(
          new PlanNode(
              index,
              node.operator,
              node.attributes,
              node.columns,
              node.children,
              node.estimatedRowCount));
      return index;
    }

    private void checkIndex(int index) {
      Preconditions.checkElementIndex(index, nodes.size(), "plan node index");
    }
  }

  /** Accumulates one node's fields. */
  public static class NodeBuilder {

    private final Builder owner;
    private final String operator;
    private final List<PlanAttribute> attributes = new ArrayList<>();
    private final List<PlanColumn> columns = new ArrayList<>();
    private final List<Integer> children = new ArrayList<>();
    private Double estimatedRowCount;

    private NodeBuilder(Builder owner, String operator) {
      this.owner = owner;
      this.operator = operator;
    }

    public NodeBuilder attribute(String key, String value) {
      attributes.add(new PlanAttribute(key, value, false));
      return this;
    }

    /** Adds an attribute whose value contains statement literals. */
    public NodeBuilder literal(String key, String value) {
      attributes.add(new PlanAttribute(key, value, true));
      return this;
    }

    public NodeBuilder column(String name, String type) {
      columns.add(new PlanColumn(name, type));
      return this;
    }

    public NodeBuilder children(int... indexes) {
      for (int index : indexes) {
        children.add(index);
      }
      return this;
    }

    public NodeBuilder estimatedRowCount(double rows) {
      this.estimatedRowCount = rows;
      return this;
    }

    /** Adds the node to the plan and returns its index. */
    public int add() {
      return owner.add(this);
    }
  }
}
