/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.explain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.Getter;
import org.opensearch.query.common.utils.HumanizeUtils;
import org.opensearch.query.instrumentation.execstats.ExecutionStats;
import org.opensearch.query.instrumentation.execstats.StatValue;
import org.opensearch.query.instrumentation.plan.ExplainFlags;
import org.opensearch.query.instrumentation.plan.ExplainPlan;
import org.opensearch.query.instrumentation.plan.ExplainTreePlanNode;
import org.opensearch.query.instrumentation.plan.PlanAttribute;
import org.opensearch.query.instrumentation.plan.PlanNode;

/**
 * Collects the top-level fields and the plan of an EXPLAIN output and renders them as text rows or
 * as a tree. Fields are rendered in the order they are added.
 *
 * <pre>
 * distribution: local
 * vectorized: true
 *
 * • render
 * │ nodes: n1
 * │
 * └── • scan
 *       table: t
 * </pre>
 */
public class OutputBuilder {

  private static final String HIDDEN = "<hidden>";

  @Getter private final ExplainFlags flags;
  private final List<Field> fields = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();
  private final List<String> indexRecommendations = new ArrayList<>();
  private ExplainPlan plan;

  public OutputBuilder(ExplainFlags flags) {
    this.flags = flags;
  }

  public void addTopLevelField(String key, String value) {
    fields.add(new Field(key, value));
  }

  public void addDistribution(String distribution) {
    addTopLevelField("distribution", distribution);
  }

  public void addVectorized(boolean vectorized) {
    addTopLevelField("vectorized", Boolean.toString(vectorized));
  }

  public void addPlanningTime(long nanos) {
    addTopLevelField("planning time", flags.isDeflake() ? HIDDEN : HumanizeUtils.duration(nanos));
  }

  public void addExecutionTime(long nanos) {
    addTopLevelField("execution time", flags.isDeflake() ? HIDDEN : HumanizeUtils.duration(nanos));
  }

  public void addKvReadStats(long rows, long bytes) {
    addTopLevelField(
        "rows read from KV",
        String.format(
            Locale.ROOT, "%s (%s)", HumanizeUtils.count(rows), HumanizeUtils.bytes(bytes)));
  }

  public void addKvTime(long nanos) {
    addTopLevelField("cumulative time spent in KV", HumanizeUtils.duration(nanos));
  }

  public void addContentionTime(long nanos) {
    addTopLevelField("cumulative time spent due to contention", HumanizeUtils.duration(nanos));
  }

  public void addMaxMemUsage(long bytes) {
    addTopLevelField("maximum memory usage", HumanizeUtils.bytes(bytes));
  }

  public void addNetworkStats(long messages, long bytes) {
    addTopLevelField(
        "network usage",
        String.format(
            Locale.ROOT,
            "%s (%s messages)",
            HumanizeUtils.bytes(bytes),
            HumanizeUtils.count(messages)));
  }

  public void addMaxDiskUsage(long bytes) {
    addTopLevelField("max sql temp disk usage", HumanizeUtils.bytes(bytes));
  }

  public void addRegionsStats(List<String> regions) {
    addTopLevelField("regions", String.join(", ", regions));
  }

  public void addWarning(String warning) {
    warnings.add(warning);
  }

  public List<String> getWarnings() {
    return List.copyOf(warnings);
  }

  public void addIndexRecommendations(List<String> recommendations) {
    indexRecommendations.addAll(recommendations);
  }

  /** Sets the plan rendered below the top-level fields, with its execution annotations. */
  public void setPlan(ExplainPlan plan) {
    this.plan = plan;
  }

  /** Renders the output as one string per line. */
  public List<String> buildStringRows() {
    List<String> rows = new ArrayList<>();
    for (Field field : fields) {
      rows.add(field.key + ": " + field.value);
    }
    for (String warning : warnings) {
      rows.add("WARNING: " + warning);
    }
    if (plan != null) {
      if (!rows.isEmpty()) {
        rows.add("");
      }
      renderNode(plan.getRoot(), "", "", rows);
      for (PlanNode subquery : plan.getSubqueryRoots()) {
        rows.add("");
        rows.add("• subquery");
        renderNode(subquery, "└── ", "    ", rows);
      }
      for (PlanNode check : plan.getCheckRoots()) {
        rows.add("");
        rows.add("• constraint-check");
        renderNode(check, "└── ", "    ", rows);
      }
    }
    if (!indexRecommendations.isEmpty()) {
      rows.add("");
      rows.add("index recommendations: " + indexRecommendations.size());
      for (int i = 0; i < indexRecommendations.size(); i++) {
        rows.add((i + 1) + ". " + indexRecommendations.get(i));
      }
    }
    return rows;
  }

  /** Renders the output as a single string, one line per row. */
  public String buildString() {
    StringBuilder sb = new StringBuilder();
    for (String row : buildStringRows()) {
      sb.append(row).append('\n');
    }
    return sb.toString();
  }

  /**
   * Builds the structured tree of the main query. Top-level fields become attributes of the root.
   *
   * @return the tree, or null if no plan was set
   */
  public ExplainTreePlanNode buildTree() {
    if (plan == null) {
      return null;
    }
    ExplainTreePlanNode root = buildTree(plan.getRoot());
    List<ExplainTreePlanNode.Attribute> attrs = new ArrayList<>();
    for (Field field : fields) {
      attrs.add(new ExplainTreePlanNode.Attribute(field.key, field.value));
    }
    attrs.addAll(root.getAttrs());
    root.setAttrs(attrs);
    return root;
  }

  private ExplainTreePlanNode buildTree(PlanNode node) {
    ExplainTreePlanNode tree = new ExplainTreePlanNode(node.getOperator());
    for (PlanAttribute attribute : node.getAttributes()) {
      tree.getAttrs()
          .add(
              new ExplainTreePlanNode.Attribute(
                  attribute.getKey(), attribute.render(flags.isHideValues())));
    }
    for (PlanNode child : plan.getChildren(node)) {
      tree.getChildren().add(buildTree(child));
    }
    return tree;
  }

  private void renderNode(PlanNode node, String firstPrefix, String restPrefix, List<String> rows) {
    rows.add(firstPrefix + "• " + node.getOperator());
    List<PlanNode> children = plan.getChildren(node);
    String fieldPrefix = restPrefix + (children.isEmpty() ? "  " : "│ ");
    for (String line : nodeFields(node)) {
      rows.add(fieldPrefix + line);
    }
    if (children.isEmpty()) {
      return;
    }
    rows.add(restPrefix + "│");
    for (int i = 0; i < children.size(); i++) {
      boolean last = i == children.size() - 1;
      renderNode(
          children.get(i),
          restPrefix + (last ? "└── " : "├── "),
          restPrefix + (last ? "    " : "│   "),
          rows);
      if (!last) {
        rows.add(restPrefix + "│");
      }
    }
  }

  private List<String> nodeFields(PlanNode node) {
    List<String> lines = new ArrayList<>();
    plan.getAnnotation(node.getIndex()).ifPresent(stats -> addStats(stats, lines));
    if (node.getEstimatedRowCount() != null) {
      lines.add(
          "estimated row count: " + HumanizeUtils.count(Math.round(node.getEstimatedRowCount())));
    }
    for (PlanAttribute attribute : node.getAttributes()) {
      lines.add(attribute.getKey() + ": " + attribute.render(flags.isHideValues()));
    }
    if ((flags.isVerbose() || flags.isShowTypes()) && !node.getColumns().isEmpty()) {
      lines.add(
          node.getColumns().stream()
              .map(c -> c.render(flags.isShowTypes()))
              .collect(Collectors.joining(", ", "columns: (", ")")));
    }
    return lines;
  }

  private void addStats(ExecutionStats stats, List<String> lines) {
    if (!stats.getNodes().isEmpty()) {
      lines.add("nodes: " + String.join(", ", stats.getNodes()));
    }
    if (!stats.getRegions().isEmpty()) {
      lines.add("regions: " + String.join(", ", stats.getRegions()));
    }
    if (stats.getRowCount().isSet()) {
      lines.add("actual row count: " + HumanizeUtils.count(stats.getRowCount().getValue()));
    }
    if (flags.isVerbose() && stats.getVectorizedBatchCount().isSet()) {
      lines.add(
          "vectorized batch count: "
              + HumanizeUtils.count(stats.getVectorizedBatchCount().getValue()));
    }
    if (stats.getKvTime().isSet()) {
      lines.add("KV time: " + HumanizeUtils.duration(stats.getKvTime().getValue()));
    }
    if (stats.getKvContentionTime().isSet()) {
      lines.add(
          "KV contention time: " + HumanizeUtils.duration(stats.getKvContentionTime().getValue()));
    }
    if (stats.getKvRowsRead().isSet()) {
      lines.add("KV rows read: " + HumanizeUtils.count(stats.getKvRowsRead().getValue()));
    }
    if (stats.getKvBytesRead().isSet()) {
      lines.add("KV bytes read: " + HumanizeUtils.bytes(stats.getKvBytesRead().getValue()));
    }
    if (flags.isVerbose()) {
      addStepSeekCounts(
          "MVCC step count", stats.getStepCount(), stats.getInternalStepCount(), lines);
      addStepSeekCounts(
          "MVCC seek count", stats.getSeekCount(), stats.getInternalSeekCount(), lines);
    }
    if (stats.getMaxAllocatedMem().isSet()) {
      lines.add(
          "estimated max memory allocated: "
              + HumanizeUtils.bytes(stats.getMaxAllocatedMem().getValue()));
    }
    if (stats.getMaxAllocatedDisk().isSet() && stats.getMaxAllocatedDisk().getValue() > 0) {
      lines.add(
          "estimated max sql temp disk usage: "
              + HumanizeUtils.bytes(stats.getMaxAllocatedDisk().getValue()));
    }
  }

  private static void addStepSeekCounts(
      String label, StatValue external, StatValue internal, List<String> lines) {
    if (external.isSet() || internal.isSet()) {
      lines.add(
          label
              + " (ext/int): "
              + HumanizeUtils.count(external.orZero())
              + "/"
              + HumanizeUtils.count(internal.orZero()));
    }
  }

  private static final class Field {
    private final String key;
    private final String value;

    private Field(String key, String value) {
      this.key = key;
      this.value = value;
    }
  }
}
