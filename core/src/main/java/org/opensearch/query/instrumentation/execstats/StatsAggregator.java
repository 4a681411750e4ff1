/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.query.instrumentation.plan.ExplainPlan;
import org.opensearch.query.instrumentation.plan.PlanNode;
import org.opensearch.query.tracing.RecordedSpan;

/**
 * Annotates the nodes of an {@link ExplainPlan} with the execution statistics of the components
 * that implemented them.
 */
@Log4j2
@RequiredArgsConstructor
public class StatsAggregator {

  private final LocalityResolver localityResolver;

  /**
   * Merges the statistics found in {@code spans} onto the plan nodes listed in {@code metadata}.
   * A node is only annotated when every one of its components reported statistics.
   *
   * @return every region any annotated node ran in, deduplicated and sorted
   */
  public List<String> annotateExplain(
      ExplainPlan plan,
      ExecNodeTraceMetadata metadata,
      Iterable<RecordedSpan> spans,
      boolean makeDeterministic) {
    Map<ComponentId, ComponentStats> statsMap =
        ComponentStatsExtractor.extractStatsFromSpans(spans, makeDeterministic);
    Map<Integer, String> regionsInfo = resolveRegions();
    SortedSet<String> allRegions = new TreeSet<>();

    walk(plan, plan.getRoot(), metadata, statsMap, regionsInfo, allRegions);
    for (PlanNode subquery : plan.getSubqueryRoots()) {
      walk(plan, subquery, metadata, statsMap, regionsInfo, allRegions);
    }
    for (PlanNode check : plan.getCheckRoots()) {
      walk(plan, check, metadata, statsMap, regionsInfo, allRegions);
    }
    return new ArrayList<>(allRegions);
  }

  /**
   * Maps each known node to the value of its region tier; later tiers win. Nodes are left without
   * a region when the descriptors can't be resolved.
   */
  private Map<Integer, String> resolveRegions() {
    Map<Integer, String> regionsInfo = new HashMap<>();
    List<NodeDescriptor> descriptors;
    try {
      descriptors = localityResolver.allKnownNodeDescriptors();
    } catch (RuntimeException e) {
      log.warn("unable to resolve node localities: {}", e.getMessage());
      return regionsInfo;
    }
    for (NodeDescriptor descriptor : descriptors) {
      for (LocalityTier tier : descriptor.getLocalityTiers()) {
        if (LocalityTier.REGION.equals(tier.getKey())) {
          regionsInfo.put(descriptor.getNodeId(), tier.getValue());
        }
      }
    }
    return regionsInfo;
  }

  private void walk(
      ExplainPlan plan,
      PlanNode node,
      ExecNodeTraceMetadata metadata,
      Map<ComponentId, ComponentStats> statsMap,
      Map<Integer, String> regionsInfo,
      SortedSet<String> allRegions) {
    List<ComponentId> components = metadata.getComponents(node.getIndex());
    if (components != null) {
      ExecutionStats nodeStats = new ExecutionStats();
      SortedSet<Integer> nodes = new TreeSet<>();
      SortedSet<String> regions = new TreeSet<>();
      boolean incomplete = false;
      for (ComponentId component : components) {
        if (component.getType() == ComponentId.Type.PROCESSOR) {
          nodes.add(component.getSqlInstanceId());
          String region = regionsInfo.getOrDefault(component.getSqlInstanceId(), "");
          if (!region.isEmpty()) {
            regions.add(region);
          }
        }
        ComponentStats stats = statsMap.get(component);
        if (stats == null) {
          incomplete = true;
          break;
        }
        nodeStats.merge(stats);
      }
      if (incomplete) {
        log.debug("withholding incomplete statistics of plan node {}", node);
      } else {
        for (int nodeId : nodes) {
          nodeStats.getNodes().add("n" + nodeId);
        }
        nodeStats.getRegions().addAll(regions);
        allRegions.addAll(regions);
        plan.annotate(node.getIndex(), nodeStats);
      }
    }
    for (PlanNode child : plan.getChildren(node)) {
      walk(plan, child, metadata, statsMap, regionsInfo, allRegions);
    }
  }
}
