/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Shape of the flows of one physical plan: which node runs each flow, and which node each of its
 * processors and outbound streams lives on. Used to tell which components of a trace belong to the
 * plan.
 */
public class FlowsMetadata {

  private final Map<String, Integer> flowNodes = new HashMap<>();
  private final Map<Integer, Integer> processorNodes = new HashMap<>();
  private final Map<Integer, Integer> streamNodes = new HashMap<>();

  /**
   * Registers a flow.
   *
   * @param flowId id of the flow
   * @param nodeId node running the flow
   * @param processorIds processors in the flow
   * @param streamIds streams originating in the flow
   * @return this
   */
  public FlowsMetadata addFlow(
      String flowId, int nodeId, Collection<Integer> processorIds, Collection<Integer> streamIds) {
    flowNodes.put(flowId, nodeId);
    processorIds.forEach(id -> processorNodes.put(id, nodeId));
    streamIds.forEach(id -> streamNodes.put(id, nodeId));
    return this;
  }

  public boolean containsFlow(String flowId) {
    return flowNodes.containsKey(flowId);
  }

  public boolean containsProcessor(int processorId) {
    return processorNodes.containsKey(processorId);
  }

  public boolean containsStream(int streamId) {
    return streamNodes.containsKey(streamId);
  }

  /** Flow id to node id. */
  public Map<String, Integer> getFlowNodes() {
    return Collections.unmodifiableMap(flowNodes);
  }

  public Map<Integer, Integer> getProcessorNodes() {
    return Collections.unmodifiableMap(processorNodes);
  }

  public Map<Integer, Integer> getStreamNodes() {
    return Collections.unmodifiableMap(streamNodes);
  }
}
