/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Identifies one distributed execution component of a physical plan. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ComponentId {

  /** Kind of execution component. */
  public enum Type {
    /** A processor running part of a flow on one node. */
    PROCESSOR,

    /** A stream carrying rows between flows. */
    STREAM,

    /** A whole flow on one node. */
    FLOW
  }

  /** Id of the flow the component belongs to. */
  private String flowId;

  private Type type;

  /** Processor or stream id, unique within the physical plan. Unused for flows. */
  private int id;

  /** Node the component ran on. */
  private int sqlInstanceId;

  public static ComponentId processor(String flowId, int processorId, int nodeId) {
    return new ComponentId(flowId, Type.PROCESSOR, processorId, nodeId);
  }

  public static ComponentId stream(String flowId, int streamId, int nodeId) {
    return new ComponentId(flowId, Type.STREAM, streamId, nodeId);
  }

  public static ComponentId flow(String flowId, int nodeId) {
    return new ComponentId(flowId, Type.FLOW, 0, nodeId);
  }
}
