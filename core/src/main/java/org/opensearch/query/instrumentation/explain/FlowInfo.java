/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.explain;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.opensearch.query.instrumentation.execstats.FlowsMetadata;

/** The physical flows of one plan of a statement: the main query, a subquery, a check. */
@Data
@AllArgsConstructor
public class FlowInfo {

  /** What the plan is for, e.g. {@code main-query} or {@code subquery}. */
  private final String type;

  /** Diagram of the flows, or null if diagrams were not saved. */
  private final FlowDiagram diagram;

  private final FlowsMetadata flowsMetadata;
}
