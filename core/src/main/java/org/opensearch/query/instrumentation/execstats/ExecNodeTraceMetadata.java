/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Side table from plan node index to the execution components that implement the node. A node maps
 * to several processors when its part of the plan is distributed. Filled in while the physical plan
 * is built and read once when the statement finishes.
 */
public class ExecNodeTraceMetadata {

  private final Map<Integer, List<ComponentId>> components = new HashMap<>();

  /** Records the components planned for a plan node, replacing any earlier association. */
  public void associateNodeWithComponents(int nodeIndex, List<ComponentId> nodeComponents) {
    components.put(nodeIndex, List.copyOf(nodeComponents));
  }

  /** Returns the components of a node, or null if none were associated. */
  public List<ComponentId> getComponents(int nodeIndex) {
    return components.get(nodeIndex);
  }

  public Set<Integer> getNodeIndexes() {
    return components.keySet();
  }

  public boolean isEmpty() {
    return components.isEmpty();
  }
}
