/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;

/** A cluster node and its locality tiers, from the most to the least significant. */
@Data
@AllArgsConstructor
public class NodeDescriptor {
  private final int nodeId;
  private final List<LocalityTier> localityTiers;
}
