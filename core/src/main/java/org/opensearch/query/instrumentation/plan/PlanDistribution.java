/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.plan;

import java.util.Locale;

/** How a physical plan is spread over the cluster. */
public enum PlanDistribution {
  /** Runs entirely on the gateway node. */
  LOCAL,

  /** Some parts run remotely, the rest on the gateway node. */
  PARTIAL,

  /** Runs distributed across every node holding relevant data. */
  FULL;

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
