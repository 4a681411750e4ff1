/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import lombok.AllArgsConstructor;
import lombok.Data;

/** One {@code key=value} level of a node's locality, e.g. {@code region=us-east1}. */
@Data
@AllArgsConstructor
public class LocalityTier {

  public static final String REGION = "region";

  private final String key;
  private final String value;
}
