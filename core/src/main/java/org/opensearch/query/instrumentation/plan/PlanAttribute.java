/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.plan;

import lombok.AllArgsConstructor;
import lombok.Data;

/** A {@code key: value} line attached to a plan node. */
@Data
@AllArgsConstructor
public class PlanAttribute {
  private final String key;
  private final String value;

  /** True when the value embeds statement literals and must be hidden in anonymized output. */
  private final boolean literal;

  /** Renders the value, masking literals if requested. */
  public String render(boolean hideValues) {
    return hideValues && literal ? "_" : value;
  }
}
