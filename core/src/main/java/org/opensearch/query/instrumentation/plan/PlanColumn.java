/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.plan;

import lombok.AllArgsConstructor;
import lombok.Data;

/** An output column of a plan node. */
@Data
@AllArgsConstructor
public class PlanColumn {
  private final String name;
  private final String type;

  public String render(boolean showTypes) {
    return showTypes ? name + " " + type : name;
  }
}
