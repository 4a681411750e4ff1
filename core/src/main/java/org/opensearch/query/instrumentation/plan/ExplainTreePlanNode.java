/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.plan;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Structured plan tree persisted alongside statement statistics. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExplainTreePlanNode {

  private String name;
  private List<Attribute> attrs = new ArrayList<>();
  private List<ExplainTreePlanNode> children = new ArrayList<>();

  public ExplainTreePlanNode(String name) {
    this.name = name;
  }

  /** A key/value pair of a node. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Attribute {
    private String key;
    private String value;
  }
}
