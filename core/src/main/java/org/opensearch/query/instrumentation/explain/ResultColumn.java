/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.explain;

import lombok.AllArgsConstructor;
import lombok.Data;

/** Name and type of a result column. */
@Data
@AllArgsConstructor
public class ResultColumn {
  private final String name;
  private final String type;
}
