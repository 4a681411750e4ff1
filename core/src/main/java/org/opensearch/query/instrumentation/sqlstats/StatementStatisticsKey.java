/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sqlstats;

import lombok.AllArgsConstructor;
import lombok.Data;

/** Identifies the bucket a statement execution's statistics are recorded under. */
@Data
@AllArgsConstructor
public class StatementStatisticsKey {
  private final String query;
  private final boolean implicitTxn;
  private final String database;
  private final boolean failed;
  private final long planHash;
}
