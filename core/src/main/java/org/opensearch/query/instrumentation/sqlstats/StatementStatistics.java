/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sqlstats;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.opensearch.query.instrumentation.execstats.QueryLevelStats;

/** Aggregated execution statistics of one statement bucket. */
@Data
@NoArgsConstructor
public class StatementStatistics {
  private long execCount;
  private QueryLevelStats execStats = new QueryLevelStats();

  void add(QueryLevelStats stats) {
    execCount++;
    execStats.accumulate(stats);
  }
}
