/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sqlstats;

import lombok.RequiredArgsConstructor;
import org.opensearch.query.instrumentation.execstats.QueryLevelStats;

/** {@link StatsCollector} of one statement, backed by a {@link StatementStatsStore}. */
@RequiredArgsConstructor
public class StatementStatsCollector implements StatsCollector {

  private final StatementStatsStore store;
  private final PhaseTimes phaseTimes;

  @Override
  public boolean shouldSaveLogicalPlanDesc(
      String fingerprint, boolean implicitTxn, String database) {
    return store.shouldSaveLogicalPlanDesc(fingerprint, implicitTxn, database);
  }

  @Override
  public void recordStatementExecStats(StatementStatisticsKey key, QueryLevelStats stats) {
    store.record(key, stats);
  }

  @Override
  public PhaseTimes getPhaseTimes() {
    return phaseTimes;
  }
}
