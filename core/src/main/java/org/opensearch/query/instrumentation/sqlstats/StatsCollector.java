/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sqlstats;

import org.opensearch.query.instrumentation.exception.InstrumentationException;
import org.opensearch.query.instrumentation.execstats.QueryLevelStats;

/** Per-statement view of the statement statistics store. */
public interface StatsCollector {

  /** True if the logical plan of this fingerprint should be saved with its statistics. */
  boolean shouldSaveLogicalPlanDesc(String fingerprint, boolean implicitTxn, String database);

  /**
   * Adds the execution statistics of one execution to the bucket of {@code key}.
   *
   * @throws InstrumentationException if the statistics cannot be recorded
   */
  void recordStatementExecStats(StatementStatisticsKey key, QueryLevelStats stats);

  PhaseTimes getPhaseTimes();
}
