/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sqlstats;

/** Points in a statement's life whose timestamps are recorded. */
public enum SessionPhase {
  SESSION_QUERY_RECEIVED,
  SESSION_START_PARSE,
  SESSION_END_PARSE,
  PLANNER_START_LOGICAL_PLAN,
  PLANNER_END_LOGICAL_PLAN,
  PLANNER_START_EXEC_STMT,
  PLANNER_END_EXEC_STMT,
  SESSION_QUERY_SERVICED
}
