/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation;

/** What a statement returns to the client. */
public enum OutputMode {
  /** The statement's own result rows. */
  UNMODIFIED,

  /** EXPLAIN ANALYZE (DEBUG): a pointer to a diagnostics bundle. */
  EXPLAIN_ANALYZE_DEBUG,

  /** EXPLAIN ANALYZE: the plan annotated with execution statistics. */
  EXPLAIN_ANALYZE_PLAN,

  /** EXPLAIN ANALYZE (DISTSQL): the annotated plan plus links to the physical flow diagrams. */
  EXPLAIN_ANALYZE_DISTSQL;

  /** True for every EXPLAIN ANALYZE variant. */
  public boolean isAnalyze() {
    return this != UNMODIFIED;
  }
}
