/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sampling;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.opensearch.query.instrumentation.diagnostics.CollectionDecision;

/** What a statement will collect. */
@Data
@AllArgsConstructor
public class SamplingDecision {

  /** Capture a diagnostics bundle. */
  private final boolean collectBundle;

  /** Do not return the statement's rows to the client. */
  private final boolean discardRows;

  private final boolean collectExecStats;
  private final StatsCollectionLevel level;

  /** The diagnostics request being served, if any. */
  private final CollectionDecision diagnostics;

  /** True when no span needs to be opened or borrowed. */
  public boolean isNoop() {
    return level == StatsCollectionLevel.NONE;
  }
}
