/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sampling;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.opensearch.query.instrumentation.OutputMode;

/** Facts about a statement known before it runs. */
@Data
@AllArgsConstructor
public class SamplingInput {
  private final String fingerprint;
  private final OutputMode outputMode;

  /** The caller's trace is already verbose. */
  private final boolean ambientVerbose;

  /** The transaction elected to collect execution statistics for all its statements. */
  private final boolean collectTxnExecStats;

  /** The logical plan of this fingerprint is due to be saved with its statistics. */
  private final boolean savePlanForStats;

  /** A statement trace callback is installed. */
  private final boolean withStatementTrace;
}
