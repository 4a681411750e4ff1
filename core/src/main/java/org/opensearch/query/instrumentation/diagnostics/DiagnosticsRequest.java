/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.diagnostics;

import java.time.Duration;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;

/** An outstanding request to capture a diagnostics bundle for a statement fingerprint. */
@Data
@AllArgsConstructor
public class DiagnosticsRequest {

  private final String fingerprint;

  /** Executions faster than this are not captured. Zero captures the next execution. */
  private final Duration minExecutionLatency;

  /** Probability of capturing a matching execution; zero means always. */
  private final double samplingProbability;

  /** When the request lapses, or null if it never does. */
  private final Instant expiresAt;

  /** Conditional requests stay outstanding until an execution meets the latency threshold. */
  public boolean isConditional() {
    return !minExecutionLatency.isZero();
  }

  public boolean isExpired(Instant now) {
    return expiresAt != null && !now.isBefore(expiresAt);
  }
}
