/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.diagnostics;

import java.time.Duration;
import org.opensearch.query.instrumentation.exception.BundlePersistenceException;

/** Tracks statement diagnostics requests and stores the bundles that satisfy them. */
public interface DiagnosticsRegistry {

  /**
   * Checks whether a request is outstanding for the fingerprint. Unconditional requests are
   * marked ongoing by this call, so only one execution captures them.
   */
  CollectionDecision shouldCollectDiagnostics(String fingerprint);

  /**
   * Returns true if an execution that took {@code execLatency} satisfies the request. Always true
   * when there is no request, as for EXPLAIN ANALYZE (DEBUG).
   */
  boolean isExecLatencyConditionMet(
      RequestId requestId, DiagnosticsRequest request, Duration execLatency);

  /**
   * Persists a bundle and marks the request, if any, as completed.
   *
   * @param collectionError why the bundle could not be built, or null
   * @return the id the bundle can be downloaded with
   * @throws BundlePersistenceException if the bundle could not be stored
   */
  long insertStatementDiagnostics(
      RequestId requestId,
      String fingerprint,
      String statement,
      DiagnosticsBundle bundle,
      String collectionError);

  /** Stops tracking a request that an execution has satisfied. */
  void removeOngoing(RequestId requestId, DiagnosticsRequest request);
}
