/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.diagnostics;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;

/** A stored diagnostics bundle. */
@Data
@AllArgsConstructor
public class CompletedDiagnostics {
  private final long id;
  private final String fingerprint;
  private final String statement;
  private final DiagnosticsBundle bundle;
  private final String collectionError;
  private final Instant collectedAt;
}
