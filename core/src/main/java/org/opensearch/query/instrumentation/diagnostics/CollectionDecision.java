/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.diagnostics;

import lombok.Data;

/** Result of asking the registry whether the current execution should be captured. */
@Data
public class CollectionDecision {

  private static final CollectionDecision NONE =
      new CollectionDecision(false, RequestId.NONE, null);

  private final boolean shouldCollect;
  private final RequestId requestId;

  /** The matched request, or null if none matched. */
  private final DiagnosticsRequest request;

  public static CollectionDecision none() {
    return NONE;
  }
}
