/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.opensearch.query.tracing.TraceContext;

/** Outcome of {@link InstrumentationController#setup}. */
@Data
@AllArgsConstructor
public class SetupResult {

  /** The context the statement must execute in. */
  private final TraceContext context;

  /** False if {@link InstrumentationController#finish} has nothing to do and may be skipped. */
  private final boolean needFinish;
}
