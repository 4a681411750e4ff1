/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.tracing;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.opensearch.query.tracing.TraceContext;

/** The context a statement should run in and the span it records into. */
@Data
@AllArgsConstructor
public class OpenedSpan {
  private final TraceContext context;
  private final StatementSpan span;
}
