/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.tracing;

import java.util.Optional;

/** Creates spans. */
public interface Tracer {

  /**
   * Opens a span that is a child of the span in {@code parent}, or a root span if the context has
   * none. The child records at least as much as its parent.
   *
   * @return a context carrying the new span
   */
  TraceContext openChildSpan(TraceContext parent, String operation, RecordingType recordingType);

  /** Returns the span carried by the context, if any. */
  default Optional<Span> spanFromContext(TraceContext ctx) {
    return ctx.getSpan();
  }

  /** Opens a span with no parent. */
  Span startRootSpan(String operation, RecordingType recordingType);
}
