/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.tracing;

import java.util.Optional;

/**
 * Immutable ambient context threaded through statement execution. It carries the span that new
 * work should attach to, if any.
 */
public final class TraceContext {

  private static final TraceContext EMPTY = new TraceContext(null);

  private final Span span;

  private TraceContext(Span span) {
    this.span = span;
  }

  /** A context with no span. */
  public static TraceContext empty() {
    return EMPTY;
  }

  /** Returns a copy of this context whose current span is {@code span}. */
  public TraceContext withSpan(Span span) {
    return new TraceContext(span);
  }

  /** Returns the span carried by this context. */
  public Optional<Span> getSpan() {
    return Optional.ofNullable(span);
  }

  @Override
  public String toString() {
    return span == null ? "TraceContext{}" : "TraceContext{span=" + span.getOperation() + "}";
  }
}
