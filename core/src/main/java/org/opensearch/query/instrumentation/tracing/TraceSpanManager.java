/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.tracing;

import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.query.common.setting.InstrumentationSettings;
import org.opensearch.query.instrumentation.exception.InstrumentationAssertionException;
import org.opensearch.query.instrumentation.sampling.StatsCollectionLevel;
import org.opensearch.query.tracing.Recording;
import org.opensearch.query.tracing.Span;
import org.opensearch.query.tracing.TraceContext;
import org.opensearch.query.tracing.Tracer;

/** Opens the span a statement records into and terminates it exactly once. */
@Log4j2
@RequiredArgsConstructor
public class TraceSpanManager {

  public static final String OPERATION = "traced statement";

  private final Tracer tracer;
  private final InstrumentationSettings settings;

  /**
   * Borrows the ambient span if it is verbose; otherwise opens a child span recording at {@code
   * level}, or no span at all for {@link StatsCollectionLevel#NONE}.
   *
   * @throws InstrumentationAssertionException if the context has no span and assertions are
   *     strict
   */
  public OpenedSpan open(TraceContext ctx, StatsCollectionLevel level) {
    Optional<Span> ambient = tracer.spanFromContext(ctx);
    if (ambient.isPresent()) {
      if (ambient.get().isVerbose()) {
        return new OpenedSpan(ctx, StatementSpan.borrowed(ambient.get()));
      }
    } else {
      missingAmbientSpan();
    }
    if (level == StatsCollectionLevel.NONE) {
      return new OpenedSpan(ctx, StatementSpan.none());
    }
    // Without an ambient span this opens a root span.
    TraceContext child = tracer.openChildSpan(ctx, OPERATION, level.toRecordingType());
    return new OpenedSpan(child, StatementSpan.owned(child.getSpan().orElseThrow()));
  }

  /**
   * Finishes an owned span, or reads a borrowed span without finishing it.
   *
   * @return the statement's recording, or empty when there is no span
   * @throws IllegalStateException if an owned span was already finished
   */
  public Optional<Recording> finish(StatementSpan span) {
    return span.terminate();
  }

  private void missingAmbientSpan() {
    String message = "the context doesn't have a tracing span";
    if (settings.isStrictAssertions()) {
      throw new InstrumentationAssertionException(message);
    }
    log.warn("{}; falling back to a root span", message);
  }
}
