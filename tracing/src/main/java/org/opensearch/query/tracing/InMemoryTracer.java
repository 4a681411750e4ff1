/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.tracing;

import com.google.common.base.Preconditions;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.log4j.Log4j2;

/** A {@link Tracer} whose spans keep their recordings in memory. */
@Log4j2
public class InMemoryTracer implements Tracer {

  public static final int DEFAULT_MAX_CHILDREN_PER_SPAN = 1000;

  private final AtomicLong nextId = new AtomicLong(1);
  private final Clock clock;
  private final int maxChildrenPerSpan;

  public InMemoryTracer() {
    this(Clock.systemUTC());
  }

  public InMemoryTracer(Clock clock) {
    this(clock, DEFAULT_MAX_CHILDREN_PER_SPAN);
  }

  public InMemoryTracer(Clock clock, int maxChildrenPerSpan) {
    Preconditions.checkArgument(
        maxChildrenPerSpan > 0, "maxChildrenPerSpan must be positive: %s", maxChildrenPerSpan);
    this.clock = clock;
    this.maxChildrenPerSpan = maxChildrenPerSpan;
  }

  @Override
  public TraceContext openChildSpan(
      TraceContext parent, String operation, RecordingType recordingType) {
    Span parentSpan = parent.getSpan().orElse(null);
    if (!(parentSpan instanceof InMemorySpan)) {
      if (parentSpan != null) {
        log.debug(
            "parent span {} was not created by this tracer, opening a root span for {}",
            parentSpan.getOperation(),
            operation);
      }
      return parent.withSpan(startRootSpan(operation, recordingType));
    }
    InMemorySpan parentInMemory = (InMemorySpan) parentSpan;
    RecordingType effective = RecordingType.max(recordingType, parentInMemory.getRecordingType());
    InMemorySpan child =
        new InMemorySpan(
            this,
            parentInMemory.getTraceId(),
            nextId.getAndIncrement(),
            parentInMemory.getSpanId(),
            operation,
            effective);
    parentInMemory.addChild(child);
    return parent.withSpan(child);
  }

  @Override
  public Span startRootSpan(String operation, RecordingType recordingType) {
    long id = nextId.getAndIncrement();
    return new InMemorySpan(this, id, id, 0, operation, recordingType);
  }

  Clock getClock() {
    return clock;
  }

  /** Upper bound on the children a single span keeps for its recording. */
  public int getMaxChildrenPerSpan() {
    return maxChildrenPerSpan;
  }
}
