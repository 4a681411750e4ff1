/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.tracing;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Getter;

/**
 * Span created by {@link InMemoryTracer}. Every append goes to a lock-free queue so that producers
 * on many threads never block each other; snapshots are taken by walking the queues.
 *
 * <p>A span keeps at most {@link InMemoryTracer#getMaxChildrenPerSpan()} children. Past that the
 * oldest finished child is evicted; if every child is still running the new one is not attached.
 * Either way the loss is counted in the {@value #DROPPED_CHILDREN_TAG} tag of the recording.
 */
public class InMemorySpan implements Span {

  public static final String DROPPED_CHILDREN_TAG = "_dropped_children";

  private final InMemoryTracer tracer;
  @Getter private final long traceId;
  @Getter private final long spanId;
  @Getter private final long parentSpanId;
  @Getter private final String operation;
  @Getter private final RecordingType recordingType;
  private final long startTimeMillis;
  private final long startNanos;

  private final AtomicBoolean finished = new AtomicBoolean(false);
  private volatile long durationNanos = -1;

  private final Map<String, String> tags = new ConcurrentHashMap<>();
  private final Queue<LogRecord> logs = new ConcurrentLinkedQueue<>();
  private final Queue<StructuredRecord> structuredRecords = new ConcurrentLinkedQueue<>();
  private final Queue<InMemorySpan> children = new ConcurrentLinkedQueue<>();
  /** Guarded by {@code children}. */
  private int childCount;

  private final AtomicLong droppedChildren = new AtomicLong();
  private final Queue<RecordedSpan> remoteSpans = new ConcurrentLinkedQueue<>();

  InMemorySpan(
      InMemoryTracer tracer,
      long traceId,
      long spanId,
      long parentSpanId,
      String operation,
      RecordingType recordingType) {
    this.tracer = tracer;
    this.traceId = traceId;
    this.spanId = spanId;
    this.parentSpanId = parentSpanId;
    this.operation = operation;
    this.recordingType = recordingType;
    this.startTimeMillis = tracer.getClock().millis();
    this.startNanos = System.nanoTime();
  }

  @Override
  public void recordStructured(Object payload) {
    if (recordingType.recordsStructured()) {
      structuredRecords.add(StructuredPayloads.encode(tracer.getClock().millis(), payload));
    }
  }

  @Override
  public void log(String message) {
    if (isVerbose()) {
      logs.add(new LogRecord(tracer.getClock().millis(), message));
    }
  }

  @Override
  public void setTag(String key, String value) {
    tags.put(key, value);
  }

  @Override
  public void importRemoteRecording(Recording remote) {
    if (recordingType.recordsStructured()) {
      remote.forEach(remoteSpans::add);
    }
  }

  @Override
  public boolean isFinished() {
    return finished.get();
  }

  @Override
  public Recording finishAndGetRecording() {
    if (!finished.compareAndSet(false, true)) {
      throw new IllegalStateException("span " + operation + " is already finished");
    }
    durationNanos = System.nanoTime() - startNanos;
    return getRecording();
  }

  @Override
  public Recording getRecording() {
    if (!recordingType.recordsStructured()) {
      return Recording.empty();
    }
    List<RecordedSpan> spans = new ArrayList<>();
    collect(spans);
    return new Recording(spans);
  }

  void addChild(InMemorySpan child) {
    synchronized (children) {
      if (childCount >= tracer.getMaxChildrenPerSpan() && !evictFinishedChild()) {
        droppedChildren.incrementAndGet();
        return;
      }
      children.add(child);
      childCount++;
    }
  }

  private boolean evictFinishedChild() {
    Iterator<InMemorySpan> it = children.iterator();
    while (it.hasNext()) {
      if (it.next().isFinished()) {
        it.remove();
        childCount--;
        droppedChildren.incrementAndGet();
        return true;
      }
    }
    return false;
  }

  private void collect(List<RecordedSpan> into) {
    into.add(snapshot());
    for (InMemorySpan child : children) {
      child.collect(into);
    }
    into.addAll(remoteSpans);
  }

  private RecordedSpan snapshot() {
    Map<String, String> snapshotTags = tags;
    long dropped = droppedChildren.get();
    if (dropped > 0) {
      snapshotTags = new HashMap<>(tags);
      snapshotTags.put(DROPPED_CHILDREN_TAG, Long.toString(dropped));
    }
    return new RecordedSpan(
        traceId,
        spanId,
        parentSpanId,
        operation,
        startTimeMillis,
        durationNanos,
        snapshotTags,
        new ArrayList<>(logs),
        new ArrayList<>(structuredRecords));
  }

  @Override
  public String toString() {
    return "InMemorySpan{" + operation + ", id=" + spanId + ", " + recordingType + "}";
  }
}
