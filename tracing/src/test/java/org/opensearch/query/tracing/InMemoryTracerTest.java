/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.tracing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class InMemoryTracerTest {

  private final InMemoryTracer tracer = new InMemoryTracer();

  @Test
  void should_open_root_span_when_context_has_none() {
    TraceContext ctx =
        tracer.openChildSpan(TraceContext.empty(), "statement", RecordingType.STRUCTURED);

    Span span = ctx.getSpan().orElseThrow();
    assertEquals("statement", span.getOperation());
    assertEquals(RecordingType.STRUCTURED, span.getRecordingType());
    assertFalse(span.isVerbose());
  }

  @Test
  void should_inherit_parent_recording_level_when_child_asks_for_less() {
    TraceContext root =
        TraceContext.empty().withSpan(tracer.startRootSpan("session", RecordingType.VERBOSE));

    TraceContext child = tracer.openChildSpan(root, "flow", RecordingType.OFF);

    assertTrue(child.getSpan().orElseThrow().isVerbose());
  }

  @Test
  void should_include_children_and_remote_spans_in_recording() {
    Span root = tracer.startRootSpan("statement", RecordingType.STRUCTURED);
    TraceContext ctx = TraceContext.empty().withSpan(root);
    Span child =
        tracer.openChildSpan(ctx, "flow", RecordingType.STRUCTURED).getSpan().orElseThrow();
    child.recordStructured(new Progress(3));

    Span remote = new InMemoryTracer().startRootSpan("remote flow", RecordingType.STRUCTURED);
    remote.recordStructured(new Progress(4));
    root.importRemoteRecording(remote.finishAndGetRecording());

    Recording recording = root.finishAndGetRecording();

    assertEquals(3, recording.getSpans().size());
    assertEquals("statement", recording.getSpans().get(0).getOperation());
    assertEquals("flow", recording.getSpans().get(1).getOperation());
    assertEquals(root.getSpanId(), recording.getSpans().get(1).getParentSpanId());
    assertEquals("remote flow", recording.getSpans().get(2).getOperation());
    assertTrue(recording.getSpans().get(0).isFinished());
    assertFalse(recording.getSpans().get(1).isFinished());
  }

  @Test
  void should_evict_finished_children_of_a_long_lived_span() {
    // Given
    InMemoryTracer boundedTracer = new InMemoryTracer(Clock.systemUTC(), 3);
    Span session = boundedTracer.startRootSpan("session", RecordingType.STRUCTURED);
    TraceContext ctx = TraceContext.empty().withSpan(session);

    // When
    for (int i = 0; i < 10; i++) {
      Span statement =
          boundedTracer
              .openChildSpan(ctx, "statement " + i, RecordingType.STRUCTURED)
              .getSpan()
              .orElseThrow();
      statement.recordStructured(new Progress(i));
      statement.finishAndGetRecording();
    }

    // Then
    Recording recording = session.getRecording();
    assertEquals(4, recording.getSpans().size());
    assertEquals("statement 7", recording.getSpans().get(1).getOperation());
    assertEquals("statement 9", recording.getSpans().get(3).getOperation());
    assertEquals(
        "7", recording.getSpans().get(0).getTags().get(InMemorySpan.DROPPED_CHILDREN_TAG));
  }

  @Test
  void should_keep_running_children_and_detach_the_overflow() {
    // Given
    InMemoryTracer boundedTracer = new InMemoryTracer(Clock.systemUTC(), 2);
    Span session = boundedTracer.startRootSpan("session", RecordingType.STRUCTURED);
    TraceContext ctx = TraceContext.empty().withSpan(session);
    boundedTracer.openChildSpan(ctx, "first", RecordingType.STRUCTURED);
    boundedTracer.openChildSpan(ctx, "second", RecordingType.STRUCTURED);

    // When
    Span overflow =
        boundedTracer.openChildSpan(ctx, "third", RecordingType.STRUCTURED).getSpan().orElseThrow();
    overflow.recordStructured(new Progress(1));

    // Then
    Recording recording = session.getRecording();
    assertEquals(3, recording.getSpans().size());
    assertEquals("second", recording.getSpans().get(2).getOperation());
    assertEquals(
        "1", recording.getSpans().get(0).getTags().get(InMemorySpan.DROPPED_CHILDREN_TAG));
    assertEquals(1, overflow.finishAndGetRecording().getSpans().size());
  }

  @Test
  void should_reject_a_non_positive_child_limit() {
    assertThrows(IllegalArgumentException.class, () -> new InMemoryTracer(Clock.systemUTC(), 0));
  }

  @Test
  void should_accept_concurrent_appends_from_many_producers() throws Exception {
    Span root = tracer.startRootSpan("statement", RecordingType.STRUCTURED);
    TraceContext ctx = TraceContext.empty().withSpan(root);
    int producers = 8;
    int recordsPerProducer = 250;
    ExecutorService executor = Executors.newFixedThreadPool(producers);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();

    try {
      for (int p = 0; p < producers; p++) {
        futures.add(
            executor.submit(
                () -> {
                  Span flow =
                      tracer.openChildSpan(ctx, "flow", RecordingType.OFF).getSpan().orElseThrow();
                  start.await();
                  for (int i = 0; i < recordsPerProducer; i++) {
                    flow.recordStructured(new Progress(i));
                    root.recordStructured(new Progress(i));
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    Recording recording = root.finishAndGetRecording();
    assertEquals(producers + 1, recording.getSpans().size());
    int total =
        recording.getSpans().stream().mapToInt(s -> s.getStructuredRecords().size()).sum();
    assertEquals(2 * producers * recordsPerProducer, total);
  }

  @Test
  void should_refuse_to_finish_a_span_twice() {
    Span span = tracer.startRootSpan("statement", RecordingType.STRUCTURED);
    span.finishAndGetRecording();

    assertTrue(span.isFinished());
    assertThrows(IllegalStateException.class, span::finishAndGetRecording);
  }

  @Test
  void should_read_recording_without_finishing() {
    Span span = tracer.startRootSpan("statement", RecordingType.VERBOSE);
    span.log("executing");

    Recording recording = span.getRecording();

    assertFalse(span.isFinished());
    assertEquals("executing", recording.getSpans().get(0).getLogs().get(0).getMessage());
  }

  @Test
  void should_record_nothing_when_recording_is_off() {
    Span span = tracer.startRootSpan("statement", RecordingType.OFF);
    span.recordStructured(new Progress(1));
    span.log("ignored");

    assertSame(Recording.empty(), span.finishAndGetRecording());
  }

  @Test
  void should_drop_log_messages_on_structured_spans() {
    Span span = tracer.startRootSpan("statement", RecordingType.STRUCTURED);
    span.log("ignored");
    span.recordStructured(new Progress(7));

    RecordedSpan recorded = span.finishAndGetRecording().getSpans().get(0);

    assertTrue(recorded.getLogs().isEmpty());
    assertEquals(1, recorded.getStructuredRecords().size());
  }

  @Test
  void should_decode_structured_payloads_and_render_json() throws Exception {
    Span span = tracer.startRootSpan("statement", RecordingType.VERBOSE);
    span.setTag("node", "n1");
    span.recordStructured(new Progress(42));
    Recording recording = span.finishAndGetRecording();

    StructuredRecord record = recording.getSpans().get(0).getStructuredRecords().get(0);
    assertTrue(record.isOfType(Progress.class));
    assertEquals(42, StructuredPayloads.decode(record, Progress.class).rows);

    String json = StructuredPayloads.toJson(recording);
    assertTrue(json.contains("\"payload\" : {"), json);
    assertTrue(recording.toVerboseString().startsWith("=== operation:statement node:n1"));
  }

  /** Test payload. */
  public static class Progress {
    public long rows;

    public Progress() {}

    Progress(long rows) {
      this.rows = rows;
    }
  }
}
