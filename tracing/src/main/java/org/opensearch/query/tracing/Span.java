/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.tracing;

/**
 * A trace span. Producers (distributed sub-plan workers) may append to a span from many threads at
 * once; a recording is read by a single consumer once the producers are done.
 */
public interface Span {

  /** Returns the operation name the span was opened with. */
  String getOperation();

  /** Returns the span id, unique within its tracer. */
  long getSpanId();

  /** Returns the recording level of this span. */
  RecordingType getRecordingType();

  /** Returns true if this span records human-readable messages. */
  default boolean isVerbose() {
    return getRecordingType() == RecordingType.VERBOSE;
  }

  /** Appends a structured payload. Ignored when the span does not record. */
  void recordStructured(Object payload);

  /** Appends a log message. Ignored unless the span is verbose. */
  void log(String message);

  /** Sets a tag on the span. */
  void setTag(String key, String value);

  /** Imports spans recorded on a remote node into this span's recording. */
  void importRemoteRecording(Recording remote);

  /** Returns true once {@link #finishAndGetRecording()} has been called. */
  boolean isFinished();

  /**
   * Finishes the span and returns its recording, including every descendant.
   *
   * @throws IllegalStateException if the span was already finished
   */
  Recording finishAndGetRecording();

  /** Returns the recording collected so far without finishing the span. */
  Recording getRecording();
}
