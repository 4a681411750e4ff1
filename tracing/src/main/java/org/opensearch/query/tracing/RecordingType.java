/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.tracing;

/** How much a span records. Verbose recording implies structured recording. */
public enum RecordingType {
  /** Nothing is recorded; the span only carries identity. */
  OFF,

  /** Structured payloads (execution statistics) are recorded; free-form log messages are not. */
  STRUCTURED,

  /** Structured payloads and human-readable log messages are recorded. */
  VERBOSE;

  /** Returns true if structured payloads are kept at this level. */
  public boolean recordsStructured() {
    return this != OFF;
  }

  /** Returns the more detailed of the two levels. */
  public static RecordingType max(RecordingType a, RecordingType b) {
    return a.compareTo(b) >= 0 ? a : b;
  }
}
