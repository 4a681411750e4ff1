/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sampling;

import org.opensearch.query.tracing.RecordingType;

/** How much a statement records while it runs. */
public enum StatsCollectionLevel {
  NONE(RecordingType.OFF),
  STRUCTURED(RecordingType.STRUCTURED),
  VERBOSE(RecordingType.VERBOSE);

  private final RecordingType recordingType;

  StatsCollectionLevel(RecordingType recordingType) {
    this.recordingType = recordingType;
  }

  /** The recording mode of the span opened for this level. */
  public RecordingType toRecordingType() {
    return recordingType;
  }
}
