/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.tracing;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** A free-form message logged into a verbose span. */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public class LogRecord {
  private final long timeMillis;
  private final String message;
}
