/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.exception;

/** The trace of a statement is malformed or inconsistent with the plan's flow metadata. */
public class TraceExtractionException extends InstrumentationException {

  public TraceExtractionException(String message) {
    super(message);
  }

  public TraceExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
