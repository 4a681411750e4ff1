/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.exception;

/** Base class of the errors raised by statement instrumentation. */
public class InstrumentationException extends RuntimeException {

  public InstrumentationException(String message) {
    super(message);
  }

  public InstrumentationException(String message, Throwable cause) {
    super(message, cause);
  }
}
