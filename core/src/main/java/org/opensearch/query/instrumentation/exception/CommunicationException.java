/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.exception;

/**
 * A row could not be written to the statement's result stream. The stream is presumed broken, so
 * this error is fatal to the statement.
 */
public class CommunicationException extends InstrumentationException {

  public CommunicationException(String message) {
    super(message);
  }

  public CommunicationException(String message, Throwable cause) {
    super(message, cause);
  }
}
