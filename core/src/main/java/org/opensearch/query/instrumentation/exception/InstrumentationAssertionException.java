/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.exception;

/** An internal invariant does not hold. Only thrown when strict assertions are enabled. */
public class InstrumentationAssertionException extends InstrumentationException {

  public InstrumentationAssertionException(String message) {
    super(message);
  }
}
