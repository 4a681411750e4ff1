/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.exception;

/** The diagnostics registry failed to store a bundle. */
public class BundlePersistenceException extends InstrumentationException {

  public BundlePersistenceException(String message) {
    super(message);
  }

  public BundlePersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
