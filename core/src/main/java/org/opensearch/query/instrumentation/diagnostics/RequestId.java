/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.diagnostics;

import lombok.Data;

/** Identifies a statement diagnostics request. The zero id stands for "no request". */
@Data
public class RequestId {

  public static final RequestId NONE = new RequestId(0);

  private final long value;

  public boolean isSet() {
    return value != 0;
  }

  @Override
  public String toString() {
    return Long.toString(value);
  }
}
