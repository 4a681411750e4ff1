/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation;

import java.util.function.BiConsumer;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.opensearch.query.tracing.Recording;

/** Hooks for tests. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TestingKnobs {

  /**
   * Called with the trace and raw SQL of every instrumented statement. Installing it makes every
   * statement record a verbose trace.
   */
  private BiConsumer<Recording, String> withStatementTrace;

  public static TestingKnobs none() {
    return new TestingKnobs();
  }
}
