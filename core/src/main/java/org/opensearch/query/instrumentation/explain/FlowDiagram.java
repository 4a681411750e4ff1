/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.explain;

import java.io.IOException;
import org.opensearch.query.tracing.Recording;

/** A rendering of the physical flows of one plan. */
public interface FlowDiagram {

  /** Adds the execution statistics found in the trace to the diagram's components. */
  void addSpans(Recording trace);

  /**
   * Encodes the diagram into a URL that displays it.
   *
   * @throws IOException if the diagram cannot be encoded
   */
  String toUrl() throws IOException;
}
