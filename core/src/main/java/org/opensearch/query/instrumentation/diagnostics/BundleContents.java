/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.diagnostics;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.opensearch.query.instrumentation.plan.Placeholders;
import org.opensearch.query.tracing.Recording;

/** What goes into a diagnostics bundle. */
@Data
@AllArgsConstructor
public class BundleContents {
  private final String statement;

  /** The plan rendered with full verbosity and types. */
  private final String planText;

  private final Recording trace;
  private final Placeholders placeholders;
  private final List<String> warnings;
}
