/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.plan;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Options controlling how much of a plan is rendered. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ExplainFlags {

  /** Show output columns and the extra execution statistics. */
  private boolean verbose;

  /** Show column types; implies verbose columns. */
  private boolean showTypes;

  /** Replace literal values with {@code _}, for anonymized plans. */
  private boolean hideValues;

  /** Hide wall-clock timings so output is reproducible. */
  private boolean deflake;

  /** A copy of these flags with {@code deflake} set. */
  public ExplainFlags deflaked() {
    return new ExplainFlags(verbose, showTypes, hideValues, true);
  }

  public static ExplainFlags defaults() {
    return new ExplainFlags();
  }

  /** Flags used for the plan stored in diagnostics bundles. */
  public static ExplainFlags forBundle() {
    return new ExplainFlags(true, true, false, false);
  }

  /** Flags used for the plan persisted with statement statistics. */
  public static ExplainFlags forStats() {
    return new ExplainFlags(false, false, true, false);
  }
}
