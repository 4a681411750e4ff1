/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.opensearch.query.instrumentation.explain.FlowInfo;
import org.opensearch.query.instrumentation.plan.Placeholders;

/** What the engine knows about an executed statement when instrumentation finishes. */
@Data
@AllArgsConstructor
public class StatementPlan {

  /** Physical flows of the main query and of every subquery, check and cascade. */
  private final List<FlowInfo> flowInfos;

  private final Placeholders placeholders;

  /** The statement as it is shown in diagnostics bundles. */
  private final String statement;
}
