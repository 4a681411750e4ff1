/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.plan;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/** What the optimizer estimated about a plan, recorded for statistics and EXPLAIN output. */
@Data
@NoArgsConstructor
public class PlanEstimates {

  /** Logical join types. */
  public enum JoinType {
    INNER,
    LEFT_OUTER,
    RIGHT_OUTER,
    FULL_OUTER,
    SEMI,
    ANTI
  }

  /** Physical join algorithms. */
  public enum JoinAlgorithm {
    HASH,
    CROSS,
    INDEX,
    LOOKUP,
    MERGE,
    ZIGZAG
  }

  private double costEstimate;
  private double maxFullScanRows;
  private double totalScanRows;
  private double outputRows;
  private boolean statsAvailable;

  /** Age of the oldest table statistics used by the optimizer. */
  private long nanosSinceStatsCollected;

  private Map<JoinType, Integer> joinTypeCounts = new EnumMap<>(JoinType.class);
  private Map<JoinAlgorithm, Integer> joinAlgorithmCounts = new EnumMap<>(JoinAlgorithm.class);

  /** Index recommendations; only computed for EXPLAIN statements. */
  private List<String> indexRecommendations = new ArrayList<>();

  public void addJoin(JoinType type, JoinAlgorithm algorithm) {
    joinTypeCounts.merge(type, 1, Integer::sum);
    joinAlgorithmCounts.merge(algorithm, 1, Integer::sum);
  }
}
