/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sqlstats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Data;
import org.opensearch.query.common.setting.InstrumentationSettings;
import org.opensearch.query.common.setting.Settings;
import org.opensearch.query.instrumentation.exception.InstrumentationException;
import org.opensearch.query.instrumentation.execstats.QueryLevelStats;
import org.opensearch.query.instrumentation.plan.ExplainTreePlanNode;

/**
 * In-memory statement statistics, bucketed by {@link StatementStatisticsKey}. Also remembers when
 * each fingerprint's logical plan was last sampled so plans are saved at most once per plan
 * collection period.
 */
public class StatementStatsStore {

  public static final int DEFAULT_MAX_BUCKETS = 100_000;

  private final InstrumentationSettings settings;
  private final Clock clock;
  private final int maxBuckets;

  /** Guarded by {@code this}. */
  private final Map<StatementStatisticsKey, StatementStatistics> buckets = new HashMap<>();

  /** Guarded by {@code this}. */
  private final Map<PlanKey, SampledPlan> sampledPlans = new HashMap<>();

  public StatementStatsStore(InstrumentationSettings settings) {
    this(settings, Clock.systemUTC(), DEFAULT_MAX_BUCKETS);
  }

  public StatementStatsStore(InstrumentationSettings settings, Clock clock, int maxBuckets) {
    this.settings = settings;
    this.clock = clock;
    this.maxBuckets = maxBuckets;
  }

  /** Creates the collector for one statement. */
  public StatementStatsCollector newCollector() {
    return new StatementStatsCollector(this, new PhaseTimes());
  }

  /**
   * Adds one execution to its bucket.
   *
   * @throws InstrumentationException if a new bucket would exceed the bucket limit
   */
  public synchronized void record(StatementStatisticsKey key, QueryLevelStats stats) {
    StatementStatistics bucket = buckets.get(key);
    if (bucket == null) {
      if (buckets.size() >= maxBuckets) {
        throw new InstrumentationException(
            String.format(
                "statement statistics limit of %d buckets reached; not recording %s",
                maxBuckets, key.getQuery()));
      }
      bucket = new StatementStatistics();
      buckets.put(key, bucket);
    }
    bucket.add(stats);
  }

  public synchronized Optional<StatementStatistics> get(StatementStatisticsKey key) {
    return Optional.ofNullable(buckets.get(key));
  }

  /** True if plan collection is on and the plan was not sampled within the last period. */
  public synchronized boolean shouldSaveLogicalPlanDesc(
      String fingerprint, boolean implicitTxn, String database) {
    boolean enabled = settings.getSettingValue(Settings.Key.PLAN_COLLECTION_ENABLED);
    if (!enabled) {
      return false;
    }
    SampledPlan sampled = sampledPlans.get(new PlanKey(fingerprint, implicitTxn, database));
    if (sampled == null) {
      return true;
    }
    Duration period = settings.getSettingValue(Settings.Key.PLAN_COLLECTION_PERIOD);
    return !clock.instant().isBefore(sampled.getSampledAt().plus(period));
  }

  /** Stores the sampled plan of a fingerprint and restarts its collection period. */
  public synchronized void savePlan(
      String fingerprint, boolean implicitTxn, String database, ExplainTreePlanNode plan) {
    sampledPlans.put(
        new PlanKey(fingerprint, implicitTxn, database), new SampledPlan(plan, clock.instant()));
  }

  public synchronized Optional<ExplainTreePlanNode> getSampledPlan(
      String fingerprint, boolean implicitTxn, String database) {
    SampledPlan sampled = sampledPlans.get(new PlanKey(fingerprint, implicitTxn, database));
    return sampled == null ? Optional.empty() : Optional.of(sampled.getPlan());
  }

  @Data
  private static class PlanKey {
    private final String fingerprint;
    private final boolean implicitTxn;
    private final String database;
  }

  @Data
  private static class SampledPlan {
    private final ExplainTreePlanNode plan;
    private final Instant sampledAt;
  }
}
