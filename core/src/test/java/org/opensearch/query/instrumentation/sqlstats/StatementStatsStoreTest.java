/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sqlstats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.opensearch.query.common.setting.InstrumentationSettings;
import org.opensearch.query.common.setting.Settings;
import org.opensearch.query.instrumentation.exception.InstrumentationException;
import org.opensearch.query.instrumentation.execstats.QueryLevelStats;
import org.opensearch.query.instrumentation.plan.ExplainTreePlanNode;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StatementStatsStoreTest {

  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  private static final String FINGERPRINT = "SELECT _ FROM t";

  @Mock private Clock clock;

  private final InstrumentationSettings settings = new InstrumentationSettings();

  @BeforeEach
  void setUp() {
    when(clock.instant()).thenReturn(START);
  }

  @Test
  void should_save_a_plan_once_per_collection_period() {
    // Given
    StatementStatsStore store = new StatementStatsStore(settings, clock, 10);
    assertTrue(store.shouldSaveLogicalPlanDesc(FINGERPRINT, true, "db"));

    // When
    store.savePlan(FINGERPRINT, true, "db", new ExplainTreePlanNode("scan"));

    // Then
    assertFalse(store.shouldSaveLogicalPlanDesc(FINGERPRINT, true, "db"));
    assertTrue(store.shouldSaveLogicalPlanDesc(FINGERPRINT, false, "db"));
    assertTrue(store.shouldSaveLogicalPlanDesc(FINGERPRINT, true, "other"));
    assertEquals("scan", store.getSampledPlan(FINGERPRINT, true, "db").orElseThrow().getName());

    when(clock.instant()).thenReturn(START.plus(Duration.ofMinutes(5)).minusMillis(1));
    assertFalse(store.shouldSaveLogicalPlanDesc(FINGERPRINT, true, "db"));
    when(clock.instant()).thenReturn(START.plus(Duration.ofMinutes(5)));
    assertTrue(store.shouldSaveLogicalPlanDesc(FINGERPRINT, true, "db"));
  }

  @Test
  void should_not_save_plans_when_collection_is_disabled() {
    InstrumentationSettings disabled =
        new InstrumentationSettings(Map.of(Settings.Key.PLAN_COLLECTION_ENABLED, false));

    StatementStatsStore store = new StatementStatsStore(disabled, clock, 10);

    assertFalse(store.shouldSaveLogicalPlanDesc(FINGERPRINT, true, "db"));
  }

  @Test
  void should_accumulate_executions_of_one_statement() {
    StatementStatsStore store = new StatementStatsStore(settings, clock, 10);
    StatementStatisticsKey key = new StatementStatisticsKey(FINGERPRINT, true, "db", false, 42L);

    store.record(key, stats(10, 100));
    store.record(key, stats(5, 300));

    StatementStatistics statistics = store.get(key).orElseThrow();
    assertEquals(2, statistics.getExecCount());
    assertEquals(15, statistics.getExecStats().getKvRowsRead());
    assertEquals(300, statistics.getExecStats().getMaxMemUsage());
  }

  @Test
  void should_keep_failed_executions_apart() {
    StatementStatsStore store = new StatementStatsStore(settings, clock, 10);

    store.record(new StatementStatisticsKey(FINGERPRINT, true, "db", false, 1L), stats(1, 1));
    store.record(new StatementStatisticsKey(FINGERPRINT, true, "db", true, 1L), stats(1, 1));

    assertEquals(
        1,
        store
            .get(new StatementStatisticsKey(FINGERPRINT, true, "db", true, 1L))
            .orElseThrow()
            .getExecCount());
  }

  @Test
  void should_refuse_new_statements_past_the_bucket_limit() {
    StatementStatsStore store = new StatementStatsStore(settings, clock, 1);
    StatementStatisticsKey first = new StatementStatisticsKey("SELECT 1", true, "db", false, 0L);
    store.record(first, stats(1, 1));

    InstrumentationException e =
        assertThrows(
            InstrumentationException.class,
            () ->
                store.record(
                    new StatementStatisticsKey("SELECT 2", true, "db", false, 0L), stats(1, 1)));

    assertEquals(
        "statement statistics limit of 1 buckets reached; not recording SELECT 2", e.getMessage());
    store.record(first, stats(1, 1));
    assertEquals(2, store.get(first).orElseThrow().getExecCount());
  }

  @Test
  void should_route_collector_calls_to_the_store() {
    StatementStatsStore store = new StatementStatsStore(settings, clock, 10);
    StatsCollector collector = store.newCollector();
    StatementStatisticsKey key = new StatementStatisticsKey(FINGERPRINT, false, "db", false, 0L);

    collector.recordStatementExecStats(key, stats(3, 3));

    assertTrue(collector.shouldSaveLogicalPlanDesc(FINGERPRINT, false, "db"));
    assertEquals(3, store.get(key).orElseThrow().getExecStats().getKvRowsRead());
  }

  private static QueryLevelStats stats(long kvRowsRead, long maxMem) {
    QueryLevelStats stats = new QueryLevelStats();
    stats.setKvRowsRead(kvRowsRead);
    stats.setMaxMemUsage(maxMem);
    return stats;
  }
}
