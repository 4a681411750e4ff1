/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sampling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Map;
import java.util.function.DoubleSupplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.opensearch.query.common.setting.InstrumentationSettings;
import org.opensearch.query.common.setting.Settings;
import org.opensearch.query.instrumentation.OutputMode;
import org.opensearch.query.instrumentation.diagnostics.CollectionDecision;
import org.opensearch.query.instrumentation.diagnostics.DiagnosticsRegistry;
import org.opensearch.query.instrumentation.diagnostics.DiagnosticsRequest;
import org.opensearch.query.instrumentation.diagnostics.RequestId;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SamplingPolicyTest {

  private static final String FINGERPRINT = "SELECT _ FROM t";

  @Mock private DiagnosticsRegistry registry;

  @BeforeEach
  void setUp() {
    when(registry.shouldCollectDiagnostics(anyString())).thenReturn(CollectionDecision.none());
  }

  @Test
  void should_never_collect_at_a_zero_sample_rate() {
    // Given
    SamplingPolicy policy = policy(0.0, () -> 0.0);

    // When
    SamplingDecision decision = policy.decide(plain(false, true));

    // Then
    assertFalse(decision.isCollectExecStats());
    assertEquals(StatsCollectionLevel.NONE, decision.getLevel());
    assertTrue(decision.isNoop());
    assertFalse(policy.shouldSampleTransaction());
  }

  @Test
  void should_always_collect_at_a_sample_rate_of_one() {
    SamplingPolicy policy = policy(1.0, () -> 0.999);

    SamplingDecision decision = policy.decide(plain(false, true));

    assertTrue(decision.isCollectExecStats());
    assertEquals(StatsCollectionLevel.STRUCTURED, decision.getLevel());
    assertTrue(policy.shouldSampleTransaction());
  }

  @Test
  void should_collect_when_the_draw_falls_below_the_rate() {
    assertTrue(policy(0.5, () -> 0.49).decide(plain(false, true)).isCollectExecStats());
    assertFalse(policy(0.5, () -> 0.5).decide(plain(false, true)).isCollectExecStats());
  }

  @Test
  void should_not_draw_when_the_plan_is_not_due() {
    SamplingDecision decision = policy(1.0, () -> 0.0).decide(plain(false, false));

    assertFalse(decision.isCollectExecStats());
    assertEquals(StatsCollectionLevel.NONE, decision.getLevel());
  }

  @Test
  void should_collect_structured_stats_when_the_transaction_asked_for_them() {
    SamplingDecision decision = policy(0.0, () -> 0.0).decide(plain(true, false));

    assertTrue(decision.isCollectExecStats());
    assertEquals(StatsCollectionLevel.STRUCTURED, decision.getLevel());
    assertFalse(decision.isCollectBundle());
  }

  @Test
  void should_capture_a_bundle_and_discard_rows_for_explain_analyze_debug() {
    SamplingDecision decision =
        policy(0.0, () -> 0.0)
            .decide(input(OutputMode.EXPLAIN_ANALYZE_DEBUG, false, false, false, false));

    assertTrue(decision.isCollectBundle());
    assertTrue(decision.isDiscardRows());
    assertTrue(decision.isCollectExecStats());
    assertEquals(StatsCollectionLevel.VERBOSE, decision.getLevel());
    verify(registry, never()).shouldCollectDiagnostics(anyString());
  }

  @ParameterizedTest
  @EnumSource(
      value = OutputMode.class,
      names = {"EXPLAIN_ANALYZE_PLAN", "EXPLAIN_ANALYZE_DISTSQL"})
  void should_discard_rows_and_trace_verbosely_for_explain_analyze(OutputMode mode) {
    SamplingDecision decision =
        policy(0.0, () -> 0.0).decide(input(mode, false, false, false, false));

    assertFalse(decision.isCollectBundle());
    assertTrue(decision.isDiscardRows());
    assertTrue(decision.isCollectExecStats());
    assertEquals(StatsCollectionLevel.VERBOSE, decision.getLevel());
  }

  @Test
  void should_capture_a_bundle_for_an_outstanding_request() {
    DiagnosticsRequest request =
        new DiagnosticsRequest(FINGERPRINT, Duration.ofMillis(100), 0, null);
    CollectionDecision outstanding = new CollectionDecision(true, new RequestId(7), request);
    when(registry.shouldCollectDiagnostics(FINGERPRINT)).thenReturn(outstanding);

    SamplingDecision decision = policy(0.0, () -> 0.0).decide(plain(false, false));

    assertTrue(decision.isCollectBundle());
    assertFalse(decision.isDiscardRows());
    assertEquals(StatsCollectionLevel.VERBOSE, decision.getLevel());
    assertEquals(outstanding, decision.getDiagnostics());
  }

  @Test
  void should_reuse_a_verbose_ambient_trace() {
    SamplingDecision decision =
        policy(0.0, () -> 0.0).decide(input(OutputMode.UNMODIFIED, true, false, false, false));

    assertTrue(decision.isCollectExecStats());
    assertEquals(StatsCollectionLevel.VERBOSE, decision.getLevel());
    assertFalse(decision.isCollectBundle());
  }

  @Test
  void should_keep_the_bundle_decision_under_a_verbose_ambient_trace() {
    CollectionDecision outstanding =
        new CollectionDecision(
            true,
            new RequestId(3),
            new DiagnosticsRequest(FINGERPRINT, Duration.ZERO, 0, null));
    when(registry.shouldCollectDiagnostics(FINGERPRINT)).thenReturn(outstanding);

    SamplingDecision decision =
        policy(0.0, () -> 0.0).decide(input(OutputMode.UNMODIFIED, true, false, false, false));

    assertTrue(decision.isCollectBundle());
    assertEquals(StatsCollectionLevel.VERBOSE, decision.getLevel());
  }

  @Test
  void should_trace_verbosely_when_a_statement_trace_callback_is_installed() {
    SamplingDecision decision =
        policy(0.0, () -> 0.0).decide(input(OutputMode.UNMODIFIED, false, false, false, true));

    assertTrue(decision.isCollectExecStats());
    assertEquals(StatsCollectionLevel.VERBOSE, decision.getLevel());
  }

  private SamplingPolicy policy(double rate, DoubleSupplier random) {
    InstrumentationSettings settings =
        new InstrumentationSettings(Map.of(Settings.Key.TXN_STATS_SAMPLE_RATE, rate));
    return new SamplingPolicy(settings, registry, random);
  }

  private static SamplingInput plain(boolean collectTxnExecStats, boolean savePlanForStats) {
    return input(OutputMode.UNMODIFIED, false, collectTxnExecStats, savePlanForStats, false);
  }

  private static SamplingInput input(
      OutputMode mode,
      boolean ambientVerbose,
      boolean collectTxnExecStats,
      boolean savePlanForStats,
      boolean withStatementTrace) {
    return new SamplingInput(
        FINGERPRINT,
        mode,
        ambientVerbose,
        collectTxnExecStats,
        savePlanForStats,
        withStatementTrace);
  }
}
