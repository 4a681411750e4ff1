/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sampling;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import lombok.extern.log4j.Log4j2;
import org.opensearch.query.common.setting.InstrumentationSettings;
import org.opensearch.query.instrumentation.OutputMode;
import org.opensearch.query.instrumentation.diagnostics.CollectionDecision;
import org.opensearch.query.instrumentation.diagnostics.DiagnosticsRegistry;

/**
 * Decides, before a statement runs, whether it collects execution statistics, a verbose trace or
 * a diagnostics bundle. Rules, highest precedence first:
 *
 * <ol>
 *   <li>EXPLAIN ANALYZE variants discard rows and collect verbose statistics; the DEBUG variant
 *       also captures a bundle.
 *   <li>An outstanding diagnostics request for the fingerprint captures a bundle.
 *   <li>A verbose ambient trace collects statistics into that trace.
 *   <li>Otherwise statistics are collected if the transaction asked for them, or if the plan of
 *       this fingerprint is due to be saved and a draw at the configured sample rate succeeds.
 * </ol>
 */
@Log4j2
public class SamplingPolicy {

  private final InstrumentationSettings settings;
  private final DiagnosticsRegistry registry;
  private final DoubleSupplier random;

  public SamplingPolicy(InstrumentationSettings settings, DiagnosticsRegistry registry) {
    this(settings, registry, () -> ThreadLocalRandom.current().nextDouble());
  }

  /** @param random source of draws in [0, 1) */
  public SamplingPolicy(
      InstrumentationSettings settings, DiagnosticsRegistry registry, DoubleSupplier random) {
    this.settings = settings;
    this.registry = registry;
    this.random = random;
  }

  public SamplingDecision decide(SamplingInput input) {
    boolean collectBundle = false;
    boolean discardRows = false;
    CollectionDecision diagnostics = CollectionDecision.none();
    switch (input.getOutputMode()) {
      case EXPLAIN_ANALYZE_DEBUG:
        collectBundle = true;
        discardRows = true;
        break;
      case EXPLAIN_ANALYZE_PLAN:
      case EXPLAIN_ANALYZE_DISTSQL:
        discardRows = true;
        break;
      default:
        diagnostics = registry.shouldCollectDiagnostics(input.getFingerprint());
        collectBundle = diagnostics.isShouldCollect();
    }

    if (input.isAmbientVerbose()) {
      // Statistics end up in the ambient trace; no span of our own is needed.
      return new SamplingDecision(
          collectBundle, discardRows, true, StatsCollectionLevel.VERBOSE, diagnostics);
    }

    boolean collectExecStats = input.isCollectTxnExecStats();
    if (!collectExecStats && input.isSavePlanForStats()) {
      collectExecStats = draw();
    }

    if (!collectBundle && !input.isWithStatementTrace() && !input.getOutputMode().isAnalyze()) {
      StatsCollectionLevel level =
          collectExecStats ? StatsCollectionLevel.STRUCTURED : StatsCollectionLevel.NONE;
      return new SamplingDecision(false, discardRows, collectExecStats, level, diagnostics);
    }
    return new SamplingDecision(
        collectBundle, discardRows, true, StatsCollectionLevel.VERBOSE, diagnostics);
  }

  /** Draws whether a new transaction collects execution statistics for all its statements. */
  public boolean shouldSampleTransaction() {
    return draw();
  }

  private boolean draw() {
    double rate = settings.getTxnStatsSampleRate();
    if (rate == 0) {
      return false;
    }
    boolean sampled = random.getAsDouble() < rate;
    log.debug("sampling draw at rate {}: {}", rate, sampled);
    return sampled;
  }
}
