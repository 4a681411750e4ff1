/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.query.instrumentation.diagnostics.BundleBuilder;
import org.opensearch.query.instrumentation.diagnostics.BundleContents;
import org.opensearch.query.instrumentation.diagnostics.CollectionDecision;
import org.opensearch.query.instrumentation.diagnostics.DiagnosticsBundle;
import org.opensearch.query.instrumentation.exception.CommunicationException;
import org.opensearch.query.instrumentation.exception.InstrumentationAssertionException;
import org.opensearch.query.instrumentation.exception.InstrumentationException;
import org.opensearch.query.instrumentation.exception.TraceExtractionException;
import org.opensearch.query.instrumentation.execstats.ComponentId;
import org.opensearch.query.instrumentation.execstats.ExecNodeTraceMetadata;
import org.opensearch.query.instrumentation.execstats.FlowsMetadata;
import org.opensearch.query.instrumentation.execstats.QueryLevelStats;
import org.opensearch.query.instrumentation.execstats.StatsAggregator;
import org.opensearch.query.instrumentation.execstats.TraceAnalyzer;
import org.opensearch.query.instrumentation.explain.CommandResult;
import org.opensearch.query.instrumentation.explain.ExplainResultWriter;
import org.opensearch.query.instrumentation.explain.FlowInfo;
import org.opensearch.query.instrumentation.explain.OutputBuilder;
import org.opensearch.query.instrumentation.plan.ExplainFlags;
import org.opensearch.query.instrumentation.plan.ExplainPlan;
import org.opensearch.query.instrumentation.plan.ExplainTreePlanNode;
import org.opensearch.query.instrumentation.plan.PlanDistribution;
import org.opensearch.query.instrumentation.plan.PlanEstimates;
import org.opensearch.query.instrumentation.plan.PlanGist;
import org.opensearch.query.instrumentation.sampling.SamplingDecision;
import org.opensearch.query.instrumentation.sampling.SamplingInput;
import org.opensearch.query.instrumentation.sampling.StatsCollectionLevel;
import org.opensearch.query.instrumentation.sqlstats.PhaseTimes;
import org.opensearch.query.instrumentation.sqlstats.StatementStatisticsKey;
import org.opensearch.query.instrumentation.sqlstats.StatsCollector;
import org.opensearch.query.instrumentation.tracing.OpenedSpan;
import org.opensearch.query.instrumentation.tracing.StatementSpan;
import org.opensearch.query.instrumentation.tracing.TraceSpanManager;
import org.opensearch.query.tracing.Recording;
import org.opensearch.query.tracing.Span;
import org.opensearch.query.tracing.TraceContext;

/**
 * Instruments the execution of one statement: decides what to collect, owns the statement's trace
 * span, and after execution records statistics, captures diagnostics bundles and produces EXPLAIN
 * ANALYZE output.
 *
 * <p>Lifecycle, on one thread:
 *
 * <ol>
 *   <li>{@link #setOutputMode} for EXPLAIN ANALYZE variants, before setup.
 *   <li>{@link #setup} once, before execution.
 *   <li>The {@code should*} and {@code record*} methods, any number of times during planning and
 *       execution.
 *   <li>{@link #finish} once on every exit path if setup reported that it is needed.
 * </ol>
 */
@Log4j2
public class InstrumentationController {

  private enum State {
    IDLE,
    CONFIGURED,
    ARMED,
    FINISHED
  }

  private final InstrumentationConfig config;
  private final TraceSpanManager spanManager;
  private final StatsAggregator statsAggregator;
  private final BundleBuilder bundleBuilder;
  private final ExplainResultWriter resultWriter;

  private State state = State.IDLE;

  @Getter private OutputMode outputMode = OutputMode.UNMODIFIED;
  private ExplainFlags explainFlags = ExplainFlags.defaults();

  private String fingerprint;
  private boolean implicitTxn;
  private String database;
  private StatsCollector statsCollector;

  private boolean collectBundle;
  private boolean collectExecStats;
  private boolean discardRows;
  private boolean savePlanForStats;
  private CollectionDecision diagnostics = CollectionDecision.none();
  private BiConsumer<Recording, String> withStatementTrace;

  private StatementSpan statementSpan = StatementSpan.none();

  private ExplainPlan explainPlan;
  private PlanDistribution distribution = PlanDistribution.LOCAL;
  private boolean vectorized;
  private ExecNodeTraceMetadata traceMetadata;

  /** Regions the statement ran in; only computed when an explain plan was recorded. */
  @Getter private List<String> regions = List.of();

  @Getter private PlanGist planGist = PlanGist.empty();
  @Getter private PlanEstimates planEstimates;

  public InstrumentationController(InstrumentationConfig config) {
    this.config = config;
    this.spanManager = new TraceSpanManager(config.getTracer(), config.getSettings());
    this.statsAggregator = new StatsAggregator(config.getLocalityResolver());
    this.bundleBuilder = new BundleBuilder(config.getDiagnosticsRegistry());
    this.resultWriter = new ExplainResultWriter(config.getSettings());
  }

  /** Selects an EXPLAIN ANALYZE variant. Must be called before {@link #setup}. */
  public void setOutputMode(OutputMode outputMode, ExplainFlags explainFlags) {
    Preconditions.checkState(
        state == State.IDLE || state == State.CONFIGURED,
        "output mode must be set before setup");
    this.outputMode = Preconditions.checkNotNull(outputMode, "output mode");
    this.explainFlags = Preconditions.checkNotNull(explainFlags, "explain flags");
    state = State.CONFIGURED;
  }

  /**
   * Decides what the statement collects and opens its span.
   *
   * @param ctx the caller's trace context
   * @param collectTxnExecStats the transaction collects execution statistics for all statements
   * @return the context to execute in, and whether {@link #finish} must be called
   * @throws InstrumentationAssertionException if {@code ctx} has no span and assertions are strict
   */
  public SetupResult setup(
      TraceContext ctx,
      StatsCollector statsCollector,
      String database,
      String fingerprint,
      boolean implicitTxn,
      boolean collectTxnExecStats) {
    Preconditions.checkState(
        state == State.IDLE || state == State.CONFIGURED, "setup was already called");
    state = State.ARMED;
    this.statsCollector = statsCollector;
    this.database = database;
    this.fingerprint = fingerprint;
    this.implicitTxn = implicitTxn;
    this.withStatementTrace = config.getTestingKnobs().getWithStatementTrace();
    this.savePlanForStats =
        statsCollector.shouldSaveLogicalPlanDesc(fingerprint, implicitTxn, database);

    boolean ambientVerbose =
        config.getTracer().spanFromContext(ctx).map(Span::isVerbose).orElse(false);
    SamplingDecision decision =
        config
            .getSamplingPolicy()
            .decide(
                new SamplingInput(
                    fingerprint,
                    outputMode,
                    ambientVerbose,
                    collectTxnExecStats,
                    savePlanForStats,
                    withStatementTrace != null));
    collectBundle = decision.isCollectBundle();
    discardRows = decision.isDiscardRows();
    collectExecStats = decision.isCollectExecStats();
    diagnostics = decision.getDiagnostics();

    if (shouldBuildExplainPlan() || decision.getLevel() == StatsCollectionLevel.VERBOSE) {
      traceMetadata = new ExecNodeTraceMetadata();
    }

    OpenedSpan opened = spanManager.open(ctx, decision.getLevel());
    statementSpan = opened.getSpan();
    return new SetupResult(opened.getContext(), statementSpan.needsFinish());
  }

  /**
   * Terminates the statement's span and processes what it recorded: records query-level
   * statistics, captures a diagnostics bundle, and writes EXPLAIN ANALYZE rows. When {@code
   * retErr} is set the bookkeeping still happens but no rows are written.
   *
   * @param txnStats transaction-wide statistics, accumulated into when the transaction collects
   *     execution statistics or the statement runs in an implicit transaction
   * @param retErr the error the statement already failed with, or null
   * @throws CommunicationException if an output row could not be delivered
   */
  public void finish(
      QueryLevelStats txnStats,
      boolean collectTxnExecStats,
      StatementPlan plan,
      String stmtRawSql,
      CommandResult res,
      Exception retErr) {
    Preconditions.checkState(state != State.FINISHED, "finish was already called");
    Preconditions.checkState(state == State.ARMED, "finish called before setup");
    state = State.FINISHED;
    if (!statementSpan.needsFinish()) {
      return;
    }

    Recording trace = spanManager.finish(statementSpan).orElse(Recording.empty());
    if (withStatementTrace != null) {
      withStatementTrace.accept(trace, stmtRawSql);
    }

    boolean deterministic = config.getSettings().isDeterministicExplain();
    if (explainPlan != null && traceMetadata != null) {
      regions = statsAggregator.annotateExplain(explainPlan, traceMetadata, trace, deterministic);
    }

    QueryLevelStats queryLevelStats =
        queryLevelStats(trace, deterministic, plan.getFlowInfos(), retErr)
            .map(
                stats -> {
                  recordStatementExecStats(stats, retErr != null);
                  if (collectTxnExecStats || implicitTxn) {
                    txnStats.accumulate(stats);
                  }
                  return stats;
                })
            .orElseGet(QueryLevelStats::new);

    Optional<DiagnosticsBundle> bundle = Optional.empty();
    List<String> warnings = new ArrayList<>();
    if (collectBundle) {
      PhaseTimes phaseTimes = statsCollector.getPhaseTimes();
      bundle =
          bundleBuilder.buildAndInsert(
              diagnostics.getRequestId(),
              diagnostics.getRequest(),
              phaseTimes.getServiceLatencyNoOverhead(),
              fingerprint,
              () -> {
                OutputBuilder ob =
                    emitExplainAnalyzePlan(ExplainFlags.forBundle(), phaseTimes, queryLevelStats);
                warnings.addAll(ob.getWarnings());
                return new BundleContents(
                    plan.getStatement(),
                    ob.buildString(),
                    trace,
                    plan.getPlaceholders(),
                    ob.getWarnings());
              });
    }

    // The statement already failed; its error takes precedence over any output.
    if (retErr != null) {
      return;
    }

    switch (outputMode) {
      case EXPLAIN_ANALYZE_DEBUG:
        resultWriter.setExplainBundleResult(res, bundle, warnings);
        break;
      case EXPLAIN_ANALYZE_PLAN:
        resultWriter.setExplainAnalyzeResult(
            res,
            emitExplainAnalyzePlan(explainFlags, statsCollector.getPhaseTimes(), queryLevelStats));
        break;
      case EXPLAIN_ANALYZE_DISTSQL:
        resultWriter.setExplainAnalyzeDistSqlResult(
            res,
            emitExplainAnalyzePlan(explainFlags, statsCollector.getPhaseTimes(), queryLevelStats),
            plan.getFlowInfos(),
            trace);
        break;
      default:
        break;
    }
  }

  /** Discards the statement's rows, as for EXECUTE ... DISCARD ROWS. */
  public void setDiscardRows() {
    discardRows = true;
  }

  /** True for EXPLAIN ANALYZE variants or after {@link #setDiscardRows()}. */
  public boolean shouldDiscardRows() {
    return discardRows;
  }

  /** True if the physical flows must be kept, for diagrams or query-level statistics. */
  public boolean shouldSaveFlows() {
    return collectBundle || outputMode == OutputMode.EXPLAIN_ANALYZE_DISTSQL || collectExecStats;
  }

  /** True if saved flows must also carry diagrams. */
  public boolean shouldSaveDiagrams() {
    return collectBundle || outputMode != OutputMode.UNMODIFIED;
  }

  /**
   * True if statements with side effects, like CREATE STATISTICS, should run as background jobs.
   * Under EXPLAIN ANALYZE they run inline so their execution can be observed.
   */
  public boolean shouldUseJobForCreateStats() {
    return outputMode == OutputMode.UNMODIFIED;
  }

  /** True if the engine should build an explain plan and pass it to {@link #recordExplainPlan}. */
  public boolean shouldBuildExplainPlan() {
    return collectBundle
        || savePlanForStats
        || outputMode == OutputMode.EXPLAIN_ANALYZE_PLAN
        || outputMode == OutputMode.EXPLAIN_ANALYZE_DISTSQL;
  }

  public boolean shouldSaveMemo() {
    return shouldBuildExplainPlan();
  }

  public boolean shouldCollectExecStats() {
    return collectExecStats;
  }

  public void recordExplainPlan(ExplainPlan explainPlan) {
    this.explainPlan = explainPlan;
  }

  public void recordPlanInfo(PlanDistribution distribution, boolean vectorized) {
    this.distribution = distribution;
    this.vectorized = vectorized;
  }

  public void recordPlanGist(PlanGist planGist) {
    this.planGist = planGist;
  }

  public void recordPlanEstimates(PlanEstimates planEstimates) {
    this.planEstimates = planEstimates;
  }

  /**
   * Records which execution components implement a plan node. Ignored unless an explain plan is
   * being built.
   */
  public void associateNodeWithComponents(int nodeIndex, List<ComponentId> components) {
    if (traceMetadata != null) {
      traceMetadata.associateNodeWithComponents(nodeIndex, components);
    }
  }

  /**
   * Returns the recorded plan as a tree with literal values hidden, to be saved with the
   * statement's statistics. Call after {@link #recordExplainPlan} and {@link #recordPlanInfo}.
   */
  public Optional<ExplainTreePlanNode> planForStats() {
    if (explainPlan == null) {
      return Optional.empty();
    }
    OutputBuilder ob = new OutputBuilder(ExplainFlags.forStats());
    ob.addDistribution(distribution.toString());
    ob.addVectorized(vectorized);
    ob.setPlan(explainPlan);
    return Optional.ofNullable(ob.buildTree());
  }

  /**
   * Analyzes the trace, or returns empty if it can't be read. Strict assertions escalate the
   * failure unless the statement already failed, whose error must reach the client instead.
   */
  private Optional<QueryLevelStats> queryLevelStats(
      Recording trace, boolean deterministic, List<FlowInfo> flowInfos, Exception retErr) {
    List<FlowsMetadata> flowsMetadata = new ArrayList<>();
    for (FlowInfo flowInfo : flowInfos) {
      flowsMetadata.add(flowInfo.getFlowsMetadata());
    }
    try {
      return Optional.of(TraceAnalyzer.getQueryLevelStats(trace, deterministic, flowsMetadata));
    } catch (TraceExtractionException e) {
      String message = "error getting query level stats for statement " + fingerprint;
      if (config.getSettings().isStrictAssertions() && retErr == null) {
        throw new InstrumentationAssertionException(message + ": " + e.getMessage());
      }
      log.debug("{}", message, e);
      return Optional.empty();
    }
  }

  private void recordStatementExecStats(QueryLevelStats stats, boolean failed) {
    StatementStatisticsKey key =
        new StatementStatisticsKey(fingerprint, implicitTxn, database, failed, planGist.hash());
    try {
      statsCollector.recordStatementExecStats(key, stats);
    } catch (InstrumentationException e) {
      log.warn("unable to record statement exec stats: {}", e.getMessage());
    }
  }

  private OutputBuilder emitExplainAnalyzePlan(
      ExplainFlags flags, PhaseTimes phaseTimes, QueryLevelStats queryStats) {
    boolean deterministic = config.getSettings().isDeterministicExplain();
    OutputBuilder ob = new OutputBuilder(deterministic ? flags.deflaked() : flags);
    if (explainPlan == null) {
      return ob;
    }
    ob.addDistribution(distribution.toString());
    ob.addVectorized(vectorized);
    ob.addPlanningTime(phaseTimes.getPlanningLatency());
    ob.addExecutionTime(phaseTimes.getRunLatency());
    if (queryStats.getKvRowsRead() != 0) {
      ob.addKvReadStats(queryStats.getKvRowsRead(), queryStats.getKvBytesRead());
    }
    if (queryStats.getKvTime() != 0) {
      ob.addKvTime(queryStats.getKvTime());
    }
    if (queryStats.getContentionTime() != 0) {
      ob.addContentionTime(queryStats.getContentionTime());
    }
    ob.addMaxMemUsage(queryStats.getMaxMemUsage());
    ob.addNetworkStats(queryStats.getNetworkMessages(), queryStats.getNetworkBytesSent());
    ob.addMaxDiskUsage(queryStats.getMaxDiskUsage());
    if (!regions.isEmpty()) {
      ob.addRegionsStats(regions);
    }
    if (planEstimates != null) {
      if (!planEstimates.isStatsAvailable()) {
        ob.addWarning("table statistics are not available for this plan");
      }
      ob.addIndexRecommendations(planEstimates.getIndexRecommendations());
    }
    ob.setPlan(explainPlan);
    return ob;
  }
}
