/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.explain;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.query.common.setting.InstrumentationSettings;
import org.opensearch.query.common.setting.Settings;
import org.opensearch.query.instrumentation.diagnostics.DiagnosticsBundle;
import org.opensearch.query.instrumentation.exception.CommunicationException;
import org.opensearch.query.tracing.Recording;

/**
 * Writes the rows of EXPLAIN ANALYZE statements. Every row is a single string cell. Only failures
 * to deliver a row are thrown; anything that goes wrong before is rendered into the rows.
 */
@Log4j2
@RequiredArgsConstructor
public class ExplainResultWriter {

  public static final List<ResultColumn> EXPLAIN_PLAN_COLUMNS =
      List.of(new ResultColumn("info", "STRING"));

  private final InstrumentationSettings settings;

  /**
   * Writes the result of EXPLAIN ANALYZE (DEBUG): a link to the captured bundle, or the reason
   * there is none.
   *
   * @throws CommunicationException if a row could not be delivered
   */
  public void setExplainBundleResult(
      CommandResult res, Optional<DiagnosticsBundle> bundle, List<String> warnings) {
    res.resetStmtType("EXPLAIN ANALYZE (DEBUG)");
    res.setColumns(EXPLAIN_PLAN_COLUMNS);
    if (res.getErr().isPresent()) {
      return;
    }

    List<String> rows = new ArrayList<>();
    for (String warning : warnings) {
      rows.add("WARNING: " + warning);
    }
    if (!rows.isEmpty()) {
      rows.add("");
    }
    rows.addAll(bundleRows(bundle));
    addRows(res, rows);
  }

  /**
   * Writes the result of EXPLAIN ANALYZE: the annotated plan.
   *
   * @throws CommunicationException if a row could not be delivered
   */
  public void setExplainAnalyzeResult(CommandResult res, OutputBuilder ob) {
    res.resetStmtType("EXPLAIN ANALYZE");
    res.setColumns(EXPLAIN_PLAN_COLUMNS);
    if (res.getErr().isPresent()) {
      return;
    }
    addRows(res, ob.buildStringRows());
  }

  /**
   * Writes the result of EXPLAIN ANALYZE (DISTSQL): the annotated plan followed by one diagram link
   * per flow. A diagram that cannot be encoded is replaced by the error text.
   *
   * @throws CommunicationException if a row could not be delivered
   */
  public void setExplainAnalyzeDistSqlResult(
      CommandResult res, OutputBuilder ob, List<FlowInfo> flows, Recording trace) {
    res.resetStmtType("EXPLAIN ANALYZE (DISTSQL)");
    res.setColumns(EXPLAIN_PLAN_COLUMNS);
    if (res.getErr().isPresent()) {
      return;
    }

    List<String> rows = ob.buildStringRows();
    rows.add("");
    for (int i = 0; i < flows.size(); i++) {
      FlowInfo flow = flows.get(i);
      StringBuilder row = new StringBuilder();
      if (flows.size() > 1) {
        row.append(String.format("Diagram %d (%s): ", i + 1, flow.getType()));
      } else {
        row.append("Diagram: ");
      }
      row.append(diagramUrl(flow, trace));
      rows.add(row.toString());
    }
    addRows(res, rows);
  }

  private String diagramUrl(FlowInfo flow, Recording trace) {
    if (flow.getDiagram() == null) {
      return "diagram not available";
    }
    try {
      flow.getDiagram().addSpans(trace);
      return flow.getDiagram().toUrl();
    } catch (IOException e) {
      log.debug("unable to encode {} diagram", flow.getType(), e);
      return e.getMessage();
    }
  }

  private List<String> bundleRows(Optional<DiagnosticsBundle> bundle) {
    if (bundle.isEmpty()) {
      return List.of("Error generating bundle: bundle was not collected");
    }
    DiagnosticsBundle b = bundle.get();
    if (b.getCollectionError() != null) {
      return List.of("Error generating bundle: " + b.getCollectionError());
    }
    if (b.getInsertionError().isPresent()) {
      return List.of("Error recording bundle: " + b.getInsertionError().get().getMessage());
    }
    String base = settings.getSettingValue(Settings.Key.BUNDLE_URL_BASE);
    return List.of(
        "Statement diagnostics bundle generated. Download it from the direct link below.",
        "",
        "Direct link: " + base + "/" + b.getDiagnosticsId().orElseThrow());
  }

  private static void addRows(CommandResult res, List<String> rows) {
    for (String row : rows) {
      res.addRow(List.of(row));
    }
  }
}
