/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.explain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import lombok.Data;
import lombok.Getter;
import org.opensearch.query.common.setting.InstrumentationSettings;
import org.opensearch.query.common.setting.Settings;
import org.opensearch.query.common.utils.HumanizeUtils;
import org.opensearch.query.instrumentation.execstats.ComponentId;
import org.opensearch.query.instrumentation.execstats.ComponentStats;
import org.opensearch.query.instrumentation.execstats.ComponentStatsExtractor;
import org.opensearch.query.tracing.Recording;

/**
 * Diagram of the processors and streams of a distributed plan. The diagram is serialized to JSON,
 * deflated and base64url-encoded into the fragment of a viewer URL.
 */
public class DistSqlDiagram implements FlowDiagram {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String urlBase;
  private final boolean makeDeterministic;

  @Getter private final List<Processor> processors = new ArrayList<>();
  @Getter private final List<Edge> edges = new ArrayList<>();

  /**
   * @param urlBase viewer location, without a trailing slash
   * @param makeDeterministic render statistics that do not vary between runs
   */
  public DistSqlDiagram(String urlBase, boolean makeDeterministic) {
    this.urlBase = urlBase;
    this.makeDeterministic = makeDeterministic;
  }

  /** A diagram linking to the configured viewer, deterministic if explain output is. */
  public static DistSqlDiagram create(InstrumentationSettings settings) {
    return new DistSqlDiagram(
        settings.getSettingValue(Settings.Key.DIAGRAM_URL_BASE), settings.isDeterministicExplain());
  }

  /** Adds a processor of flow {@code flowId} running on node {@code nodeId}. */
  public DistSqlDiagram addProcessor(String flowId, int nodeId, int processorId, String title) {
    processors.add(new Processor(flowId, nodeId, processorId, title));
    return this;
  }

  /** Adds a stream from one processor to another. */
  public DistSqlDiagram addEdge(
      String flowId, int sourceProcessor, int destProcessor, int streamId) {
    edges.add(new Edge(flowId, sourceProcessor, destProcessor, streamId));
    return this;
  }

  @Override
  public void addSpans(Recording trace) {
    Map<ComponentId, ComponentStats> statsMap =
        ComponentStatsExtractor.extractStatsFromSpans(trace, makeDeterministic);
    for (Processor processor : processors) {
      ComponentStats stats =
          statsMap.get(
              ComponentId.processor(processor.flowId, processor.processorId, processor.nodeId));
      if (stats != null) {
        processor.getDetails().addAll(describe(stats));
      }
    }
    for (Edge edge : edges) {
      for (Map.Entry<ComponentId, ComponentStats> entry : statsMap.entrySet()) {
        ComponentId component = entry.getKey();
        if (component.getType() == ComponentId.Type.STREAM
            && component.getId() == edge.streamId
            && component.getFlowId().equals(edge.flowId)) {
          edge.getStats().addAll(describe(entry.getValue()));
        }
      }
    }
  }

  @Override
  public String toUrl() throws IOException {
    byte[] json = MAPPER.writeValueAsBytes(new Diagram(nodeNames(), processors, edges));
    ByteArrayOutputStream compressed = new ByteArrayOutputStream();
    try (DeflaterOutputStream out =
        new DeflaterOutputStream(compressed, new Deflater(Deflater.BEST_COMPRESSION))) {
      out.write(json);
    }
    return urlBase
        + "/decode.html#"
        + Base64.getUrlEncoder().withoutPadding().encodeToString(compressed.toByteArray());
  }

  private List<String> nodeNames() {
    TreeSet<Integer> nodes = new TreeSet<>();
    processors.forEach(p -> nodes.add(p.nodeId));
    List<String> names = new ArrayList<>();
    nodes.forEach(n -> names.add("n" + n));
    return names;
  }

  private static List<String> describe(ComponentStats stats) {
    List<String> lines = new ArrayList<>();
    if (stats.getOutput().getNumTuples().isSet()) {
      lines.add("rows output: " + HumanizeUtils.count(stats.getOutput().getNumTuples().getValue()));
    }
    if (stats.getKv().getTuplesRead().isSet()) {
      lines.add("KV rows read: " + HumanizeUtils.count(stats.getKv().getTuplesRead().getValue()));
    }
    if (stats.getKv().getBytesRead().isSet()) {
      lines.add("KV bytes read: " + HumanizeUtils.bytes(stats.getKv().getBytesRead().getValue()));
    }
    if (stats.getExec().getExecTime().isSet()) {
      lines.add(
          "execution time: " + HumanizeUtils.duration(stats.getExec().getExecTime().getValue()));
    }
    if (stats.getExec().getMaxAllocatedMem().isSet()) {
      lines.add(
          "max memory allocated: "
              + HumanizeUtils.bytes(stats.getExec().getMaxAllocatedMem().getValue()));
    }
    if (stats.getNetRx().getTuplesReceived().isSet()) {
      lines.add(
          "network rows received: "
              + HumanizeUtils.count(stats.getNetRx().getTuplesReceived().getValue()));
    }
    if (stats.getNetTx().getTuplesSent().isSet()) {
      lines.add(
          "network rows sent: " + HumanizeUtils.count(stats.getNetTx().getTuplesSent().getValue()));
    }
    return lines;
  }

  /** A processor box. */
  @Data
  public static class Processor {
    @JsonIgnore private final String flowId;
    private final int nodeId;
    private final int processorId;
    private final String title;
    private final List<String> details = new ArrayList<>();
  }

  /** An arrow between two processors. */
  @Data
  public static class Edge {
    @JsonIgnore private final String flowId;
    private final int sourceProcessor;
    private final int destProcessor;
    private final int streamId;
    private final List<String> stats = new ArrayList<>();
  }

  /** The serialized form. */
  @Data
  public static class Diagram {
    private final List<String> nodeNames;
    private final List<Processor> processors;
    private final List<Edge> edges;
  }
}
