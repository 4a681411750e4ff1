/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Execution statistics reported by one component. Workers record these as structured payloads on
 * their trace spans; the coordinator reads them back out of the statement's recording.
 *
 * <p>Times are in nanoseconds, sizes in bytes.
 */
@Data
@NoArgsConstructor
public class ComponentStats {

  private ComponentId component;
  private NetworkRxStats netRx = new NetworkRxStats();
  private NetworkTxStats netTx = new NetworkTxStats();
  private KvStats kv = new KvStats();
  private ExecStats exec = new ExecStats();
  private OutputStats output = new OutputStats();
  private FlowStats flowStats = new FlowStats();

  public ComponentStats(ComponentId component) {
    this.component = component;
  }

  /** Fills every statistic unset here with the value from {@code other}. */
  public void union(ComponentStats other) {
    netRx.union(other.netRx);
    netTx.union(other.netTx);
    kv.union(other.kv);
    exec.union(other.exec);
    output.union(other.output);
    flowStats.union(other.flowStats);
  }

  /**
   * Overwrites statistics that depend on wall-clock time, memory accounting or wire encoding with
   * fixed values, so that rendered output is reproducible.
   */
  public void makeDeterministic() {
    netRx.latency.resetTo(0);
    netRx.waitTime.resetTo(0);
    netRx.deserializationTime.resetTo(0);
    netRx.bytesReceived.resetTo(8 * netRx.tuplesReceived.orZero());
    netTx.bytesSent.resetTo(8 * netTx.tuplesSent.orZero());
    kv.kvTime.resetTo(0);
    kv.contentionTime.resetTo(0);
    kv.bytesRead.resetTo(8 * kv.tuplesRead.orZero());
    exec.execTime.resetTo(0);
    exec.maxAllocatedMem.resetTo(0);
    exec.maxAllocatedDisk.resetTo(0);
    flowStats.maxMemUsage.resetTo(0);
    flowStats.maxDiskUsage.resetTo(0);
  }

  /** Statistics of an inbound stream. */
  @Data
  @NoArgsConstructor
  public static class NetworkRxStats {
    private StatValue latency = new StatValue();
    private StatValue waitTime = new StatValue();
    private StatValue deserializationTime = new StatValue();
    private StatValue tuplesReceived = new StatValue();
    private StatValue bytesReceived = new StatValue();
    private StatValue messagesReceived = new StatValue();

    void union(NetworkRxStats other) {
      latency.maybeFill(other.latency);
      waitTime.maybeFill(other.waitTime);
      deserializationTime.maybeFill(other.deserializationTime);
      tuplesReceived.maybeFill(other.tuplesReceived);
      bytesReceived.maybeFill(other.bytesReceived);
      messagesReceived.maybeFill(other.messagesReceived);
    }
  }

  /** Statistics of an outbound stream. */
  @Data
  @NoArgsConstructor
  public static class NetworkTxStats {
    private StatValue tuplesSent = new StatValue();
    private StatValue bytesSent = new StatValue();
    private StatValue messagesSent = new StatValue();

    void union(NetworkTxStats other) {
      tuplesSent.maybeFill(other.tuplesSent);
      bytesSent.maybeFill(other.bytesSent);
      messagesSent.maybeFill(other.messagesSent);
    }
  }

  /** Statistics of reads from the key-value layer. */
  @Data
  @NoArgsConstructor
  public static class KvStats {
    private StatValue kvTime = new StatValue();
    private StatValue contentionTime = new StatValue();
    private StatValue bytesRead = new StatValue();
    private StatValue tuplesRead = new StatValue();
    private StatValue numInterfaceSteps = new StatValue();
    private StatValue numInternalSteps = new StatValue();
    private StatValue numInterfaceSeeks = new StatValue();
    private StatValue numInternalSeeks = new StatValue();

    void union(KvStats other) {
      kvTime.maybeFill(other.kvTime);
      contentionTime.maybeFill(other.contentionTime);
      bytesRead.maybeFill(other.bytesRead);
      tuplesRead.maybeFill(other.tuplesRead);
      numInterfaceSteps.maybeFill(other.numInterfaceSteps);
      numInternalSteps.maybeFill(other.numInternalSteps);
      numInterfaceSeeks.maybeFill(other.numInterfaceSeeks);
      numInternalSeeks.maybeFill(other.numInternalSeeks);
    }
  }

  /** Resource usage of a processor. */
  @Data
  @NoArgsConstructor
  public static class ExecStats {
    private StatValue execTime = new StatValue();
    private StatValue maxAllocatedMem = new StatValue();
    private StatValue maxAllocatedDisk = new StatValue();

    void union(ExecStats other) {
      execTime.maybeFill(other.execTime);
      maxAllocatedMem.maybeFill(other.maxAllocatedMem);
      maxAllocatedDisk.maybeFill(other.maxAllocatedDisk);
    }
  }

  /** Output of a processor. */
  @Data
  @NoArgsConstructor
  public static class OutputStats {
    private StatValue numBatches = new StatValue();
    private StatValue numTuples = new StatValue();

    void union(OutputStats other) {
      numBatches.maybeFill(other.numBatches);
      numTuples.maybeFill(other.numTuples);
    }
  }

  /** Resource usage of a whole flow on one node. */
  @Data
  @NoArgsConstructor
  public static class FlowStats {
    private StatValue maxMemUsage = new StatValue();
    private StatValue maxDiskUsage = new StatValue();

    void union(FlowStats other) {
      maxMemUsage.maybeFill(other.maxMemUsage);
      maxDiskUsage.maybeFill(other.maxDiskUsage);
    }
  }
}
