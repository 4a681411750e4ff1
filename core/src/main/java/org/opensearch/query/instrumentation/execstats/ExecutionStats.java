/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Execution statistics attributed to one plan node, merged from every component that implements
 * the node. Counters and volumes are summed across components; peak memory and disk take the
 * maximum.
 */
@Data
@NoArgsConstructor
public class ExecutionStats {

  private StatValue rowCount = new StatValue();
  private StatValue vectorizedBatchCount = new StatValue();
  private StatValue kvTime = new StatValue();
  private StatValue kvContentionTime = new StatValue();
  private StatValue kvBytesRead = new StatValue();
  private StatValue kvRowsRead = new StatValue();
  private StatValue stepCount = new StatValue();
  private StatValue internalStepCount = new StatValue();
  private StatValue seekCount = new StatValue();
  private StatValue internalSeekCount = new StatValue();
  private StatValue maxAllocatedMem = new StatValue();
  private StatValue maxAllocatedDisk = new StatValue();

  /** Nodes the plan node ran on, as {@code n<id>}, sorted by id. */
  private List<String> nodes = new ArrayList<>();

  /** Regions the plan node ran in, sorted. */
  private List<String> regions = new ArrayList<>();

  /** Folds the statistics of one contributing component into this aggregate. */
  public void merge(ComponentStats stats) {
    rowCount.maybeAdd(stats.getOutput().getNumTuples());
    vectorizedBatchCount.maybeAdd(stats.getOutput().getNumBatches());
    kvTime.maybeAdd(stats.getKv().getKvTime());
    kvContentionTime.maybeAdd(stats.getKv().getContentionTime());
    kvBytesRead.maybeAdd(stats.getKv().getBytesRead());
    kvRowsRead.maybeAdd(stats.getKv().getTuplesRead());
    stepCount.maybeAdd(stats.getKv().getNumInterfaceSteps());
    internalStepCount.maybeAdd(stats.getKv().getNumInternalSteps());
    seekCount.maybeAdd(stats.getKv().getNumInterfaceSeeks());
    internalSeekCount.maybeAdd(stats.getKv().getNumInternalSeeks());
    maxAllocatedMem.maybeMax(stats.getExec().getMaxAllocatedMem());
    maxAllocatedDisk.maybeMax(stats.getExec().getMaxAllocatedDisk());
  }
}
