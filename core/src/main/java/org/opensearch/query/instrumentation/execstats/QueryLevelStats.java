/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Statement-wide execution statistics computed once from the full trace. Times are in nanoseconds,
 * sizes in bytes.
 */
@Data
@NoArgsConstructor
public class QueryLevelStats {
  private long networkBytesSent;
  private long maxMemUsage;
  private long maxDiskUsage;
  private long kvBytesRead;
  private long kvRowsRead;
  private long kvTime;
  private long networkMessages;
  private long contentionTime;

  /** Copy constructor. */
  public QueryLevelStats(QueryLevelStats other) {
    accumulate(other);
  }

  /**
   * Adds the statistics of another statement (or another part of this one) into this aggregate:
   * volumes and times are summed, peak memory and disk take the maximum.
   */
  public void accumulate(QueryLevelStats other) {
    networkBytesSent += other.networkBytesSent;
    maxMemUsage = Math.max(maxMemUsage, other.maxMemUsage);
    maxDiskUsage = Math.max(maxDiskUsage, other.maxDiskUsage);
    kvBytesRead += other.kvBytesRead;
    kvRowsRead += other.kvRowsRead;
    kvTime += other.kvTime;
    networkMessages += other.networkMessages;
    contentionTime += other.contentionTime;
  }
}
