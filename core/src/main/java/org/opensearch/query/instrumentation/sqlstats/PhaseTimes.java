/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.sqlstats;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/** Timestamps, in nanoseconds, of the phases of one statement. */
public class PhaseTimes {

  private final Map<SessionPhase, Long> times = new EnumMap<>(SessionPhase.class);

  public void setPhaseTime(SessionPhase phase, long nanos) {
    times.put(phase, nanos);
  }

  public long getPhaseTime(SessionPhase phase) {
    return times.getOrDefault(phase, 0L);
  }

  public long getParsingLatency() {
    return between(SessionPhase.SESSION_START_PARSE, SessionPhase.SESSION_END_PARSE);
  }

  public long getPlanningLatency() {
    return between(SessionPhase.PLANNER_START_LOGICAL_PLAN, SessionPhase.PLANNER_END_LOGICAL_PLAN);
  }

  public long getRunLatency() {
    return between(SessionPhase.PLANNER_START_EXEC_STMT, SessionPhase.PLANNER_END_EXEC_STMT);
  }

  /**
   * Time the statement spent being parsed, planned and executed, excluding session overhead. Only
   * meaningful once execution ended.
   */
  public Duration getServiceLatencyNoOverhead() {
    long nanos =
        between(SessionPhase.PLANNER_START_LOGICAL_PLAN, SessionPhase.PLANNER_END_EXEC_STMT)
            + getParsingLatency();
    return Duration.ofNanos(nanos);
  }

  private long between(SessionPhase start, SessionPhase end) {
    Long startTime = times.get(start);
    Long endTime = times.get(end);
    if (startTime == null || endTime == null || endTime < startTime) {
      return 0;
    }
    return endTime - startTime;
  }
}
