/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.diagnostics;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * In-memory {@link DiagnosticsRegistry}. Requests are keyed by fingerprint, at most one per
 * fingerprint. An unconditional request is handed to the first execution that asks for it and
 * becomes ongoing; a conditional request stays outstanding until an execution slow enough to
 * satisfy it completes.
 */
public class StatementDiagnosticsRegistry implements DiagnosticsRegistry {

  private static final Logger LOG = LogManager.getLogger();

  private final Clock clock;
  private final DoubleSupplier random;
  private final AtomicLong requestIds = new AtomicLong();
  private final AtomicLong diagnosticsIds = new AtomicLong();

  /** Guarded by {@code this}. */
  private final Map<RequestId, DiagnosticsRequest> requests = new HashMap<>();

  /** Guarded by {@code this}. */
  private final Map<RequestId, DiagnosticsRequest> ongoing = new HashMap<>();

  private final Map<Long, CompletedDiagnostics> completed = new ConcurrentHashMap<>();

  public StatementDiagnosticsRegistry() {
    this(Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
  }

  @VisibleForTesting
  public StatementDiagnosticsRegistry(Clock clock, DoubleSupplier random) {
    this.clock = clock;
    this.random = random;
  }

  /**
   * Registers a request for the fingerprint, replacing any earlier one.
   *
   * @param minExecutionLatency zero to capture the next execution
   * @param samplingProbability zero to capture every qualifying execution; requires a latency
   * @param expiresAfter zero for a request that never lapses
   */
  public synchronized RequestId insertRequest(
      String fingerprint,
      double samplingProbability,
      Duration minExecutionLatency,
      Duration expiresAfter) {
    Preconditions.checkArgument(
        samplingProbability >= 0 && samplingProbability <= 1,
        "sampling probability must be between 0 and 1 inclusive");
    Preconditions.checkArgument(
        samplingProbability == 0 || !minExecutionLatency.isZero(),
        "sampling probability only supported with a minimum execution latency");
    Preconditions.checkArgument(!expiresAfter.isNegative(), "expiration must not be negative");

    Instant expiresAt = expiresAfter.isZero() ? null : clock.instant().plus(expiresAfter);
    DiagnosticsRequest request =
        new DiagnosticsRequest(fingerprint, minExecutionLatency, samplingProbability, expiresAt);
    requests.values().removeIf(r -> r.getFingerprint().equals(fingerprint));
    RequestId id = new RequestId(requestIds.incrementAndGet());
    requests.put(id, request);
    LOG.info("statement diagnostics request {} inserted for {}", id, fingerprint);
    return id;
  }

  /** Cancels an outstanding request. Returns false if it was not outstanding. */
  public synchronized boolean cancelRequest(RequestId requestId) {
    return requests.remove(requestId) != null;
  }

  @Override
  public synchronized CollectionDecision shouldCollectDiagnostics(String fingerprint) {
    Instant now = clock.instant();
    Iterator<Map.Entry<RequestId, DiagnosticsRequest>> it = requests.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<RequestId, DiagnosticsRequest> entry = it.next();
      DiagnosticsRequest request = entry.getValue();
      if (!request.getFingerprint().equals(fingerprint)) {
        continue;
      }
      if (request.isExpired(now)) {
        it.remove();
        LOG.info("statement diagnostics request {} expired", entry.getKey());
        return CollectionDecision.none();
      }
      if (request.getSamplingProbability() > 0
          && random.getAsDouble() >= request.getSamplingProbability()) {
        return CollectionDecision.none();
      }
      if (!request.isConditional()) {
        it.remove();
        ongoing.put(entry.getKey(), request);
      }
      return new CollectionDecision(true, entry.getKey(), request);
    }
    return CollectionDecision.none();
  }

  @Override
  public boolean isExecLatencyConditionMet(
      RequestId requestId, DiagnosticsRequest request, Duration execLatency) {
    if (!requestId.isSet() || request == null) {
      return true;
    }
    return request.getMinExecutionLatency().compareTo(execLatency) <= 0;
  }

  @Override
  public long insertStatementDiagnostics(
      RequestId requestId,
      String fingerprint,
      String statement,
      DiagnosticsBundle bundle,
      String collectionError) {
    long id = diagnosticsIds.incrementAndGet();
    completed.put(
        id,
        new CompletedDiagnostics(
            id, fingerprint, statement, bundle, collectionError, clock.instant()));
    LOG.info("statement diagnostics {} collected for {} (request {})", id, fingerprint, requestId);
    return id;
  }

  @Override
  public synchronized void removeOngoing(RequestId requestId, DiagnosticsRequest request) {
    if (!requestId.isSet() || request == null) {
      return;
    }
    if (request.isConditional()) {
      requests.remove(requestId);
    } else {
      ongoing.remove(requestId);
    }
  }

  public Optional<CompletedDiagnostics> getCompleted(long diagnosticsId) {
    return Optional.ofNullable(completed.get(diagnosticsId));
  }

  public synchronized boolean isOutstanding(RequestId requestId) {
    return requests.containsKey(requestId);
  }

  public synchronized boolean isOngoing(RequestId requestId) {
    return ongoing.containsKey(requestId);
  }
}
