/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.diagnostics;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.query.instrumentation.exception.BundlePersistenceException;
import org.opensearch.query.tracing.StructuredPayloads;

/** Captures diagnostics bundles and hands them to the {@link DiagnosticsRegistry}. */
@Log4j2
@RequiredArgsConstructor
public class BundleBuilder {

  private final DiagnosticsRegistry registry;

  /**
   * Builds and stores a bundle if the execution was slow enough for the request, then marks the
   * request as satisfied. The contents are only computed once the latency check passes. A storage
   * failure is recorded on the returned bundle and never thrown.
   *
   * @return the bundle, or empty if the execution did not meet the latency threshold
   */
  public Optional<DiagnosticsBundle> buildAndInsert(
      RequestId requestId,
      DiagnosticsRequest request,
      Duration serviceLatency,
      String fingerprint,
      Supplier<BundleContents> contents) {
    if (!registry.isExecLatencyConditionMet(requestId, request, serviceLatency)) {
      log.debug(
          "execution of {} took {}, below the threshold of request {}",
          fingerprint,
          serviceLatency,
          requestId);
      return Optional.empty();
    }
    BundleContents bundleContents = contents.get();
    DiagnosticsBundle bundle = build(bundleContents);
    insert(bundle, requestId, fingerprint, bundleContents.getStatement());
    registry.removeOngoing(requestId, request);
    return Optional.of(bundle);
  }

  /** Assembles the bundle archive. A failure yields a bundle carrying the error instead. */
  public DiagnosticsBundle build(BundleContents contents) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.UTF_8)) {
      addFile(zip, DiagnosticsBundle.STATEMENT_FILE, contents.getStatement());
      addFile(zip, DiagnosticsBundle.PLAN_FILE, contents.getPlanText());
      addFile(
          zip, DiagnosticsBundle.TRACE_JSON_FILE, StructuredPayloads.toJson(contents.getTrace()));
      addFile(zip, DiagnosticsBundle.TRACE_TEXT_FILE, contents.getTrace().toVerboseString());
      addFile(zip, DiagnosticsBundle.PLACEHOLDERS_FILE, contents.getPlaceholders().render());
      if (!contents.getWarnings().isEmpty()) {
        addFile(
            zip, DiagnosticsBundle.WARNINGS_FILE, String.join("\n", contents.getWarnings()) + "\n");
      }
    } catch (IOException | IllegalStateException e) {
      log.warn("unable to build diagnostics bundle", e);
      return DiagnosticsBundle.failed(e.getMessage());
    }
    return DiagnosticsBundle.of(out.toByteArray());
  }

  private void insert(
      DiagnosticsBundle bundle, RequestId requestId, String fingerprint, String statement) {
    try {
      long id =
          registry.insertStatementDiagnostics(
              requestId, fingerprint, statement, bundle, bundle.getCollectionError());
      bundle.recordInsertion(id);
    } catch (BundlePersistenceException e) {
      log.warn("unable to store diagnostics bundle for {}", fingerprint, e);
      bundle.recordInsertionFailure(e);
    }
  }

  private static void addFile(ZipOutputStream zip, String name, String contents)
      throws IOException {
    zip.putNextEntry(new ZipEntry(name));
    zip.write(contents.getBytes(StandardCharsets.UTF_8));
    zip.closeEntry();
  }
}
