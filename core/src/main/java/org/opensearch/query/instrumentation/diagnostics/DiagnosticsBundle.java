/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.diagnostics;

import com.google.common.base.Preconditions;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import lombok.Getter;
import org.opensearch.query.instrumentation.exception.BundlePersistenceException;

/**
 * A zip archive of everything needed to debug one execution offline. The archive is fixed when
 * the bundle is built; the outcome of storing it is recorded once.
 */
public class DiagnosticsBundle {

  public static final String STATEMENT_FILE = "statement.txt";
  public static final String PLAN_FILE = "plan.txt";
  public static final String TRACE_JSON_FILE = "trace.json";
  public static final String TRACE_TEXT_FILE = "trace.txt";
  public static final String PLACEHOLDERS_FILE = "placeholders.txt";
  public static final String WARNINGS_FILE = "warnings.txt";

  private final byte[] zip;

  /** Why the archive could not be built, or null. */
  @Getter private final String collectionError;

  private boolean inserted;
  private long diagnosticsId;
  private BundlePersistenceException insertionError;

  private DiagnosticsBundle(byte[] zip, String collectionError) {
    this.zip = zip;
    this.collectionError = collectionError;
  }

  static DiagnosticsBundle of(byte[] zip) {
    return new DiagnosticsBundle(zip.clone(), null);
  }

  static DiagnosticsBundle failed(String collectionError) {
    return new DiagnosticsBundle(new byte[0], collectionError);
  }

  public byte[] getZip() {
    return zip.clone();
  }

  /** Reads the archive back as file name to UTF-8 contents, in archive order. */
  public Map<String, String> readFiles() throws IOException {
    Map<String, String> files = new LinkedHashMap<>();
    try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
      ZipEntry entry;
      while ((entry = in.getNextEntry()) != null) {
        files.put(entry.getName(), new String(in.readAllBytes(), StandardCharsets.UTF_8));
      }
    }
    return files;
  }

  void recordInsertion(long id) {
    Preconditions.checkState(!inserted, "bundle was already inserted");
    inserted = true;
    diagnosticsId = id;
  }

  void recordInsertionFailure(BundlePersistenceException error) {
    Preconditions.checkState(!inserted, "bundle was already inserted");
    inserted = true;
    insertionError = error;
  }

  /** Id assigned by the registry, if the bundle was stored. */
  public Optional<Long> getDiagnosticsId() {
    return inserted && insertionError == null ? Optional.of(diagnosticsId) : Optional.empty();
  }

  public Optional<BundlePersistenceException> getInsertionError() {
    return Optional.ofNullable(insertionError);
  }
}
