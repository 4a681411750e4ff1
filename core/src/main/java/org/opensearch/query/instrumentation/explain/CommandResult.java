/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.explain;

import java.util.List;
import java.util.Optional;
import org.opensearch.query.instrumentation.exception.CommunicationException;

/** Sink for the rows a statement returns to the client. */
public interface CommandResult {

  /** Replaces the statement type reported to the client. */
  void resetStmtType(String statementType);

  void setColumns(List<ResultColumn> columns);

  /** The error already set on this result, if any. Rows cannot be added once one is set. */
  Optional<Exception> getErr();

  /**
   * Sends one row.
   *
   * @throws CommunicationException if the row could not be delivered
   */
  void addRow(List<String> row);
}
