/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.plan;

import com.google.common.base.Splitter;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import lombok.EqualsAndHashCode;

/**
 * Compact, lossy encoding of a plan's shape: the operators in pre-order with their child counts,
 * without attributes or literals. Two executions of a statement that picked the same plan shape
 * share a gist, so its hash is used in statement statistics keys.
 */
@EqualsAndHashCode
public final class PlanGist {

  private static final PlanGist EMPTY = new PlanGist("");
  private static final String SEPARATOR = ";";

  private final String encoded;

  private PlanGist(String encoded) {
    this.encoded = encoded;
  }

  public static PlanGist empty() {
    return EMPTY;
  }

  /** Wraps a previously encoded gist. */
  public static PlanGist of(String encoded) {
    return new PlanGist(encoded);
  }

  /** Computes the gist of a plan, covering the main query, subqueries and checks. */
  public static PlanGist fromPlan(ExplainPlan plan) {
    List<String> shape = new ArrayList<>();
    appendShape(plan, plan.getRoot(), shape);
    for (PlanNode subquery : plan.getSubqueryRoots()) {
      appendShape(plan, subquery, shape);
    }
    for (PlanNode check : plan.getCheckRoots()) {
      appendShape(plan, check, shape);
    }
    byte[] bytes = String.join(SEPARATOR, shape).getBytes(StandardCharsets.UTF_8);
    return new PlanGist(Base64.getEncoder().withoutPadding().encodeToString(bytes));
  }

  /** Returns the operators in pre-order as {@code name(childCount)}. */
  public List<String> decode() {
    if (encoded.isEmpty()) {
      return List.of();
    }
    String shape = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
    return Splitter.on(SEPARATOR).splitToList(shape);
  }

  /** Stable 64-bit hash of the gist; zero for the empty gist. */
  public long hash() {
    if (encoded.isEmpty()) {
      return 0;
    }
    return Hashing.farmHashFingerprint64().hashString(encoded, StandardCharsets.UTF_8).asLong();
  }

  @Override
  public String toString() {
    return encoded;
  }

  private static void appendShape(ExplainPlan plan, PlanNode node, List<String> shape) {
    shape.add(node.getOperator() + "(" + node.getChildCount() + ")");
    for (PlanNode child : plan.getChildren(node)) {
      appendShape(plan, child, shape);
    }
  }
}
