/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Process-wide configuration read by the statement instrumentation. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Probability that a transaction collects execution statistics. */
    TXN_STATS_SAMPLE_RATE("sql.txn_stats.sample_rate"),

    /** Fail fast on internal assertion violations instead of logging and degrading. */
    STRICT_ASSERTIONS("sql.instrumentation.strict_assertions"),

    /** Strip wall-clock dependent values from statistics so output is reproducible. */
    DETERMINISTIC_EXPLAIN("sql.instrumentation.deterministic_explain"),

    PLAN_COLLECTION_ENABLED("sql.metrics.statement_details.plan_collection.enabled"),
    PLAN_COLLECTION_PERIOD("sql.metrics.statement_details.plan_collection.period"),

    BUNDLE_URL_BASE("sql.diagnostics.bundle_url_base"),
    DIAGRAM_URL_BASE("sql.distsql.diagram_url_base");

    @Getter private final String keyValue;

    private static final Map<String, Key> ALL_KEYS;

    static {
      ImmutableMap.Builder<String, Key> builder = new ImmutableMap.Builder<>();
      for (Key key : Key.values()) {
        builder.put(key.getKeyValue(), key);
      }
      ALL_KEYS = builder.build();
    }

    public static Optional<Key> of(String keyValue) {
      return Optional.ofNullable(ALL_KEYS.get(keyValue));
    }
  }

  /** Get setting value by key. */
  public abstract <T> T getSettingValue(Key key);

  /**
   * Update a setting. Implementations validate the value here so that readers never observe an
   * invalid value.
   *
   * @throws IllegalArgumentException if the value is rejected
   */
  public abstract void updateSetting(Key key, Object value);
}
