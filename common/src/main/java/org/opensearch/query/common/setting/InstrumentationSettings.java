/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.common.setting;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;

/**
 * In-memory {@link Settings} with per-key validation. Values are converted and validated once in
 * {@link #updateSetting(Key, Object)}; {@link #getSettingValue(Key)} is a plain map read and is
 * safe to call on the statement hot path.
 */
@Log4j2
public class InstrumentationSettings extends Settings {

  public static final double DEFAULT_TXN_STATS_SAMPLE_RATE = 0.01;

  private static final Map<Key, Object> DEFAULTS =
      new ImmutableMap.Builder<Key, Object>()
          .put(Key.TXN_STATS_SAMPLE_RATE, DEFAULT_TXN_STATS_SAMPLE_RATE)
          .put(Key.STRICT_ASSERTIONS, false)
          .put(Key.DETERMINISTIC_EXPLAIN, false)
          .put(Key.PLAN_COLLECTION_ENABLED, true)
          .put(Key.PLAN_COLLECTION_PERIOD, Duration.ofMinutes(5))
          .put(Key.BUNDLE_URL_BASE, "http://localhost:9200/_plugins/_sql/stmtbundle")
          .put(Key.DIAGRAM_URL_BASE, "http://localhost:9200/_plugins/_sql/distsqlplan")
          .build();

  private static final Map<Key, Function<Object, Object>> VALIDATORS = new EnumMap<>(Key.class);

  static {
    VALIDATORS.put(Key.TXN_STATS_SAMPLE_RATE, InstrumentationSettings::validateSampleRate);
    VALIDATORS.put(Key.STRICT_ASSERTIONS, InstrumentationSettings::validateBoolean);
    VALIDATORS.put(Key.DETERMINISTIC_EXPLAIN, InstrumentationSettings::validateBoolean);
    VALIDATORS.put(Key.PLAN_COLLECTION_ENABLED, InstrumentationSettings::validateBoolean);
    VALIDATORS.put(Key.PLAN_COLLECTION_PERIOD, InstrumentationSettings::validatePeriod);
    VALIDATORS.put(Key.BUNDLE_URL_BASE, InstrumentationSettings::validateUrlBase);
    VALIDATORS.put(Key.DIAGRAM_URL_BASE, InstrumentationSettings::validateUrlBase);
  }

  private final Map<Key, Object> values = new ConcurrentHashMap<>(DEFAULTS);

  /** Settings with every key at its default. */
  public InstrumentationSettings() {}

  /** Settings with the given overrides, each validated as if passed to updateSetting. */
  public InstrumentationSettings(Map<Key, ?> overrides) {
    overrides.forEach(this::updateSetting);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  @Override
  public void updateSetting(Key key, Object value) {
    Preconditions.checkNotNull(key, "setting key");
    Object validated = VALIDATORS.get(key).apply(value);
    values.put(key, validated);
    log.info("setting {} updated to {}", key.getKeyValue(), validated);
  }

  /** Shorthand for the transaction stats sample rate. */
  public double getTxnStatsSampleRate() {
    return getSettingValue(Key.TXN_STATS_SAMPLE_RATE);
  }

  /** Shorthand for the strict assertions flag. */
  public boolean isStrictAssertions() {
    return getSettingValue(Key.STRICT_ASSERTIONS);
  }

  /** Shorthand for the deterministic explain flag. */
  public boolean isDeterministicExplain() {
    return getSettingValue(Key.DETERMINISTIC_EXPLAIN);
  }

  private static Object validateSampleRate(Object value) {
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException(
          String.format("%s must be a number", Key.TXN_STATS_SAMPLE_RATE.getKeyValue()));
    }
    double rate = ((Number) value).doubleValue();
    if (Double.isNaN(rate) || rate < 0 || rate > 1) {
      throw new IllegalArgumentException("value must be between 0 and 1 inclusive");
    }
    return rate;
  }

  private static Object validateBoolean(Object value) {
    if (value instanceof Boolean) {
      return value;
    }
    if (value instanceof String
        && ("true".equalsIgnoreCase((String) value) || "false".equalsIgnoreCase((String) value))) {
      return Boolean.parseBoolean((String) value);
    }
    throw new IllegalArgumentException("value must be a boolean: " + value);
  }

  private static Object validatePeriod(Object value) {
    Duration period;
    if (value instanceof Duration) {
      period = (Duration) value;
    } else if (value instanceof String) {
      period = Duration.parse((String) value);
    } else {
      throw new IllegalArgumentException("value must be a duration: " + value);
    }
    if (period.isNegative() || period.isZero()) {
      throw new IllegalArgumentException("value must be a positive duration: " + period);
    }
    return period;
  }

  private static Object validateUrlBase(Object value) {
    if (!(value instanceof String) || Strings.isNullOrEmpty(((String) value).trim())) {
      throw new IllegalArgumentException("value must be a non-empty URL: " + value);
    }
    String url = ((String) value).trim();
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
