/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.common.utils;

import java.util.Locale;
import lombok.experimental.UtilityClass;

/** Human-readable rendering of byte counts, durations and counts for EXPLAIN output. */
@UtilityClass
public class HumanizeUtils {

  private static final String[] IEC_SIZES = {"B", "KiB", "MiB", "GiB", "TiB", "PiB", "EiB"};

  /**
   * Formats a byte count with IEC units, e.g. {@code 512 B}, {@code 1.5 KiB}, {@code 12 MiB}.
   * Values below ten units keep one decimal.
   */
  public static String bytes(long bytes) {
    if (bytes < 1024) {
      return bytes + " B";
    }
    int exp = 0;
    double scaled = bytes;
    while (scaled >= 1024 && exp < IEC_SIZES.length - 1) {
      scaled /= 1024;
      exp++;
    }
    double value = roundForDisplay(scaled);
    // Rounding can carry a value into the next unit, e.g. 1023.97 KiB.
    if (value >= 1024 && exp < IEC_SIZES.length - 1) {
      value = roundForDisplay(scaled / 1024);
      exp++;
    }
    String format = value < 10 ? "%.1f %s" : "%.0f %s";
    return String.format(Locale.ROOT, format, value, IEC_SIZES[exp]);
  }

  /**
   * Formats a duration given in nanoseconds. Granularity is never finer than a microsecond:
   * {@code 0µs}, {@code 15µs}, {@code 1.5ms}, {@code 2s}, {@code 3m4s}.
   */
  public static String duration(long nanos) {
    long micros = Math.round(nanos / 1_000.0);
    if (micros < 1_000) {
      return micros + "µs";
    }
    long tenthsOfMillis = Math.round(nanos / 100_000.0);
    if (tenthsOfMillis < 10_000) {
      return oneDecimal(tenthsOfMillis / 10.0) + "ms";
    }
    long tenthsOfSeconds = Math.round(nanos / 100_000_000.0);
    if (tenthsOfSeconds < 600) {
      return oneDecimal(tenthsOfSeconds / 10.0) + "s";
    }
    long seconds = Math.round(nanos / 1_000_000_000.0);
    return (seconds / 60) + "m" + (seconds % 60) + "s";
  }

  /** Formats a count with thousands separators, e.g. {@code 1,234,567}. */
  public static String count(long count) {
    return String.format(Locale.ROOT, "%,d", count);
  }

  /** Rounds half up to one decimal below ten and to a whole number above. */
  private static double roundForDisplay(double value) {
    return value < 10 ? Math.floor(value * 10 + 0.5) / 10 : Math.floor(value + 0.5);
  }

  private static String oneDecimal(double value) {
    String formatted = String.format(Locale.ROOT, "%.1f", value);
    return formatted.endsWith(".0") ? formatted.substring(0, formatted.length() - 2) : formatted;
  }
}
