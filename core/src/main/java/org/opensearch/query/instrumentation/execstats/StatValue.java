/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.execstats;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An optional non-negative statistic. Components only report the statistics they track; an unset
 * value is distinct from zero.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class StatValue {

  private boolean set;
  private long value;

  public static StatValue of(long value) {
    return new StatValue(true, value);
  }

  public static StatValue unset() {
    return new StatValue();
  }

  /** Adds {@code other} to this value if it is set. */
  public void maybeAdd(StatValue other) {
    if (other != null && other.set) {
      value = set ? value + other.value : other.value;
      set = true;
    }
  }

  /** Raises this value to {@code other} if it is set and larger. */
  public void maybeMax(StatValue other) {
    if (other != null && other.set) {
      value = set ? Math.max(value, other.value) : other.value;
      set = true;
    }
  }

  /** Copies {@code other} into this value if this value is unset. */
  public void maybeFill(StatValue other) {
    if (!set && other != null && other.set) {
      value = other.value;
      set = true;
    }
  }

  /** Replaces a set value with {@code replacement}; leaves an unset value alone. */
  public void resetTo(long replacement) {
    if (set) {
      value = replacement;
    }
  }

  /** Returns the value, or zero when unset. */
  public long orZero() {
    return set ? value : 0;
  }
}
