/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Values bound to a prepared statement's placeholders, in placeholder order. */
@EqualsAndHashCode
@ToString
public class Placeholders {

  private static final Placeholders NONE = new Placeholders(List.of());

  private final List<Value> values;

  private Placeholders(List<Value> values) {
    this.values = Collections.unmodifiableList(values);
  }

  public static Placeholders none() {
    return NONE;
  }

  public static Placeholders of(List<Value> values) {
    return new Placeholders(new ArrayList<>(values));
  }

  public List<Value> getValues() {
    return values;
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Renders one {@code $n: value (type)} line per placeholder. */
  public String render() {
    if (values.isEmpty()) {
      return "-- no placeholders\n";
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < values.size(); i++) {
      Value value = values.get(i);
      sb.append('$')
          .append(i + 1)
          .append(": ")
          .append(value.getValue())
          .append(" (")
          .append(value.getType())
          .append(")\n");
    }
    return sb.toString();
  }

  /** One bound value, already rendered as SQL text. */
  @Data
  @AllArgsConstructor
  public static class Value {
    private final String type;
    private final String value;
  }
}
