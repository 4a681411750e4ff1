/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.query.instrumentation.tracing;

import com.google.common.base.Preconditions;
import java.util.Optional;
import org.opensearch.query.tracing.Recording;
import org.opensearch.query.tracing.Span;

/**
 * The trace span a statement records into. Exactly one of three shapes: no span, a span the
 * statement opened and must finish, or a caller's span the statement reads but must not finish.
 */
public abstract class StatementSpan {

  /** Shape of a {@link StatementSpan}. */
  public enum Kind {
    NONE,
    OWNED,
    BORROWED
  }

  private static final StatementSpan NONE = new None();

  private StatementSpan() {}

  public static StatementSpan none() {
    return NONE;
  }

  public static StatementSpan owned(Span span) {
    return new Owned(Preconditions.checkNotNull(span, "owned span"));
  }

  public static StatementSpan borrowed(Span span) {
    return new Borrowed(Preconditions.checkNotNull(span, "borrowed span"));
  }

  public abstract Kind getKind();

  public abstract Optional<Span> getSpan();

  /** True unless there is no span. */
  public boolean needsFinish() {
    return getKind() != Kind.NONE;
  }

  /** Finishes an owned span or reads a borrowed one. */
  abstract Optional<Recording> terminate();

  private static final class None extends StatementSpan {
    @Override
    public Kind getKind() {
      return Kind.NONE;
    }

    @Override
    public Optional<Span> getSpan() {
      return Optional.empty();
    }

    @Override
    Optional<Recording> terminate() {
      return Optional.empty();
    }

    @Override
    public String toString() {
      return "StatementSpan{none}";
    }
  }

  private static final class Owned extends StatementSpan {
    private final Span span;

    private Owned(Span span) {
      this.span = span;
    }

    @Override
    public Kind getKind() {
      return Kind.OWNED;
    }

    @Override
    public Optional<Span> getSpan() {
      return Optional.of(span);
    }

    @Override
    Optional<Recording> terminate() {
      return Optional.of(span.finishAndGetRecording());
    }

    @Override
    public String toString() {
      return "StatementSpan{owned " + span.getOperation() + "}";
    }
  }

  private static final class Borrowed extends StatementSpan {
    private final Span span;

    private Borrowed(Span span) {
      this.span = span;
    }

    @Override
    public Kind getKind() {
      return Kind.BORROWED;
    }

    @Override
    public Optional<Span> getSpan() {
      return Optional.of(span);
    }

    @Override
    Optional<Recording> terminate() {
      return Optional.of(span.getRecording());
    }

    @Override
    public String toString() {
      return "StatementSpan{borrowed " + span.getOperation() + "}";
    }
  }
}
