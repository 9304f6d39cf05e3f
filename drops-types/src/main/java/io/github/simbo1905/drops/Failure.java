package io.github.simbo1905.drops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Structured description of why an input did not validate.
public sealed interface Failure
    permits Failure.ConstraintFailure, Failure.MissingKey, Failure.KeyFailure,
    Failure.AlternativeFailure, Aggregate {

  /// A predicate returned false.
  ///
  /// `args` is the argument list the predicate was invoked with, the input value last, which
  /// is enough to render a message without running the predicate again.
  record ConstraintFailure(Object input, String predicate, List<Object> args) implements Failure {
    public ConstraintFailure {
      Objects.requireNonNull(predicate, "predicate");
      // the input, and so the last argument, may legitimately be null
      args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    /// True when this is the implicit kind check rather than a refinement
    public boolean isKindCheck() {
      return StandardPredicates.TYPE.equals(predicate);
    }
  }

  /// A required key was absent from the input map
  record MissingKey(List<Object> path) implements Failure {
    public MissingKey {
      path = List.copyOf(path);
    }
  }

  /// The value under a declared key failed its type
  record KeyFailure(List<Object> path, Failure cause) implements Failure {
    public KeyFailure {
      path = List.copyOf(path);
      Objects.requireNonNull(cause, "cause");
    }
  }

  /// Neither side of a union matched
  record AlternativeFailure(Result.Err left, Result.Err right, CompileOptions options) implements Failure {
    public AlternativeFailure {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
      Objects.requireNonNull(options, "options");
    }
  }
}
