package io.github.simbo1905.drops;

import java.util.Objects;

/// Outcome of validating an input against a [TypeNode].
///
/// An [Ok] carries the validated input for leaf types and an [Aggregate] of per-member
/// outcomes for lists and maps. An [Err] carries a [Failure] shaped like the node that
/// failed. Validation never throws for bad data: every data problem comes back as an `Err`.
public sealed interface Result permits Result.Ok, Result.Err {

  boolean isOk();

  record Ok(Object value) implements Result {
    @Override
    public boolean isOk() {
      return true;
    }
  }

  record Err(Failure failure) implements Result {
    public Err {
      Objects.requireNonNull(failure, "failure");
    }

    @Override
    public boolean isOk() {
      return false;
    }
  }

  static Ok ok(Object value) {
    return new Ok(value);
  }

  static Err err(Failure failure) {
    return new Err(failure);
  }
}
