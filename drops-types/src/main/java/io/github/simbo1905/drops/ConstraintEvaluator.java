package io.github.simbo1905.drops;

import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.drops.DropsLogging.LOG;

/// Applies an ordered list of constraints to a value, stopping at the first failure.
final class ConstraintEvaluator {

  private final PredicateRegistry registry;

  ConstraintEvaluator(PredicateRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /// `Ok(value)` when every check passes, otherwise `Err` describing the first failing check
  Result apply(Object value, List<Constraint> constraints) {
    for (Constraint.Check check : Constraint.flatten(constraints)) {
      if (!registry.evaluate(check.name(), check.args(), value)) {
        StructuredLog.finest(LOG, "constraint.failed", "predicate", check.name(), "input", value);
        return Result.err(new Failure.ConstraintFailure(
            value, check.name(), PredicateRegistry.callArguments(check.args(), value)));
      }
    }
    return Result.ok(value);
  }
}
