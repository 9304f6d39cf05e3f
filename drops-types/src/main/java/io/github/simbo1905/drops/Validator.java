package io.github.simbo1905.drops;

import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.drops.DropsLogging.LOG;

/// Walks a [TypeNode] tree against input data.
///
/// Dispatch is by node variant: each record in the sealed [TypeNode] family implements its
/// own rule and calls back here for children. A validator holds no mutable state and may be
/// shared between threads.
public final class Validator {

  private final PredicateRegistry registry;
  private final ConstraintEvaluator evaluator;

  public Validator(PredicateRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.evaluator = new ConstraintEvaluator(registry);
  }

  public PredicateRegistry registry() {
    return registry;
  }

  public Result validate(TypeNode node, Object input) {
    Objects.requireNonNull(node, "node");
    Result result = node.validate(input, this);
    StructuredLog.finest(LOG, "validate", "node", node.getClass().getSimpleName(), "ok", result.isOk());
    return result;
  }

  Result apply(Object value, List<Constraint> constraints) {
    return evaluator.apply(value, constraints);
  }

  /// Structural failure for a container node whose own constraints omitted the kind check
  Result kindMismatch(Object input, Kind kind) {
    return Result.err(new Failure.ConstraintFailure(
        input, StandardPredicates.TYPE, PredicateRegistry.callArguments(List.<Object>of(kind), input)));
  }
}
