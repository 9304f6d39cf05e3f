package io.github.simbo1905.drops;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// A predicate reference attached to a type node.
///
/// A [Check] names a predicate in the [PredicateRegistry] plus the arguments it is applied
/// with. An [All] groups checks under a logical AND; groups are flattened before evaluation
/// so the evaluator only ever sees an ordered list of checks.
public sealed interface Constraint {

  /// Single predicate reference
  record Check(String name, List<Object> args) implements Constraint {
    public Check {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(args, "args");
      // List.copyOf rejects null elements and nil is a legitimate predicate argument
      args = java.util.Collections.unmodifiableList(new ArrayList<>(args));
    }

    @Override
    public String toString() {
      return args.isEmpty() ? name : name + args;
    }
  }

  /// Logical AND of nested constraints
  record All(List<Constraint> constraints) implements Constraint {
    public All {
      constraints = List.copyOf(constraints);
    }
  }

  static Check check(String name, Object... args) {
    return new Check(name, Arrays.asList(args));
  }

  static All all(Constraint... constraints) {
    return new All(List.of(constraints));
  }

  /// The implicit kind check for `kind`, or nothing for [Kind#ANY]
  static List<Constraint> inferred(Kind kind) {
    return kind == Kind.ANY ? List.of() : List.of(check(StandardPredicates.TYPE, kind));
  }

  /// Flattens AND groups into a single ordered list of checks
  static List<Check> flatten(List<? extends Constraint> constraints) {
    List<Check> out = new ArrayList<>();
    for (Constraint c : constraints) {
      if (c instanceof Check check) {
        out.add(check);
      } else if (c instanceof All group) {
        out.addAll(flatten(group.constraints()));
      }
    }
    return out;
  }
}
