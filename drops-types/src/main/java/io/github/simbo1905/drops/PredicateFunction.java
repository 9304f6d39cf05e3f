package io.github.simbo1905.drops;

/// A boolean check registered under a name in a [PredicateRegistry].
///
/// Predicates come in two arities. A [Unary] is called as `(value)`. A [Binary] is called as
/// `(arg, value)` when its constraint carries one argument and as `(args, value)`, with the
/// whole argument list as the first parameter, when it carries several.
public sealed interface PredicateFunction permits PredicateFunction.Unary, PredicateFunction.Binary {

  @FunctionalInterface
  non-sealed interface Unary extends PredicateFunction {
    boolean test(Object value);
  }

  @FunctionalInterface
  non-sealed interface Binary extends PredicateFunction {
    boolean test(Object arg, Object value);
  }
}
