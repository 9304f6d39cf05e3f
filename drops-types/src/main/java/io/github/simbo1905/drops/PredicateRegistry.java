package io.github.simbo1905.drops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static io.github.simbo1905.drops.DropsLogging.LOG;

/// Immutable name-indexed table of predicate functions.
///
/// The registry is passed to the compiler and validator explicitly rather than looked up
/// globally, so a test can substitute its own table. Use [StandardPredicates#registry()]
/// for the built-in set or [#builder()] to assemble one.
public final class PredicateRegistry {

  private final Map<String, PredicateFunction> functions;

  private PredicateRegistry(Map<String, PredicateFunction> functions) {
    this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
  }

  public static Builder builder() {
    return new Builder(new LinkedHashMap<>());
  }

  /// A builder seeded with this registry's entries
  public Builder toBuilder() {
    return new Builder(new LinkedHashMap<>(functions));
  }

  public Set<String> names() {
    return functions.keySet();
  }

  public boolean contains(String name) {
    return functions.containsKey(name);
  }

  /// Looks up `name` and checks it can be called with `argumentCount` constraint arguments.
  ///
  /// @throws UnknownPredicateException if the name is not registered or the arity does not fit
  public PredicateFunction resolve(String name, int argumentCount) {
    PredicateFunction fn = functions.get(name);
    if (fn == null) {
      StructuredLog.warning(LOG, "predicate.unknown", "name", name, "known", functions.keySet());
      throw new UnknownPredicateException(name, argumentCount, "Unknown predicate: " + name);
    }
    boolean unary = fn instanceof PredicateFunction.Unary;
    if (unary != (argumentCount == 0)) {
      StructuredLog.warning(LOG, "predicate.arity", "name", name, "args", argumentCount);
      throw new UnknownPredicateException(name, argumentCount,
          "Predicate " + name + (unary ? " takes no arguments, got " : " requires arguments, got ") + argumentCount);
    }
    return fn;
  }

  /// Applies the predicate `name` to `value`.
  ///
  /// The call is `(value)` when `args` is empty, `(args[0], value)` for a single argument
  /// and `(args, value)` otherwise.
  public boolean evaluate(String name, List<Object> args, Object value) {
    PredicateFunction fn = resolve(name, args.size());
    if (fn instanceof PredicateFunction.Unary u) {
      return u.test(value);
    }
    PredicateFunction.Binary b = (PredicateFunction.Binary) fn;
    return b.test(args.size() == 1 ? args.get(0) : args, value);
  }

  /// The argument list a predicate is actually invoked with, value last
  static List<Object> callArguments(List<Object> args, Object value) {
    List<Object> out = new ArrayList<>(2);
    if (args.size() == 1) {
      out.add(args.get(0));
    } else if (!args.isEmpty()) {
      out.add(args);
    }
    out.add(value);
    return Collections.unmodifiableList(out);
  }

  @Override
  public String toString() {
    return "PredicateRegistry" + functions.keySet();
  }

  public static final class Builder {
    private final Map<String, PredicateFunction> functions;

    private Builder(Map<String, PredicateFunction> functions) {
      this.functions = functions;
    }

    public Builder unary(String name, PredicateFunction.Unary fn) {
      return put(name, fn);
    }

    public Builder binary(String name, PredicateFunction.Binary fn) {
      return put(name, fn);
    }

    public Builder put(String name, PredicateFunction fn) {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(fn, "fn");
      functions.put(name, fn);
      return this;
    }

    public PredicateRegistry build() {
      return new PredicateRegistry(functions);
    }
  }
}
