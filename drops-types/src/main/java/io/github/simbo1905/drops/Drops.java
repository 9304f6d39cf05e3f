package io.github.simbo1905.drops;

import java.util.Objects;

import static io.github.simbo1905.drops.DropsLogging.LOG;

/// Entry point: compile a type specification once, validate many inputs against it.
///
/// ## Usage
/// ```java
/// Schema user = Drops.compile(TypeSpec.map(
///     TypeSpec.required(Symbol.of("name"), TypeSpec.string(Constraint.check("filled"))),
///     TypeSpec.optional(Symbol.of("age"), TypeSpec.integer(Constraint.check("gteq", 0)))));
///
/// Object input = Map.of(Symbol.of("name"), "Jane");
/// if (!user.validate(input).isOk()) {
///   user.errors(input).forEach(e -> System.out.println(e.path() + ": " + e.message()));
/// }
/// ```
public final class Drops {

  private Drops() {}

  public static Schema compile(TypeSpec spec) {
    return compile(spec, CompileOptions.DEFAULT);
  }

  public static Schema compile(TypeSpec spec, CompileOptions options) {
    return compile(spec, options, StandardPredicates.registry());
  }

  public static Schema compile(TypeSpec spec, CompileOptions options, PredicateRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    TypeNode root = new TypeCompiler(registry, options).compile(spec);
    return new Schema(root, new Validator(registry));
  }

  /// Reads a spec document with [SpecReader] and compiles it
  public static Schema compileDocument(Object document, CompileOptions options) {
    LOG.fine(() -> "compileDocument options=" + options.summary());
    return compile(SpecReader.read(document), options);
  }
}
