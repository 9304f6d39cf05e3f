package io.github.simbo1905.drops;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.drops.DropsLogging.LOG;

/// Compiles a [TypeSpec] into an immutable [TypeNode] tree.
///
/// Compilation infers the implicit kind check for each node, copies the `atomize` option
/// onto every map node, layers use-site refinements onto their base, and resolves every
/// predicate name against the registry. An unknown predicate, a malformed `format` regex or a
/// malformed spec is a fatal [IllegalArgumentException] here, never a validation failure later.
///
/// The compiler holds no state between calls; the same spec and options always compile to
/// equal trees.
public final class TypeCompiler {

  private final PredicateRegistry registry;
  private final CompileOptions options;

  public TypeCompiler(PredicateRegistry registry, CompileOptions options) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.options = Objects.requireNonNull(options, "options");
  }

  public TypeCompiler(PredicateRegistry registry) {
    this(registry, CompileOptions.DEFAULT);
  }

  public CompileOptions options() {
    return options;
  }

  public TypeNode compile(TypeSpec spec) {
    Objects.requireNonNull(spec, "spec");
    StructuredLog.fine(LOG, "compile.start", "spec", spec.getClass().getSimpleName(), "options", options.summary());
    TypeNode root = visit(spec);
    StructuredLog.fine(LOG, "compile.done", "root", root.getClass().getSimpleName());
    return root;
  }

  TypeNode visit(TypeSpec spec) {
    LOG.finer(() -> "visit " + spec.getClass().getSimpleName());
    if (spec instanceof TypeSpec.Primitive p) {
      List<Constraint> inferred = p.inferKindCheck() ? Constraint.inferred(p.kind()) : List.of();
      return new TypeNode.PrimitiveType(p.kind(), resolved(inferred, p.constraints()));
    } else if (spec instanceof TypeSpec.ListOf l) {
      List<Constraint> constraints = resolved(Constraint.inferred(Kind.LIST), l.constraints());
      if (l.member() == null) {
        return new TypeNode.PrimitiveType(Kind.LIST, constraints);
      }
      return new TypeNode.ListType(visit(l.member()), constraints);
    } else if (spec instanceof TypeSpec.MapOf m) {
      List<TypeNode.MapKey> keys = new ArrayList<>(m.keys().size());
      for (TypeSpec.KeySpec key : m.keys()) {
        keys.add(new TypeNode.MapKey(key.path(), key.presence(), visit(key.type())));
      }
      return new TypeNode.MapType(keys, options.atomize(), resolved(Constraint.inferred(Kind.MAP), m.constraints()));
    } else if (spec instanceof TypeSpec.UnionOf u) {
      return compileUnion(u);
    } else if (spec instanceof TypeSpec.Refined r) {
      return visit(r.base()).constrain(resolved(List.of(), r.constraints()));
    }
    throw new IllegalArgumentException("Unknown spec form: " + spec.getClass().getName());
  }

  /// `[a, b, c]` becomes `Union(Union(a, b), c)`
  TypeNode compileUnion(TypeSpec.UnionOf union) {
    List<TypeSpec> alternatives = union.alternatives();
    if (alternatives.size() < 2) {
      throw new IllegalArgumentException("Union needs at least two alternatives, got " + alternatives.size());
    }
    TypeNode node = new TypeNode.UnionType(visit(alternatives.get(0)), visit(alternatives.get(1)), options);
    for (int i = 2; i < alternatives.size(); i++) {
      node = new TypeNode.UnionType(node, visit(alternatives.get(i)), options);
    }
    return node;
  }

  /// Concatenates constraint lists after checking every predicate they name is registered
  private List<Constraint> resolved(List<Constraint> inferred, List<Constraint> declared) {
    List<Constraint> out = new ArrayList<>(inferred.size() + declared.size());
    out.addAll(inferred);
    out.addAll(declared);
    for (Constraint.Check check : Constraint.flatten(out)) {
      StandardPredicates.checkArguments(check, registry.resolve(check.name(), check.args().size()));
    }
    return out;
  }
}
