package io.github.simbo1905.drops;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Declarative description of a type, the input to [TypeCompiler].
///
/// Five forms: [Primitive], [ListOf], [MapOf], [UnionOf] and [Refined]. Specs are plain
/// immutable values; compiling one resolves predicate names, infers kind checks and
/// applies [CompileOptions] to produce a [TypeNode] tree.
public sealed interface TypeSpec {

  /// Leaf kind plus extra constraints. `inferKindCheck` false suppresses the implicit
  /// `type(kind)` check.
  record Primitive(Kind kind, List<Constraint> constraints, boolean inferKindCheck) implements TypeSpec {
    public Primitive {
      Objects.requireNonNull(kind, "kind");
      constraints = List.copyOf(constraints);
    }
  }

  /// List whose members satisfy `member`; a null `member` means any list
  record ListOf(TypeSpec member, List<Constraint> constraints) implements TypeSpec {
    public ListOf {
      constraints = List.copyOf(constraints);
    }
  }

  /// Map with declared keys, in declaration order
  record MapOf(List<KeySpec> keys, List<Constraint> constraints) implements TypeSpec {
    public MapOf {
      keys = List.copyOf(keys);
      constraints = List.copyOf(constraints);
    }
  }

  /// Two or more alternatives, compiled left-associatively
  record UnionOf(List<TypeSpec> alternatives) implements TypeSpec {
    public UnionOf {
      alternatives = List.copyOf(alternatives);
    }
  }

  /// Use-site refinement: `constraints` are layered onto whatever `base` compiles to
  record Refined(TypeSpec base, List<Constraint> constraints) implements TypeSpec {
    public Refined {
      Objects.requireNonNull(base, "base");
      constraints = List.copyOf(constraints);
    }
  }

  /// Declared map key; `path` holds one segment per nesting level
  record KeySpec(List<Object> path, TypeNode.Presence presence, TypeSpec type) {
    public KeySpec {
      path = List.copyOf(path);
      Objects.requireNonNull(presence, "presence");
      Objects.requireNonNull(type, "type");
    }
  }

  static Primitive primitive(Kind kind, Constraint... constraints) {
    return new Primitive(kind, List.of(constraints), true);
  }

  static Primitive string(Constraint... constraints) {
    return primitive(Kind.STRING, constraints);
  }

  static Primitive integer(Constraint... constraints) {
    return primitive(Kind.INTEGER, constraints);
  }

  static Primitive bool(Constraint... constraints) {
    return primitive(Kind.BOOLEAN, constraints);
  }

  static Primitive any(Constraint... constraints) {
    return primitive(Kind.ANY, constraints);
  }

  static ListOf list(TypeSpec member, Constraint... constraints) {
    return new ListOf(Objects.requireNonNull(member, "member"), List.of(constraints));
  }

  /// Any list, compiled to a primitive list node
  static ListOf list() {
    return new ListOf(null, List.of());
  }

  static MapOf map(KeySpec... keys) {
    return new MapOf(List.of(keys), List.of());
  }

  static MapOf map(List<KeySpec> keys, Constraint... constraints) {
    return new MapOf(keys, List.of(constraints));
  }

  static UnionOf union(TypeSpec first, TypeSpec second, TypeSpec... rest) {
    List<TypeSpec> all = new ArrayList<>(2 + rest.length);
    all.add(first);
    all.add(second);
    all.addAll(Arrays.asList(rest));
    return new UnionOf(all);
  }

  static Refined refine(TypeSpec base, Constraint... constraints) {
    return new Refined(base, List.of(constraints));
  }

  static KeySpec required(Object segment, TypeSpec type) {
    return new KeySpec(List.of(segment), TypeNode.Presence.REQUIRED, type);
  }

  static KeySpec required(List<?> path, TypeSpec type) {
    return new KeySpec(List.copyOf(path), TypeNode.Presence.REQUIRED, type);
  }

  static KeySpec optional(Object segment, TypeSpec type) {
    return new KeySpec(List.of(segment), TypeNode.Presence.OPTIONAL, type);
  }

  static KeySpec optional(List<?> path, TypeSpec type) {
    return new KeySpec(List.copyOf(path), TypeNode.Presence.OPTIONAL, type);
  }
}
