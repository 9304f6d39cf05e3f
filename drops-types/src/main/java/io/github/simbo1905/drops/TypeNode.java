package io.github.simbo1905.drops;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Compiled, immutable schema tree.
///
/// Four mutually-exclusive node forms: [PrimitiveType], [ListType], [MapType] and
/// [UnionType]. Nodes are built by [TypeCompiler] and never change afterwards; all
/// collections they hold are unmodifiable copies so a tree can be cached and shared across
/// threads. Records give value equality, so compiling the same spec twice produces equal
/// trees.
public sealed interface TypeNode {

  /// Constraints applied to the input at this node before any structural descent
  List<Constraint> constraints();

  /// Validates `input` against this node
  /// @param input the value to check, possibly null
  /// @param validator supplies constraint evaluation and recursive dispatch
  /// @return `Ok` or `Err` shaped like this node
  Result validate(Object input, Validator validator);

  /// A copy of this node with `extra` appended after its own constraints
  TypeNode constrain(List<Constraint> extra);

  /// Leaf type; the first constraint is normally the implicit kind check
  record PrimitiveType(Kind kind, List<Constraint> constraints) implements TypeNode {
    public PrimitiveType {
      Objects.requireNonNull(kind, "kind");
      constraints = List.copyOf(constraints);
    }

    @Override
    public Result validate(Object input, Validator validator) {
      return validator.apply(input, constraints);
    }

    @Override
    public TypeNode constrain(List<Constraint> extra) {
      return new PrimitiveType(kind, concat(constraints, extra));
    }
  }

  /// Homogeneous list; every element is validated against `memberType`
  record ListType(TypeNode memberType, List<Constraint> constraints) implements TypeNode {
    public ListType {
      Objects.requireNonNull(memberType, "memberType");
      constraints = List.copyOf(constraints);
    }

    @Override
    public Result validate(Object input, Validator validator) {
      Result own = validator.apply(input, constraints);
      if (!own.isOk()) {
        return own;
      }
      if (!(input instanceof List<?> members)) {
        return validator.kindMismatch(input, Kind.LIST);
      }
      List<Result> results = new ArrayList<>(members.size());
      for (Object member : members) {
        results.add(validator.validate(memberType, member));
      }
      return new Aggregate(Aggregate.Shape.LIST, results).toResult();
    }

    @Override
    public TypeNode constrain(List<Constraint> extra) {
      return new ListType(memberType, concat(constraints, extra));
    }
  }

  /// Keyed record with declared required and optional keys
  record MapType(List<MapKey> keys, boolean atomize, List<Constraint> constraints) implements TypeNode {
    public MapType {
      keys = List.copyOf(keys);
      constraints = List.copyOf(constraints);
      Set<List<Object>> seen = new HashSet<>();
      for (MapKey key : keys) {
        if (!seen.add(key.path())) {
          throw new IllegalArgumentException("Duplicate map key path: " + key.path());
        }
      }
    }

    @Override
    public Result validate(Object input, Validator validator) {
      Object data = atomize ? MapKeys.atomize(input, keys) : input;
      Result own = validator.apply(data, constraints);
      if (!own.isOk()) {
        return own;
      }
      if (!(data instanceof Map<?, ?> map)) {
        return validator.kindMismatch(data, Kind.MAP);
      }
      List<Result> results = new ArrayList<>(keys.size());
      for (MapKey key : keys) {
        results.addAll(MapKeys.validate(key, map, validator));
      }
      return new Aggregate(Aggregate.Shape.MAP, results).toResult();
    }

    @Override
    public TypeNode constrain(List<Constraint> extra) {
      return new MapType(keys, atomize, concat(constraints, extra));
    }
  }

  /// Two alternatives; input must satisfy `left` or `right`
  record UnionType(TypeNode left, TypeNode right, CompileOptions options) implements TypeNode {
    public UnionType {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
      Objects.requireNonNull(options, "options");
    }

    /// Unions hold no constraints of their own; refinements are pushed into both branches
    @Override
    public List<Constraint> constraints() {
      return List.of();
    }

    /// True when both branches are leaf kinds, the only case where a refinement failure on
    /// the left stops the right branch from being tried
    public boolean isPrimitivePair() {
      return left instanceof PrimitiveType && right instanceof PrimitiveType;
    }

    @Override
    public Result validate(Object input, Validator validator) {
      Result leftResult = validator.validate(left, input);
      if (leftResult.isOk()) {
        return leftResult;
      }
      Result.Err leftErr = (Result.Err) leftResult;
      if (isPrimitivePair()
          && leftErr.failure() instanceof Failure.ConstraintFailure cf
          && !cf.isKindCheck()) {
        return leftErr;
      }
      Result rightResult = validator.validate(right, input);
      if (rightResult.isOk()) {
        return rightResult;
      }
      return Result.err(new Failure.AlternativeFailure(leftErr, (Result.Err) rightResult, options));
    }

    @Override
    public TypeNode constrain(List<Constraint> extra) {
      return new UnionType(left.constrain(extra), right.constrain(extra), options);
    }
  }

  /// Whether a declared key must be present
  enum Presence { REQUIRED, OPTIONAL }

  /// Declared member of a [MapType]; `path` may reach several levels into the input
  record MapKey(List<Object> path, Presence presence, TypeNode type) {
    public MapKey {
      path = List.copyOf(path);
      if (path.isEmpty()) {
        throw new IllegalArgumentException("Map key path cannot be empty");
      }
      Objects.requireNonNull(presence, "presence");
      Objects.requireNonNull(type, "type");
    }

    /// The same key with every path segment in its string-keyed form
    public MapKey stringify() {
      List<Object> out = new ArrayList<>(path.size());
      for (Object segment : path) {
        out.add(Symbol.stringify(segment));
      }
      return new MapKey(out, presence, type);
    }
  }

  private static List<Constraint> concat(List<Constraint> a, List<Constraint> b) {
    if (b.isEmpty()) {
      return a;
    }
    List<Constraint> out = new ArrayList<>(a.size() + b.size());
    out.addAll(a);
    out.addAll(b);
    return out;
  }
}
