package io.github.simbo1905.drops;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.simbo1905.drops.DropsLogging.LOG;

/// Presence policy, nested path lookup and key normalization for [TypeNode.MapType].
public final class MapKeys {

  /// Successful outcome of one declared key, nested under its path
  public record KeyValue(List<Object> path, Object value) {
    public KeyValue {
      path = List.copyOf(path);
    }
  }

  private MapKeys() {}

  /// Validates one declared key against `container`.
  ///
  /// Returns an empty list for an absent optional key, a single `MissingKey` failure for an
  /// absent required key (its type is not consulted), otherwise the type's outcome nested
  /// under the key path.
  public static List<Result> validate(TypeNode.MapKey key, Map<?, ?> container, Validator validator) {
    if (!present(container, key.path())) {
      if (key.presence() == TypeNode.Presence.OPTIONAL) {
        StructuredLog.finest(LOG, "key.absent", "path", key.path(), "presence", "optional");
        return List.of();
      }
      StructuredLog.finer(LOG, "key.missing", "path", key.path());
      return List.of(Result.err(new Failure.MissingKey(key.path())));
    }
    Result result = validator.validate(key.type(), get(container, key.path()));
    if (result instanceof Result.Ok ok) {
      return List.of(Result.ok(new KeyValue(key.path(), ok.value())));
    }
    return List.of(Result.err(new Failure.KeyFailure(key.path(), ((Result.Err) result).failure())));
  }

  /// True when every segment of `path` resolves through nested maps.
  /// A non-map or missing intermediate level is absence; a null leaf value is present.
  public static boolean present(Object data, List<Object> path) {
    Object current = data;
    for (Object segment : path) {
      if (!(current instanceof Map<?, ?> map) || !containsKey(map, segment)) {
        return false;
      }
      current = lookup(map, segment);
    }
    return true;
  }

  /// Value at `path`, or null when absent; never throws on partial paths
  public static Object get(Object data, List<Object> path) {
    Object current = data;
    for (Object segment : path) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = lookup(map, segment);
    }
    return current;
  }

  /// Sorted and null-hostile maps may reject a foreign key type; that is absence here
  private static boolean containsKey(Map<?, ?> map, Object segment) {
    try {
      return map.containsKey(segment);
    } catch (ClassCastException | NullPointerException e) {
      StructuredLog.finest(LOG, "key.unsupported", "segment", segment, "map", map.getClass().getSimpleName());
      return false;
    }
  }

  private static Object lookup(Map<?, ?> map, Object segment) {
    try {
      return map.get(segment);
    } catch (ClassCastException | NullPointerException e) {
      return null;
    }
  }

  /// Copies the string-keyed value of every declared key into a fresh map under the
  /// declared path. Undeclared input keys are dropped and absent keys are omitted.
  /// Input that is not a map is returned unchanged so the map constraint can report it.
  /// The input is never modified.
  public static Object atomize(Object input, List<TypeNode.MapKey> keys) {
    if (!(input instanceof Map<?, ?>)) {
      return input;
    }
    Map<Object, Object> out = new LinkedHashMap<>();
    Set<Map<?, ?>> owned = Collections.newSetFromMap(new IdentityHashMap<>());
    owned.add(out);
    for (TypeNode.MapKey key : keys) {
      List<Object> stringPath = key.stringify().path();
      if (present(input, stringPath)) {
        put(out, key.path(), get(input, stringPath), owned);
      }
    }
    StructuredLog.finest(LOG, "map.atomize", "declared", keys.size(), "copied", out.size());
    return out;
  }

  /// Writes `value` at `path`, descending only into maps in `owned`. An intermediate map
  /// that came from the input is replaced by a copy, so the input is never written to.
  @SuppressWarnings("unchecked")
  private static void put(Map<Object, Object> target, List<Object> path, Object value, Set<Map<?, ?>> owned) {
    Map<Object, Object> current = target;
    for (int i = 0; i < path.size() - 1; i++) {
      Object next = current.get(path.get(i));
      if (!(next instanceof Map<?, ?> found) || !owned.contains(found)) {
        Map<Object, Object> fresh = next instanceof Map<?, ?> m ? new LinkedHashMap<Object, Object>(m) : new LinkedHashMap<Object, Object>();
        owned.add(fresh);
        current.put(path.get(i), fresh);
        next = fresh;
      }
      current = (Map<Object, Object>) next;
    }
    current.put(path.get(path.size() - 1), value);
  }
}
