package io.github.simbo1905.drops;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static io.github.simbo1905.drops.DropsLogging.LOG;

/// Reads the plain-data document form of a type specification into a [TypeSpec].
///
/// A document is either a kind name such as `"integer"` or a map holding exactly one form
/// tag (`primitive`, `list`, `map`, `union`, `refine`) plus optional `constraints`:
///
/// ```
/// {"map": [
///    {"path": "name", "type": "string"},
///    {"path": ["address", "zip"], "presence": "optional",
///     "type": {"primitive": "string", "constraints": [["format", "\\d{5}"]]}}
/// ]}
/// ```
///
/// A constraint is a predicate name, a list `[name, arg...]` or `{"and": [...]}`.
/// Key path segments become [Symbol]s. Unknown tags, conflicting forms and malformed
/// members throw [IllegalArgumentException].
public final class SpecReader {

  static final String PRIMITIVE = "primitive";
  static final String LIST = "list";
  static final String MAP = "map";
  static final String UNION = "union";
  static final String REFINE = "refine";
  static final String CONSTRAINTS = "constraints";

  private static final Set<String> FORMS = Set.of(PRIMITIVE, LIST, MAP, UNION, REFINE);

  private SpecReader() {}

  public static TypeSpec read(Object document) {
    if (document instanceof String kind) {
      return TypeSpec.primitive(Kind.fromTag(kind));
    }
    if (!(document instanceof Map<?, ?> members)) {
      throw new IllegalArgumentException("Spec must be a kind name or a map, got: " + describe(document));
    }

    List<String> forms = new ArrayList<>();
    for (Object key : members.keySet()) {
      String tag = String.valueOf(key);
      if (FORMS.contains(tag)) {
        forms.add(tag);
      } else if (!CONSTRAINTS.equals(tag)) {
        StructuredLog.warning(LOG, "spec.unknownTag", "tag", tag);
        throw new IllegalArgumentException("Unknown spec tag: " + tag);
      }
    }
    if (forms.size() != 1) {
      throw new IllegalArgumentException(forms.isEmpty()
          ? "Spec has no form tag, expected one of " + FORMS
          : "Spec has multiple forms: " + forms);
    }

    List<Constraint> constraints = readConstraints(members.get(CONSTRAINTS));
    String form = forms.get(0);
    Object body = members.get(form);
    LOG.finer(() -> "read form=" + form);
    return switch (form) {
      case PRIMITIVE -> {
        if (!(body instanceof String kind)) {
          throw new IllegalArgumentException("primitive must be a kind name");
        }
        yield new TypeSpec.Primitive(Kind.fromTag(kind), constraints, true);
      }
      case LIST -> new TypeSpec.ListOf(body == null ? null : read(body), constraints);
      case MAP -> new TypeSpec.MapOf(readKeys(body), constraints);
      case UNION -> {
        if (!constraints.isEmpty()) {
          throw new IllegalArgumentException("union takes no constraints, use refine");
        }
        if (!(body instanceof List<?> alternatives) || alternatives.size() < 2) {
          throw new IllegalArgumentException("union must be a list of at least two specs");
        }
        List<TypeSpec> specs = new ArrayList<>(alternatives.size());
        for (Object alternative : alternatives) {
          specs.add(read(alternative));
        }
        yield new TypeSpec.UnionOf(specs);
      }
      case REFINE -> new TypeSpec.Refined(read(body), constraints);
      default -> throw new IllegalArgumentException("Unknown spec form: " + form);
    };
  }

  static List<TypeSpec.KeySpec> readKeys(Object body) {
    if (!(body instanceof List<?> keyDocs)) {
      throw new IllegalArgumentException("map must be a list of keys");
    }
    List<TypeSpec.KeySpec> keys = new ArrayList<>(keyDocs.size());
    for (Object keyDoc : keyDocs) {
      if (!(keyDoc instanceof Map<?, ?> key)) {
        throw new IllegalArgumentException("map key must be a map, got: " + describe(keyDoc));
      }
      for (Object tag : key.keySet()) {
        if (!Set.of("path", "presence", "type").contains(String.valueOf(tag))) {
          throw new IllegalArgumentException("Unknown map key tag: " + tag);
        }
      }
      if (!key.containsKey("type")) {
        throw new IllegalArgumentException("map key requires a type");
      }
      keys.add(new TypeSpec.KeySpec(readPath(key.get("path")), readPresence(key.get("presence")), read(key.get("type"))));
    }
    return keys;
  }

  static List<Object> readPath(Object path) {
    if (path instanceof String name) {
      return List.of(Symbol.of(name));
    }
    if (path instanceof List<?> segments && !segments.isEmpty()) {
      List<Object> out = new ArrayList<>(segments.size());
      for (Object segment : segments) {
        if (!(segment instanceof String name)) {
          throw new IllegalArgumentException("path segments must be strings, got: " + describe(segment));
        }
        out.add(Symbol.of(name));
      }
      return out;
    }
    throw new IllegalArgumentException("path must be a name or a non-empty list of names");
  }

  static TypeNode.Presence readPresence(Object presence) {
    if (presence == null) {
      return TypeNode.Presence.REQUIRED;
    }
    if (presence instanceof String p) {
      switch (p) {
        case "required":
          return TypeNode.Presence.REQUIRED;
        case "optional":
          return TypeNode.Presence.OPTIONAL;
        default:
          break;
      }
    }
    throw new IllegalArgumentException("presence must be required or optional, got: " + presence);
  }

  static List<Constraint> readConstraints(Object doc) {
    if (doc == null) {
      return List.of();
    }
    if (!(doc instanceof List<?> items)) {
      throw new IllegalArgumentException("constraints must be a list");
    }
    List<Constraint> out = new ArrayList<>(items.size());
    for (Object item : items) {
      out.add(readConstraint(item));
    }
    return out;
  }

  static Constraint readConstraint(Object doc) {
    if (doc instanceof String name) {
      return new Constraint.Check(name, List.of());
    }
    if (doc instanceof List<?> call && !call.isEmpty() && call.get(0) instanceof String name) {
      List<Object> args = new ArrayList<>(call.subList(1, call.size()));
      if (args.size() == 1 && StandardPredicates.TYPE.equals(name) && args.get(0) instanceof String kind) {
        args.set(0, Kind.fromTag(kind));
      }
      return new Constraint.Check(name, args);
    }
    if (doc instanceof Map<?, ?> group && group.size() == 1 && group.containsKey("and")) {
      return new Constraint.All(readConstraints(group.get("and")));
    }
    throw new IllegalArgumentException("Malformed constraint: " + describe(doc));
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName().toLowerCase(Locale.ROOT) + " " + value;
  }
}
