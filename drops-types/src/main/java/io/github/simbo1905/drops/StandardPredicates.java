package io.github.simbo1905.drops;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static io.github.simbo1905.drops.DropsLogging.LOG;

/// Built-in predicate library.
///
/// Every function here returns `false` for inputs of the wrong shape instead of throwing:
/// `gt(0, "x")` is simply not satisfied. The kind check [#TYPE] is also what union
/// resolution looks for when deciding whether a left branch failed on kind or on a
/// refinement.
public final class StandardPredicates {

  public static final String TYPE = "type";
  public static final String FILLED = "filled";
  public static final String EMPTY = "empty";
  public static final String EQL = "eql";
  public static final String NOT_EQL = "notEql";
  public static final String GT = "gt";
  public static final String GTEQ = "gteq";
  public static final String LT = "lt";
  public static final String LTEQ = "lteq";
  public static final String SIZE = "size";
  public static final String MIN_SIZE = "minSize";
  public static final String MAX_SIZE = "maxSize";
  public static final String INCLUDES = "includes";
  public static final String EXCLUDES = "excludes";
  public static final String IN = "in";
  public static final String NOT_IN = "notIn";
  public static final String EVEN = "even";
  public static final String ODD = "odd";
  public static final String FORMAT = "format";

  private static final PredicateRegistry REGISTRY = PredicateRegistry.builder()
      .binary(TYPE, (kind, value) -> kind instanceof Kind k && k.accepts(value))
      .unary(FILLED, value -> size(value) > 0)
      .unary(EMPTY, value -> size(value) == 0)
      .binary(EQL, Objects::equals)
      .binary(NOT_EQL, (expected, value) -> !Objects.equals(expected, value))
      .binary(GT, (bound, value) -> compare(value, bound) > 0)
      .binary(GTEQ, (bound, value) -> compare(value, bound) >= 0)
      .binary(LT, (bound, value) -> ordered(value, bound) && compare(value, bound) < 0)
      .binary(LTEQ, (bound, value) -> ordered(value, bound) && compare(value, bound) <= 0)
      .binary(SIZE, (expected, value) -> expected instanceof Number n && size(value) == n.longValue())
      .binary(MIN_SIZE, (min, value) -> min instanceof Number n && size(value) >= n.longValue())
      .binary(MAX_SIZE, (max, value) -> max instanceof Number n && size(value) >= 0 && size(value) <= n.longValue())
      .binary(INCLUDES, (member, value) -> value instanceof Collection<?> c && member(c, member))
      .binary(EXCLUDES, (member, value) -> value instanceof Collection<?> c && !member(c, member))
      .binary(IN, (choices, value) -> member(asList(choices), value))
      .binary(NOT_IN, (choices, value) -> !member(asList(choices), value))
      .unary(EVEN, value -> Kind.INTEGER.accepts(value) && ((Number) value).longValue() % 2 == 0)
      .unary(ODD, value -> Kind.INTEGER.accepts(value) && ((Number) value).longValue() % 2 != 0)
      .binary(FORMAT, StandardPredicates::format)
      .build();

  private static final Map<String, Pattern> PATTERNS = new ConcurrentHashMap<>();

  /// Sentinel returned by [#compare] for values that have no ordering
  static final int INCOMPARABLE = Integer.MIN_VALUE;

  private StandardPredicates() {}

  public static PredicateRegistry registry() {
    return REGISTRY;
  }

  /// Size of a string, collection or map; -1 for anything else
  static long size(Object value) {
    if (value instanceof CharSequence s) return s.length();
    if (value instanceof Collection<?> c) return c.size();
    if (value instanceof Map<?, ?> m) return m.size();
    return -1;
  }

  static boolean ordered(Object value, Object bound) {
    return compare(value, bound) != INCOMPARABLE;
  }

  /// Numeric comparison across number types, natural order for same-class comparables
  @SuppressWarnings({"unchecked", "rawtypes"})
  static int compare(Object value, Object bound) {
    if (Kind.NUMBER.accepts(value) && Kind.NUMBER.accepts(bound)) {
      Number v = (Number) value;
      Number b = (Number) bound;
      if (!finite(v) || !finite(b)) {
        double dv = v.doubleValue();
        double db = b.doubleValue();
        return Double.isNaN(dv) || Double.isNaN(db) ? INCOMPARABLE : Integer.signum(Double.compare(dv, db));
      }
      return decimal(v).compareTo(decimal(b));
    }
    if (value instanceof Comparable c && bound != null && value.getClass() == bound.getClass()) {
      return Integer.signum(c.compareTo(bound));
    }
    return INCOMPARABLE;
  }

  private static boolean finite(Number n) {
    return !(n instanceof Double || n instanceof Float) || Double.isFinite(n.doubleValue());
  }

  private static BigDecimal decimal(Number n) {
    if (n instanceof BigDecimal d) return d;
    if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
    return new BigDecimal(n.toString());
  }

  private static boolean format(Object regex, Object value) {
    if (!(value instanceof String s)) {
      return false;
    }
    if (regex instanceof Pattern p) {
      return p.matcher(s).matches();
    }
    if (regex instanceof String r) {
      return pattern(r).matcher(s).matches();
    }
    return false;
  }

  /// Compiled form of a `format` regex, cached per source string.
  /// @throws PatternSyntaxException for a malformed regex
  static Pattern pattern(String regex) {
    return PATTERNS.computeIfAbsent(regex, Pattern::compile);
  }

  /// Checks arguments that can only be validated by the standard implementation, so a bad
  /// `format` regex fails when the schema is compiled rather than on first use
  static void checkArguments(Constraint.Check check, PredicateFunction resolved) {
    if (FORMAT.equals(check.name())
        && resolved == REGISTRY.resolve(FORMAT, 1)
        && check.args().size() == 1
        && check.args().get(0) instanceof String regex) {
      try {
        pattern(regex);
      } catch (PatternSyntaxException e) {
        StructuredLog.warning(LOG, "predicate.badFormat", "regex", regex, "error", e.getDescription());
        throw e;
      }
    }
  }

  /// Membership by [Objects#equals]; immutable collections reject `contains(null)`
  private static boolean member(Collection<?> collection, Object value) {
    for (Object element : collection) {
      if (Objects.equals(element, value)) {
        return true;
      }
    }
    return false;
  }

  /// A single non-list argument is treated as a one-element choice list
  static List<?> asList(Object args) {
    return args instanceof List<?> l ? l : Collections.singletonList(args);
  }
}
