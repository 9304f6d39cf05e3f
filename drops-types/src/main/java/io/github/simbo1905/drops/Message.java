package io.github.simbo1905.drops;

import java.util.Collection;
import java.util.stream.Collectors;

/// Standardized message templates for validation failures
public enum Message {
  TYPE(StandardPredicates.TYPE, "must be %s"),
  FILLED(StandardPredicates.FILLED, "must be filled"),
  EMPTY(StandardPredicates.EMPTY, "must be empty"),
  EQL(StandardPredicates.EQL, "must be equal to %s"),
  NOT_EQL(StandardPredicates.NOT_EQL, "must not be equal to %s"),
  GT(StandardPredicates.GT, "must be greater than %s"),
  GTEQ(StandardPredicates.GTEQ, "must be greater than or equal to %s"),
  LT(StandardPredicates.LT, "must be less than %s"),
  LTEQ(StandardPredicates.LTEQ, "must be less than or equal to %s"),
  SIZE(StandardPredicates.SIZE, "size must be %s"),
  MIN_SIZE(StandardPredicates.MIN_SIZE, "size cannot be less than %s"),
  MAX_SIZE(StandardPredicates.MAX_SIZE, "size cannot be greater than %s"),
  INCLUDES(StandardPredicates.INCLUDES, "must include %s"),
  EXCLUDES(StandardPredicates.EXCLUDES, "must not include %s"),
  IN(StandardPredicates.IN, "must be one of: %s"),
  NOT_IN(StandardPredicates.NOT_IN, "must not be one of: %s"),
  EVEN(StandardPredicates.EVEN, "must be even"),
  ODD(StandardPredicates.ODD, "must be odd"),
  FORMAT(StandardPredicates.FORMAT, "is in invalid format"),

  /// Required key absent from the input
  MISSING_KEY(null, "is missing"),

  /// Predicate registered by the caller with no template of its own
  UNKNOWN_PREDICATE(null, "must satisfy %s");

  private final String predicate;
  private final String template;

  Message(String predicate, String template) {
    this.predicate = predicate;
    this.template = template;
  }

  public static Message forPredicate(String name) {
    for (Message m : values()) {
      if (name.equals(m.predicate)) {
        return m;
      }
    }
    return UNKNOWN_PREDICATE;
  }

  /// Renders a constraint failure from the arguments the predicate was called with
  static String render(Failure.ConstraintFailure failure) {
    Message m = forPredicate(failure.predicate());
    if (m == UNKNOWN_PREDICATE) {
      return m.format(failure.predicate());
    }
    // call arguments end with the input; anything before it is the constraint argument
    Object arg = failure.args().size() > 1 ? failure.args().get(0) : null;
    return m.format(display(arg));
  }

  public String format(Object... args) {
    return String.format(template, args);
  }

  private static String display(Object arg) {
    if (arg instanceof Kind kind) {
      return kind.label();
    }
    if (arg instanceof Symbol s) {
      return s.name();
    }
    if (arg instanceof Collection<?> c) {
      return c.stream().map(Message::display).collect(Collectors.joining(", "));
    }
    return String.valueOf(arg);
  }
}
