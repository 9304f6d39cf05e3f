package io.github.simbo1905.drops;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Locale;

/// Primitive kinds a leaf type can be declared as.
///
/// Each kind except [#ANY] contributes an implicit `type(kind)` check to the node it is
/// compiled into.
public enum Kind {
  ANY("any value"),
  NIL("nil"),
  STRING("a string"),
  INTEGER("an integer"),
  FLOAT("a float"),
  NUMBER("a number"),
  BOOLEAN("a boolean"),
  SYMBOL("a symbol"),
  LIST("a list"),
  MAP("a map"),
  DATE("a date"),
  TIME("a time"),
  DATE_TIME("a date time");

  private final String label;

  Kind(String label) {
    this.label = label;
  }

  /// Human-readable noun phrase used in error messages
  public String label() {
    return label;
  }

  /// Lower-case name used in spec documents, e.g. `date_time`
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }

  /// Resolves a spec document tag such as `"integer"`
  public static Kind fromTag(String tag) {
    for (Kind kind : values()) {
      if (kind.tag().equals(tag)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown primitive kind: " + tag);
  }

  public boolean accepts(Object value) {
    return switch (this) {
      case ANY -> true;
      case NIL -> value == null;
      case STRING -> value instanceof String;
      case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short
          || value instanceof Byte || value instanceof BigInteger;
      case FLOAT -> value instanceof Double || value instanceof Float || value instanceof BigDecimal;
      case NUMBER -> INTEGER.accepts(value) || FLOAT.accepts(value);
      case BOOLEAN -> value instanceof Boolean;
      case SYMBOL -> value instanceof Symbol;
      case LIST -> value instanceof java.util.List;
      case MAP -> value instanceof java.util.Map;
      case DATE -> value instanceof LocalDate;
      case TIME -> value instanceof LocalTime;
      case DATE_TIME -> value instanceof OffsetDateTime || value instanceof ZonedDateTime
          || value instanceof Instant;
    };
  }
}
