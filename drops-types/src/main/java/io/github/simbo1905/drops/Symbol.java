package io.github.simbo1905.drops;

import java.util.Objects;

/// A name in the native key namespace of map schemas.
///
/// Declared map keys are normally symbols. Input decoded from text usually arrives with
/// `String` keys instead; a map node compiled with `atomize` copies those values across
/// to the symbol keys it declares before validating.
public record Symbol(String name) implements Comparable<Symbol> {

  public Symbol {
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Symbol name cannot be empty");
    }
  }

  public static Symbol of(String name) {
    return new Symbol(name);
  }

  /// The string-keyed form of a key segment: a symbol's name, anything else unchanged
  static Object stringify(Object segment) {
    return segment instanceof Symbol s ? s.name() : segment;
  }

  @Override
  public int compareTo(Symbol other) {
    return name.compareTo(other.name);
  }

  @Override
  public String toString() {
    return ":" + name;
  }
}
