package io.github.simbo1905.drops;

/// Raised when a constraint names a predicate the registry does not have, or uses it with
/// an argument count the predicate cannot accept.
///
/// This is a configuration error in the schema itself and is never reported as a
/// validation failure.
public final class UnknownPredicateException extends IllegalArgumentException {
  private final String predicate;
  private final int argumentCount;

  UnknownPredicateException(String predicate, int argumentCount, String message) {
    super(message);
    this.predicate = predicate;
    this.argumentCount = argumentCount;
  }

  public String predicate() {
    return predicate;
  }

  public int argumentCount() {
    return argumentCount;
  }
}
