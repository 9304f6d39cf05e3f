package io.github.simbo1905.drops;

/// A single human-readable validation problem.
///
/// `path` is a JSON Pointer style location of the offending value (`""` for the root,
/// `/user/tags/1` for a nested element).
public record ValidationError(String path, String message) {

  public ValidationError {
    if (message == null || message.isEmpty()) {
      throw new IllegalArgumentException("Error message cannot be null or empty");
    }
  }

  @Override
  public String toString() {
    return (path.isEmpty() ? "#" : path) + " " + message;
  }
}
