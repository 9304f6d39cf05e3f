package io.github.simbo1905.drops;

import java.util.List;
import java.util.Objects;

/// A compiled type bound to the validator for the registry it was compiled against.
///
/// Compile once and reuse; a schema is immutable and thread-safe.
public record Schema(TypeNode root, Validator validator) {

  public Schema {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(validator, "validator");
  }

  public Result validate(Object input) {
    return validator.validate(root, input);
  }

  public boolean isValid(Object input) {
    return validate(input).isOk();
  }

  /// Human-readable errors for `input`, empty when it is valid
  public List<ValidationError> errors(Object input) {
    return ErrorMessages.render(validate(input));
  }
}
