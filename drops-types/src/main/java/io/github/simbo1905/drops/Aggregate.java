package io.github.simbo1905.drops;

import java.util.List;

/// Ordered per-member outcomes of a list or map validation.
///
/// The same record is carried by [Result.Ok] when every member succeeded and by
/// [Result.Err] when at least one failed. Successes and failures stay interleaved in
/// input order (list index order, or declared key order for maps) so a caller can tell
/// exactly which member failed.
public record Aggregate(Shape shape, List<Result> results) implements Failure {

  public enum Shape { LIST, MAP }

  public Aggregate {
    results = List.copyOf(results);
  }

  public boolean allOk() {
    return results.stream().allMatch(Result::isOk);
  }

  /// Wraps as `Ok` when every member succeeded, otherwise as `Err`
  Result toResult() {
    return allOk() ? Result.ok(this) : Result.err(this);
  }
}
