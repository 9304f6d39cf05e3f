package io.github.simbo1905.drops;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/// Flattens a [Result] into [ValidationError]s in result order.
///
/// Messages are rebuilt from the failure records alone; no predicate is evaluated again.
public final class ErrorMessages {

  private ErrorMessages() {}

  /// Empty for an `Ok` result
  public static List<ValidationError> render(Result result) {
    List<ValidationError> out = new ArrayList<>();
    collect(result, "", out);
    return List.copyOf(out);
  }

  public static List<ValidationError> render(Failure failure) {
    List<ValidationError> out = new ArrayList<>();
    collect(failure, "", out);
    return List.copyOf(out);
  }

  static void collect(Result result, String path, List<ValidationError> out) {
    if (result instanceof Result.Err err) {
      collect(err.failure(), path, out);
    }
  }

  static void collect(Failure failure, String path, List<ValidationError> out) {
    if (failure instanceof Failure.ConstraintFailure cf) {
      out.add(new ValidationError(path, Message.render(cf)));
    } else if (failure instanceof Failure.MissingKey mk) {
      out.add(new ValidationError(path + pointer(mk.path()), Message.MISSING_KEY.format()));
    } else if (failure instanceof Failure.KeyFailure kf) {
      collect(kf.cause(), path + pointer(kf.path()), out);
    } else if (failure instanceof Aggregate agg) {
      List<Result> results = agg.results();
      for (int i = 0; i < results.size(); i++) {
        // map members carry their own key path, list members are addressed by index
        String memberPath = agg.shape() == Aggregate.Shape.LIST ? path + "/" + i : path;
        collect(results.get(i), memberPath, out);
      }
    } else if (failure instanceof Failure.AlternativeFailure alt) {
      out.add(new ValidationError(path, side(alt.left(), path) + " or " + side(alt.right(), path)));
    }
  }

  /// One branch of a union, messages relative to the union's own location
  private static String side(Result.Err err, String path) {
    List<ValidationError> errors = new ArrayList<>();
    collect(err.failure(), path, errors);
    return errors.stream()
        .map(e -> e.path().equals(path) ? e.message() : e.path().substring(path.length()) + " " + e.message())
        .collect(Collectors.joining(", "));
  }

  /// RFC 6901 escaped pointer suffix for a key path
  static String pointer(List<Object> segments) {
    StringBuilder sb = new StringBuilder();
    for (Object segment : segments) {
      String token = String.valueOf(Symbol.stringify(segment));
      sb.append('/').append(token.replace("~", "~0").replace("/", "~1"));
    }
    return sb.toString();
  }
}
