package io.github.simbo1905.drops;

/// Options threaded through compilation.
///
/// `atomize` is copied onto every map node the compiler produces. When set, string-keyed
/// input is normalized into the declared key namespace before the map is validated.
public record CompileOptions(boolean atomize) {

  /// System property consulted by [#fromSystemProperties()]
  public static final String ATOMIZE_PROPERTY = "drops.atomize";

  /// Default options with atomization disabled
  public static final CompileOptions DEFAULT = new CompileOptions(false);

  /// Options whose defaults come from system properties (read once per call)
  public static CompileOptions fromSystemProperties() {
    String prop = System.getProperty(ATOMIZE_PROPERTY);
    return prop == null ? DEFAULT : new CompileOptions(Boolean.parseBoolean(prop.trim()));
  }

  public CompileOptions withAtomize(boolean atomize) {
    return new CompileOptions(atomize);
  }

  String summary() {
    return "atomize=" + atomize;
  }
}
