package io.github.simbo1905.drops;

import java.util.logging.Logger;

/// Centralized logger for the type compiler and validator.
/// All classes must use this logger via:
///   import static io.github.simbo1905.drops.DropsLogging.LOG;
final class DropsLogging {
  public static final Logger LOG = Logger.getLogger("io.github.simbo1905.drops");
  private DropsLogging() {}
}
