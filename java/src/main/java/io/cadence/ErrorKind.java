package io.cadence;

/** The kind of error raised by cadence. */
public enum ErrorKind {
  /** Invalid rule options, out-of-range constraint values or an unsupported option. */
  CONFIG("config"),
  /** Two dates with different timezone labels were compared. */
  COMPARISON("comparison"),
  /** A rule or operator could not converge on its next value within its iteration bound. */
  NON_CONVERGENCE("non-convergence"),
  /** Calendar arithmetic produced a date that does not exist. */
  INVALID_DATE("invalid-date");

  private final String displayName;

  ErrorKind(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
