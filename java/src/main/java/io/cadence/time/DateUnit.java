package io.cadence.time;

/** Calendar units understood by {@link DateTime} arithmetic and truncation. */
public enum DateUnit {
  YEAR("year", 0),
  MONTH("month", 0),
  WEEK("week", 7L * 24 * 60 * 60 * 1000),
  DAY("day", 24L * 60 * 60 * 1000),
  HOUR("hour", 60L * 60 * 1000),
  MINUTE("minute", 60L * 1000),
  SECOND("second", 1000),
  MILLISECOND("millisecond", 1);

  private final String displayName;
  private final long millis;

  DateUnit(String displayName, long millis) {
    this.displayName = displayName;
    this.millis = millis;
  }

  /**
   * Returns true if every instance of this unit spans the same number of milliseconds.
   *
   * @return whether the unit has a fixed length
   */
  public boolean isFixedLength() {
    return millis > 0;
  }

  /**
   * Returns the length of this unit in milliseconds.
   *
   * @return the length in milliseconds
   * @throws IllegalStateException for years and months
   */
  public long millis() {
    if (millis == 0) {
      throw new IllegalStateException(displayName + " has no fixed length");
    }
    return millis;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
