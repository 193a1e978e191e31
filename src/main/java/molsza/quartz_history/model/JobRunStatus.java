package molsza.quartz_history.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a single firing. The display names are what providers store and
 * what gets serialized.
 */
public enum JobRunStatus {
  STARTED("Started"),
  SUCCESS("Success"),
  FAILED("Failed"),
  VETOED("Vetoed");

  private final String displayName;

  JobRunStatus(String displayName) {
    this.displayName = displayName;
  }

  @JsonValue
  public String getDisplayName() {
    return displayName;
  }

  @JsonCreator
  public static JobRunStatus fromDisplayName(String value) {
    if (value == null) {
      return null;
    }
    for (JobRunStatus status : values()) {
      if (status.displayName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job run status '" + value + "'");
  }

  public boolean isFinished() {
    return this != STARTED;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
