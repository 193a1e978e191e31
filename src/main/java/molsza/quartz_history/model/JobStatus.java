package molsza.quartz_history.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStatus {
  ACTIVE("Active"),
  PAUSED("Paused"),
  NO_TRIGGERS("No Triggers");

  private final String displayName;

  JobStatus(String displayName) {
    this.displayName = displayName;
  }

  @JsonValue
  public String getDisplayName() {
    return displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
