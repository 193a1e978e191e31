package molsza.quartz_history.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Optional filters for a run history lookup. Every non-null field narrows the
 * result; {@code startDate} and {@code endDate} both apply to the run start time.
 */
@Value
@Builder(toBuilder = true)
public class JobRunQuery {
  private static final JobRunQuery ALL = JobRunQuery.builder().build();

  Instant startDate;
  Instant endDate;
  JobRunStatus status;
  Integer priority;
  String instanceName;
  String resultContains;
  Integer take;

  public static JobRunQuery all() {
    return ALL;
  }

  public static JobRunQuery latest(int take) {
    return JobRunQuery.builder().take(take).build();
  }

  public boolean hasFilters() {
    return startDate != null || endDate != null || status != null || priority != null
        || instanceName != null || resultContains != null || take != null;
  }
}
