package molsza.quartz_history.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class JobRunStats {
  private static final JobRunStats EMPTY = JobRunStats.builder().build();

  long totalRuns;
  long successCount;
  long failureCount;
  double avgRunTimeMs;
  long maxRunTimeMs;
  long minRunTimeMs;

  public static JobRunStats empty() {
    return EMPTY;
  }
}
