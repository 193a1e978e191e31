package molsza.quartz_history.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * One execution attempt of one job. Written twice under the same {@link #id}:
 * once as {@link JobRunStatus#STARTED} and once with the final outcome.
 */
@Value
@Builder(toBuilder = true)
public class JobRun {
  String id;
  String jobName;
  String jobGroup;
  String triggerName;
  String triggerGroup;
  String description;

  Instant scheduledTime;
  Instant startTime;
  Instant endTime;
  Long runTimeMs;

  JobRunStatus status;
  String errorMessage;
  String result;
  int retryCount;

  @Builder.Default
  Map<String, Object> data = Collections.emptyMap();
  String instanceName;
  Integer priority;
  String category;
}
