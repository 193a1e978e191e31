package molsza.quartz_history.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Point in time view of a registered job: structure and trigger state come
 * from the live scheduler, {@link #lastRun} and {@link #lastRunStats} from the
 * run history.
 */
@Value
@Builder
public class JobInfo {
  String name;
  String group;
  String description;
  String type;
  JobStatus status;
  int triggerCount;
  String category;
  JobRun lastRun;
  JobRunStats lastRunStats;
  @Singular
  List<TriggerInfo> triggers;
}
