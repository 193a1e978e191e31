package molsza.quartz_history.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TriggerInfo {
  String name;
  String group;
  String description;
  /**
   * Only set for cron triggers.
   */
  String cronExpression;
  Instant nextFireTime;
  Instant previousFireTime;
  String state;
}
