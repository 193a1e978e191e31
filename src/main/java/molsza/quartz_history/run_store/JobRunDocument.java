package molsza.quartz_history.run_store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

/**
 * Stored shape of a run record. Timestamps are epoch milliseconds.
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobRunDocument {
  private String id;
  private String jobName;
  private String jobGroup;
  private String triggerName;
  private String triggerGroup;
  private String description;
  private long scheduledTime;
  private long startTime;
  private Long endTime;
  private Long runTimeMs;
  private String status;
  private String errorMessage;
  private String result;
  private int retryCount;
  private Map<String, Object> dataMap;
  private String instanceName;
  private Integer priority;
  private String category;
}
