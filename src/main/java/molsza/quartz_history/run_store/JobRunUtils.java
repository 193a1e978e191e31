package molsza.quartz_history.run_store;

import molsza.quartz_history.model.JobRun;
import molsza.quartz_history.model.JobRunStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between {@link JobRun} and the stored {@link JobRunDocument}.
 */
public final class JobRunUtils {

  private JobRunUtils() {
  }

  /**
   * Rejects runs a provider cannot key or order.
   *
   * @throws JobRunStoreException if the id, job key or start time is missing
   */
  public static void checkSavable(JobRun jobRun) throws JobRunStoreException {
    if (jobRun == null) {
      throw new JobRunStoreException("Job run must not be null");
    }
    if (jobRun.getId() == null || jobRun.getJobName() == null || jobRun.getJobGroup() == null) {
      throw new JobRunStoreException("Job run " + jobRun.getId() + " needs an id, a job name and a job group");
    }
    if (jobRun.getStartTime() == null) {
      throw new JobRunStoreException("Job run " + jobRun.getId() + " has no start time");
    }
  }

  public static JobRunDocument toDocument(JobRun jobRun) {
    JobRunDocument document = new JobRunDocument();
    document.setId(jobRun.getId());
    document.setJobName(jobRun.getJobName());
    document.setJobGroup(jobRun.getJobGroup());
    document.setTriggerName(jobRun.getTriggerName());
    document.setTriggerGroup(jobRun.getTriggerGroup());
    document.setDescription(jobRun.getDescription());
    document.setScheduledTime(toMillis(jobRun.getScheduledTime() != null ? jobRun.getScheduledTime() : jobRun.getStartTime()));
    document.setStartTime(toMillis(jobRun.getStartTime()));
    document.setEndTime(jobRun.getEndTime() == null ? null : toMillis(jobRun.getEndTime()));
    document.setRunTimeMs(jobRun.getRunTimeMs());
    document.setStatus(jobRun.getStatus() == null ? null : jobRun.getStatus().getDisplayName());
    document.setErrorMessage(jobRun.getErrorMessage());
    document.setResult(jobRun.getResult());
    document.setRetryCount(jobRun.getRetryCount());
    document.setDataMap(toStoredData(jobRun.getData()));
    document.setInstanceName(jobRun.getInstanceName());
    document.setPriority(jobRun.getPriority());
    document.setCategory(jobRun.getCategory());
    return document;
  }

  public static JobRun fromDocument(JobRunDocument document) {
    return JobRun.builder()
        .id(document.getId())
        .jobName(document.getJobName())
        .jobGroup(document.getJobGroup())
        .triggerName(document.getTriggerName())
        .triggerGroup(document.getTriggerGroup())
        .description(document.getDescription())
        .scheduledTime(Instant.ofEpochMilli(document.getScheduledTime()))
        .startTime(Instant.ofEpochMilli(document.getStartTime()))
        .endTime(document.getEndTime() == null ? null : Instant.ofEpochMilli(document.getEndTime()))
        .runTimeMs(document.getRunTimeMs())
        .status(JobRunStatus.fromDisplayName(document.getStatus()))
        .errorMessage(document.getErrorMessage())
        .result(document.getResult())
        .retryCount(document.getRetryCount())
        .data(document.getDataMap() == null ? Collections.emptyMap() : Collections.unmodifiableMap(document.getDataMap()))
        .instanceName(document.getInstanceName())
        .priority(document.getPriority())
        .category(document.getCategory())
        .build();
  }

  // instants are kept as ISO-8601 text, the stored data is schemaless
  private static Map<String, Object> toStoredData(Map<String, Object> data) {
    if (data == null || data.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, Object> stored = new LinkedHashMap<>();
    data.forEach((key, value) -> stored.put(key, value instanceof Instant ? value.toString() : value));
    return stored;
  }

  private static long toMillis(Instant instant) {
    return instant == null ? 0 : instant.toEpochMilli();
  }
}
