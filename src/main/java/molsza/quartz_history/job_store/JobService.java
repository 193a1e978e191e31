package molsza.quartz_history.job_store;

import lombok.extern.slf4j.Slf4j;
import molsza.quartz_history.model.JobInfo;
import molsza.quartz_history.model.JobRun;
import molsza.quartz_history.model.JobRunQuery;
import molsza.quartz_history.model.JobRunStats;
import molsza.quartz_history.model.JobRunStatus;
import molsza.quartz_history.model.TriggerInfo;
import org.quartz.JobKey;
import org.quartz.SchedulerException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Caller facing operations on top of a {@link JobStore}: argument checks,
 * the default group, live run times for running jobs and triggering several
 * jobs at once, optionally waiting for their outcome.
 */
@Slf4j
public class JobService {
  public static final String DEFAULT_GROUP = JobKey.DEFAULT_GROUP;
  public static final String CORRELATION_ID_KEY = "CorrelationId";
  public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofSeconds(1);
  public static final Duration MIN_CHECK_INTERVAL = Duration.ofMillis(100);
  public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofMinutes(10);

  private final JobStore store;
  private final Clock clock;

  public JobService(JobStore store) {
    this(store, Clock.systemUTC());
  }

  public JobService(JobStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  public List<JobInfo> getJobs() throws SchedulerException {
    return store.getJobs();
  }

  public Optional<JobInfo> getJob(String jobName, String jobGroup) throws SchedulerException {
    return store.getJob(requireName(jobName), group(jobGroup));
  }

  /**
   * Same as {@link JobStore#getJobRuns}, except that runs still in progress
   * report the time elapsed so far as their run time.
   */
  public List<JobRun> getJobRuns(String jobName, String jobGroup, JobRunQuery query) throws SchedulerException {
    Instant now = clock.instant();
    return store.getJobRuns(requireName(jobName), group(jobGroup), query).stream()
        .map(run -> run.getStatus() == JobRunStatus.STARTED && run.getStartTime() != null
            ? run.toBuilder().runTimeMs(Math.max(0, Duration.between(run.getStartTime(), now).toMillis())).build()
            : run)
        .collect(Collectors.toList());
  }

  public JobRunStats getJobRunStats(String jobName, String jobGroup, Instant startDate, Instant endDate) throws SchedulerException {
    return store.getJobRunStats(requireName(jobName), group(jobGroup), startDate, endDate);
  }

  public List<TriggerInfo> getTriggers(String jobName, String jobGroup) throws SchedulerException {
    return store.getTriggers(requireName(jobName), group(jobGroup));
  }

  public void saveJobRun(JobRun jobRun) throws SchedulerException {
    if (jobRun == null) {
      throw new IllegalArgumentException("jobRun must not be null");
    }
    store.saveJobRun(jobRun);
  }

  public void triggerJob(String jobName, String jobGroup, Map<String, Object> data) throws SchedulerException {
    store.triggerJob(requireName(jobName), group(jobGroup), data);
  }

  /**
   * Triggers every named job. All firings carry the same generated
   * {@value #CORRELATION_ID_KEY}; {@code data} is applied on top of the
   * job specific entries of {@code jobData}.
   *
   * @return the correlation id
   */
  public String triggerJobs(Collection<String> jobNames, String jobGroup, Map<String, Object> data,
                            Map<String, Map<String, Object>> jobData) throws SchedulerException {
    Set<String> names = requireNames(jobNames);
    String correlationId = newCorrelationId();
    log.debug("Triggering {} jobs of group {} (correlationId={})", names.size(), group(jobGroup), correlationId);
    for (String jobName : names) {
      store.triggerJob(jobName, group(jobGroup), firingData(jobName, data, jobData, correlationId));
    }
    return correlationId;
  }

  /**
   * Triggers the job and polls it until the firing has finished. Without a
   * run history there is nothing to follow, so the job is returned right
   * after triggering.
   *
   * @return the job as seen after the firing finished
   * @throws TimeoutException if the firing did not finish within {@code timeout}
   */
  public JobInfo triggerJobAndWait(String jobName, String jobGroup, Map<String, Object> data,
                                   Duration checkInterval, Duration timeout)
      throws SchedulerException, TimeoutException, InterruptedException {
    String name = requireName(jobName);
    String group = group(jobGroup);
    Duration interval = checkInterval(checkInterval);
    Duration limit = timeout == null ? DEFAULT_WAIT_TIMEOUT : timeout;
    Instant deadline = clock.instant().plus(limit);

    Instant triggeredAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    store.triggerJob(name, group, data);
    if (!store.keepsRunHistory()) {
      log.warn("No job run history kept, not waiting for job {}.{}", group, name);
      return requireJob(name, group);
    }
    log.debug("Waiting for job {}.{} (checkInterval={}, timeout={})", group, name, interval, limit);

    while (true) {
      JobInfo job = requireJob(name, group);
      if (finishedSince(job, triggeredAt)) {
        log.debug("Job {}.{} finished with {}", group, name, job.getLastRun().getStatus());
        return job;
      }
      if (!clock.instant().isBefore(deadline)) {
        throw new TimeoutException("Job " + group + "." + name + " did not finish within " + limit);
      }
      Thread.sleep(interval.toMillis());
    }
  }

  /**
   * Triggers the named jobs and waits for all of them. Sequentially, each job
   * is triggered after the previous one finished and a failure stops the
   * sequence unless {@code continueOnFailed}. Otherwise all jobs are
   * triggered at once and awaited together.
   *
   * @return the jobs as seen after their firings finished, keyed by job name
   */
  public Map<String, JobInfo> triggerJobsAndWait(Collection<String> jobNames, String jobGroup, Map<String, Object> data,
                                                 Map<String, Map<String, Object>> jobData, boolean sequentially,
                                                 boolean continueOnFailed, Duration checkInterval, Duration timeout)
      throws SchedulerException, TimeoutException, InterruptedException {
    Set<String> names = requireNames(jobNames);
    String group = group(jobGroup);
    Duration interval = checkInterval(checkInterval);
    Duration limit = timeout == null ? DEFAULT_WAIT_TIMEOUT : timeout;
    String correlationId = newCorrelationId();
    Map<String, JobInfo> results = new LinkedHashMap<>();

    if (sequentially) {
      for (String name : names) {
        JobInfo job = triggerJobAndWait(name, group, firingData(name, data, jobData, correlationId), interval, limit);
        results.put(name, job);
        if (!continueOnFailed && failed(job)) {
          log.debug("Job {}.{} failed, not triggering the remaining jobs (correlationId={})", group, name, correlationId);
          return results;
        }
      }
      return results;
    }

    Instant deadline = clock.instant().plus(limit);
    Instant triggeredAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
    for (String name : names) {
      store.triggerJob(name, group, firingData(name, data, jobData, correlationId));
    }
    Set<String> running = new LinkedHashSet<>(names);
    if (!store.keepsRunHistory()) {
      log.warn("No job run history kept, not waiting for jobs {} of group {}", names, group);
      for (String name : names) {
        results.put(name, requireJob(name, group));
      }
      running.clear();
    }
    while (!running.isEmpty()) {
      for (String name : List.copyOf(running)) {
        JobInfo job = requireJob(name, group);
        if (finishedSince(job, triggeredAt)) {
          results.put(name, job);
          running.remove(name);
        }
      }
      if (running.isEmpty()) {
        break;
      }
      if (!clock.instant().isBefore(deadline)) {
        throw new TimeoutException("Jobs " + running + " of group " + group + " did not finish within " + limit);
      }
      Thread.sleep(interval.toMillis());
    }

    Map<String, JobInfo> ordered = new LinkedHashMap<>();
    names.forEach(name -> ordered.put(name, results.get(name)));
    return ordered;
  }

  public boolean interruptJob(String jobName, String jobGroup) throws SchedulerException {
    return store.interruptJob(requireName(jobName), group(jobGroup));
  }

  public void pauseJob(String jobName, String jobGroup) throws SchedulerException {
    store.pauseJob(requireName(jobName), group(jobGroup));
  }

  public void resumeJob(String jobName, String jobGroup) throws SchedulerException {
    store.resumeJob(requireName(jobName), group(jobGroup));
  }

  /**
   * @param olderThan purge runs started before this instant, {@code null} for now
   */
  public long purgeJobRuns(String jobName, String jobGroup, Instant olderThan) throws SchedulerException {
    return store.purgeJobRuns(requireName(jobName), group(jobGroup), olderThan == null ? clock.instant() : olderThan);
  }

  private JobInfo requireJob(String name, String group) throws SchedulerException {
    return store.getJob(name, group)
        .orElseThrow(() -> new IllegalStateException("Job " + group + "." + name + " not found after triggering"));
  }

  private static boolean failed(JobInfo job) {
    return job.getLastRun() != null && job.getLastRun().getStatus() == JobRunStatus.FAILED;
  }

  private static boolean finishedSince(JobInfo job, Instant triggeredAt) {
    JobRun lastRun = job.getLastRun();
    return lastRun != null
        && lastRun.getStartTime() != null
        && !lastRun.getStartTime().isBefore(triggeredAt)
        && lastRun.getStatus() != JobRunStatus.STARTED;
  }

  private static Map<String, Object> firingData(String jobName, Map<String, Object> data,
                                                Map<String, Map<String, Object>> jobData, String correlationId) {
    Map<String, Object> merged = new HashMap<>();
    if (jobData != null && jobData.get(jobName) != null) {
      merged.putAll(jobData.get(jobName));
    }
    if (data != null) {
      merged.putAll(data);
    }
    merged.put(CORRELATION_ID_KEY, correlationId);
    return merged;
  }

  private static Duration checkInterval(Duration checkInterval) {
    Duration interval = checkInterval == null ? DEFAULT_CHECK_INTERVAL : checkInterval;
    if (interval.compareTo(MIN_CHECK_INTERVAL) < 0) {
      throw new IllegalArgumentException("checkInterval must be at least " + MIN_CHECK_INTERVAL.toMillis() + "ms");
    }
    return interval;
  }

  private static Set<String> requireNames(Collection<String> jobNames) {
    if (jobNames == null || jobNames.isEmpty()) {
      throw new IllegalArgumentException("At least one job name must be provided");
    }
    Set<String> names = new LinkedHashSet<>();
    jobNames.forEach(name -> names.add(requireName(name)));
    return names;
  }

  private static String requireName(String jobName) {
    if (jobName == null || jobName.isBlank()) {
      throw new IllegalArgumentException("jobName must not be empty");
    }
    return jobName;
  }

  private static String group(String jobGroup) {
    return jobGroup == null ? DEFAULT_GROUP : jobGroup;
  }

  private static String newCorrelationId() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}
