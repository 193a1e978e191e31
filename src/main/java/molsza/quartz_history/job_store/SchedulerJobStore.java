package molsza.quartz_history.job_store;

import lombok.extern.slf4j.Slf4j;
import molsza.quartz_history.model.JobInfo;
import molsza.quartz_history.model.JobRun;
import molsza.quartz_history.model.JobRunQuery;
import molsza.quartz_history.model.JobRunStats;
import molsza.quartz_history.model.JobStatus;
import molsza.quartz_history.model.TriggerInfo;
import molsza.quartz_history.run_store.JobRunStoreProvider;
import org.quartz.CronTrigger;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.Trigger.TriggerState;
import org.quartz.impl.matchers.GroupMatcher;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * {@link JobStore} over a Quartz scheduler and a {@link JobRunStoreProvider}.
 * The live scheduler decides which jobs exist; the provider only adds their
 * history. {@link #getJobs()} enriches the jobs concurrently on a bounded pool.
 */
@Slf4j
public class SchedulerJobStore implements JobStore, AutoCloseable {
  public static final int DEFAULT_PARALLELISM = 4;
  public static final String CATEGORY_KEY = "Category";

  private static final Comparator<JobKey> BY_GROUP_AND_NAME = Comparator
      .comparing(JobKey::getGroup)
      .thenComparing(JobKey::getName);

  private final SchedulerProvider schedulers;
  private final JobRunStoreProvider provider;
  private final ExecutorService enrichment;

  public SchedulerJobStore(SchedulerProvider schedulers, JobRunStoreProvider provider) {
    this(schedulers, provider, DEFAULT_PARALLELISM);
  }

  public SchedulerJobStore(SchedulerProvider schedulers, JobRunStoreProvider provider, int parallelism) {
    this.schedulers = schedulers;
    this.provider = provider;
    var threadFactory = new CustomizableThreadFactory("job-store-");
    threadFactory.setDaemon(true);
    this.enrichment = Executors.newFixedThreadPool(Math.max(1, parallelism), threadFactory);
  }

  @Override
  public List<JobInfo> getJobs() throws SchedulerException {
    log.debug("Getting jobs");
    Scheduler scheduler = schedulers.getScheduler();
    List<JobKey> jobKeys = new ArrayList<>(scheduler.getJobKeys(GroupMatcher.anyJobGroup()));
    jobKeys.sort(BY_GROUP_AND_NAME);

    List<Future<Optional<JobInfo>>> pending = new ArrayList<>(jobKeys.size());
    try {
      for (JobKey jobKey : jobKeys) {
        checkNotCancelled("get jobs");
        pending.add(enrichment.submit(() -> jobInfo(scheduler, jobKey)));
      }
      List<JobInfo> jobs = new ArrayList<>(pending.size());
      for (Future<Optional<JobInfo>> future : pending) {
        future.get().ifPresent(jobs::add);
      }
      return jobs;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Getting jobs was cancelled");
    } catch (ExecutionException e) {
      throw unwrap(e);
    } finally {
      pending.forEach(f -> f.cancel(true));
    }
  }

  @Override
  public Optional<JobInfo> getJob(String jobName, String jobGroup) throws SchedulerException {
    log.debug("Getting job (name={}, group={})", jobName, jobGroup);
    Optional<JobInfo> job = jobInfo(schedulers.getScheduler(), JobKey.jobKey(jobName, jobGroup));
    if (job.isEmpty()) {
      log.debug("Job not found (name={}, group={})", jobName, jobGroup);
    }
    return job;
  }

  @Override
  public List<JobRun> getJobRuns(String jobName, String jobGroup, JobRunQuery query) throws SchedulerException {
    log.debug("Getting job runs (name={}, group={})", jobName, jobGroup);
    JobRunQuery filter = query == null ? JobRunQuery.all() : query;
    logFilter(filter);
    return provider.getJobRuns(jobName, jobGroup, filter);
  }

  @Override
  public JobRunStats getJobRunStats(String jobName, String jobGroup, Instant startDate, Instant endDate) throws SchedulerException {
    log.debug("Getting job run stats (name={}, group={}, start={}, end={})", jobName, jobGroup, startDate, endDate);
    return provider.getJobRunStats(jobName, jobGroup, startDate, endDate);
  }

  @Override
  public List<TriggerInfo> getTriggers(String jobName, String jobGroup) throws SchedulerException {
    log.debug("Getting triggers (name={}, group={})", jobName, jobGroup);
    Scheduler scheduler = schedulers.getScheduler();
    return triggerInfos(scheduler, scheduler.getTriggersOfJob(JobKey.jobKey(jobName, jobGroup)));
  }

  @Override
  public JobStatus getJobStatus(String jobName, String jobGroup) throws SchedulerException {
    Scheduler scheduler = schedulers.getScheduler();
    List<TriggerState> states = new ArrayList<>();
    for (Trigger trigger : scheduler.getTriggersOfJob(JobKey.jobKey(jobName, jobGroup))) {
      states.add(scheduler.getTriggerState(trigger.getKey()));
    }
    return statusOf(states);
  }

  @Override
  public void saveJobRun(JobRun jobRun) throws SchedulerException {
    log.debug("Saving job run (name={}, group={}, id={})",
        jobRun == null ? null : jobRun.getJobName(),
        jobRun == null ? null : jobRun.getJobGroup(),
        jobRun == null ? null : jobRun.getId());
    provider.saveJobRun(jobRun);
  }

  @Override
  public void triggerJob(String jobName, String jobGroup, Map<String, Object> data) throws SchedulerException {
    log.debug("Triggering job (name={}, group={})", jobName, jobGroup);
    Scheduler scheduler = schedulers.getScheduler();
    checkNotCancelled("trigger job " + jobGroup + "." + jobName);
    scheduler.triggerJob(JobKey.jobKey(jobName, jobGroup), data == null ? new JobDataMap() : new JobDataMap(data));
  }

  @Override
  public void pauseJob(String jobName, String jobGroup) throws SchedulerException {
    log.debug("Pausing job (name={}, group={})", jobName, jobGroup);
    Scheduler scheduler = schedulers.getScheduler();
    checkNotCancelled("pause job " + jobGroup + "." + jobName);
    scheduler.pauseJob(JobKey.jobKey(jobName, jobGroup));
  }

  @Override
  public void resumeJob(String jobName, String jobGroup) throws SchedulerException {
    log.debug("Resuming job (name={}, group={})", jobName, jobGroup);
    Scheduler scheduler = schedulers.getScheduler();
    checkNotCancelled("resume job " + jobGroup + "." + jobName);
    scheduler.resumeJob(JobKey.jobKey(jobName, jobGroup));
  }

  @Override
  public boolean interruptJob(String jobName, String jobGroup) throws SchedulerException {
    log.debug("Interrupting job (name={}, group={})", jobName, jobGroup);
    Scheduler scheduler = schedulers.getScheduler();
    checkNotCancelled("interrupt job " + jobGroup + "." + jobName);
    return scheduler.interrupt(JobKey.jobKey(jobName, jobGroup));
  }

  @Override
  public long purgeJobRuns(String jobName, String jobGroup, Instant olderThan) throws SchedulerException {
    log.debug("Purging job runs (name={}, group={}, olderThan={})", jobName, jobGroup, olderThan);
    return provider.purgeJobRuns(jobName, jobGroup, olderThan);
  }

  @Override
  public boolean keepsRunHistory() {
    return provider.keepsHistory();
  }

  /**
   * No triggers gives {@link JobStatus#NO_TRIGGERS}, only paused triggers
   * {@link JobStatus#PAUSED}, anything else {@link JobStatus#ACTIVE}.
   */
  static JobStatus statusOf(Collection<TriggerState> states) {
    if (states.isEmpty()) {
      return JobStatus.NO_TRIGGERS;
    }
    return states.stream().allMatch(s -> s == TriggerState.PAUSED) ? JobStatus.PAUSED : JobStatus.ACTIVE;
  }

  static String displayName(TriggerState state) {
    if (state == null) {
      return null;
    }
    String name = state.name();
    return name.charAt(0) + name.substring(1).toLowerCase();
  }

  private Optional<JobInfo> jobInfo(Scheduler scheduler, JobKey jobKey) throws SchedulerException {
    JobDetail detail = scheduler.getJobDetail(jobKey);
    if (detail == null) {
      return Optional.empty();
    }
    List<? extends Trigger> triggers = scheduler.getTriggersOfJob(jobKey);
    List<TriggerState> states = new ArrayList<>(triggers.size());
    List<TriggerInfo> triggerInfos = new ArrayList<>(triggers.size());
    for (Trigger trigger : triggers) {
      TriggerState state = scheduler.getTriggerState(trigger.getKey());
      states.add(state);
      triggerInfos.add(triggerInfo(trigger, state));
    }

    List<JobRun> latest = provider.getJobRuns(jobKey.getName(), jobKey.getGroup(), JobRunQuery.latest(1));
    JobRunStats stats = provider.getJobRunStats(jobKey.getName(), jobKey.getGroup(), null, null);
    Object category = detail.getJobDataMap().get(CATEGORY_KEY);

    return Optional.of(JobInfo.builder()
        .name(jobKey.getName())
        .group(jobKey.getGroup())
        .description(detail.getDescription())
        .type(detail.getJobClass().getName())
        .status(statusOf(states))
        .triggerCount(triggers.size())
        .category(category == null ? null : category.toString())
        .lastRun(latest.isEmpty() ? null : latest.get(0))
        .lastRunStats(stats)
        .triggers(triggerInfos)
        .build());
  }

  private static List<TriggerInfo> triggerInfos(Scheduler scheduler, List<? extends Trigger> triggers) throws SchedulerException {
    List<TriggerInfo> result = new ArrayList<>(triggers.size());
    for (Trigger trigger : triggers) {
      result.add(triggerInfo(trigger, scheduler.getTriggerState(trigger.getKey())));
    }
    return result;
  }

  private static TriggerInfo triggerInfo(Trigger trigger, TriggerState state) {
    return TriggerInfo.builder()
        .name(trigger.getKey().getName())
        .group(trigger.getKey().getGroup())
        .description(trigger.getDescription())
        .cronExpression(trigger instanceof CronTrigger ? ((CronTrigger) trigger).getCronExpression() : null)
        .nextFireTime(toInstant(trigger.getNextFireTime()))
        .previousFireTime(toInstant(trigger.getPreviousFireTime()))
        .state(displayName(state))
        .build();
  }

  private static void logFilter(JobRunQuery filter) {
    if (!log.isDebugEnabled() || !filter.hasFilters()) {
      return;
    }
    log.debug("Job run filter (start={}, end={}, status={}, priority={}, instanceName={}, resultContains={}, take={})",
        filter.getStartDate(), filter.getEndDate(), filter.getStatus(), filter.getPriority(),
        filter.getInstanceName(), filter.getResultContains(), filter.getTake());
  }

  private static void checkNotCancelled(String operation) {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Cancelled before " + operation);
    }
  }

  private static SchedulerException unwrap(ExecutionException e) {
    Throwable cause = e.getCause();
    if (cause instanceof SchedulerException) {
      return (SchedulerException) cause;
    }
    if (cause instanceof RuntimeException) {
      throw (RuntimeException) cause;
    }
    if (cause instanceof Error) {
      throw (Error) cause;
    }
    return new SchedulerException("Enriching jobs failed", cause);
  }

  private static Instant toInstant(Date date) {
    return date == null ? null : date.toInstant();
  }

  @Override
  public void close() {
    enrichment.shutdownNow();
  }
}
