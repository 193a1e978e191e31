package molsza.quartz_history.listener;

import lombok.extern.slf4j.Slf4j;
import molsza.quartz_history.model.JobData;
import molsza.quartz_history.model.JobRun;
import molsza.quartz_history.model.JobRunStatus;
import molsza.quartz_history.run_store.JobRunStoreProvider;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.JobListener;
import org.quartz.SchedulerException;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Writes a run record for every firing: a {@code Started} record before the
 * job executes and the final outcome under the same id afterwards.
 * <p>
 * Recording never fails or delays a job beyond the save timeout. Saves run on
 * a separate executor; the completion save of a firing is chained after its
 * start save, so the final status always lands last. While the store lags
 * behind, at most a bounded number of saves wait; further records are dropped
 * and logged.
 */
@Slf4j
public class JobRunHistoryListener implements JobListener, AutoCloseable {
  public static final String NAME = "jobRunHistory";
  public static final String CATEGORY_KEY = "Category";
  public static final Duration DEFAULT_SAVE_TIMEOUT = Duration.ofSeconds(5);
  public static final int DEFAULT_QUEUE_CAPACITY = 1_000;

  static final String PENDING_SAVE_KEY = JobRunHistoryListener.class.getName() + ".pendingSave";
  static final String STARTED_RUN_KEY = JobRunHistoryListener.class.getName() + ".startedRun";

  private final JobRunStoreProvider provider;
  private final Duration saveTimeout;
  private final boolean recordVetoed;
  private final Clock clock;
  private final ThreadPoolExecutor executor;

  public JobRunHistoryListener(JobRunStoreProvider provider) {
    this(provider, DEFAULT_SAVE_TIMEOUT, false, Clock.systemUTC());
  }

  public JobRunHistoryListener(JobRunStoreProvider provider, Duration saveTimeout, boolean recordVetoed, Clock clock) {
    this(provider, saveTimeout, recordVetoed, clock, DEFAULT_QUEUE_CAPACITY);
  }

  /**
   * @param queueCapacity saves waiting for the store beyond this many are
   *                      dropped with a warning
   */
  public JobRunHistoryListener(JobRunStoreProvider provider, Duration saveTimeout, boolean recordVetoed, Clock clock,
                               int queueCapacity) {
    this.provider = provider;
    this.saveTimeout = saveTimeout == null ? DEFAULT_SAVE_TIMEOUT : saveTimeout;
    this.recordVetoed = recordVetoed;
    this.clock = clock;
    var threadFactory = new CustomizableThreadFactory("job-run-history-");
    threadFactory.setDaemon(true);
    this.executor = new ThreadPoolExecutor(2, 2, 0L, TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(Math.max(1, queueCapacity)), threadFactory, new ThreadPoolExecutor.AbortPolicy());
  }

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public void jobToBeExecuted(JobExecutionContext context) {
    try {
      JobRun run = startedRun(context);
      context.put(STARTED_RUN_KEY, run);
      CompletableFuture<Void> pending = submit(run);
      context.put(PENDING_SAVE_KEY, pending);
      await(pending, run);
    } catch (RuntimeException e) {
      log.error("Could not record start of job {}", context.getJobDetail().getKey(), e);
    }
  }

  @Override
  public void jobExecutionVetoed(JobExecutionContext context) {
    if (!recordVetoed) {
      log.debug("Job {} was vetoed, no run recorded", context.getJobDetail().getKey());
      return;
    }
    try {
      Instant now = clock.instant();
      JobRun run = startedRun(context).toBuilder()
          .status(JobRunStatus.VETOED)
          .startTime(now)
          .endTime(now)
          .runTimeMs(0L)
          .build();
      await(submit(run), run);
    } catch (RuntimeException e) {
      log.error("Could not record veto of job {}", context.getJobDetail().getKey(), e);
    }
  }

  @Override
  public void jobWasExecuted(JobExecutionContext context, JobExecutionException jobException) {
    try {
      JobRun run = completedRun(context, jobException);
      CompletableFuture<?> started = context.get(PENDING_SAVE_KEY) instanceof CompletableFuture
          ? (CompletableFuture<?>) context.get(PENDING_SAVE_KEY)
          : CompletableFuture.completedFuture(null);
      CompletableFuture<Void> pending = started
          .handle((v, e) -> null)
          .thenCompose(v -> submit(run));
      await(pending, run);
    } catch (RuntimeException e) {
      log.error("Could not record completion of job {}", context.getJobDetail().getKey(), e);
    }
  }

  JobRun startedRun(JobExecutionContext context) {
    Instant now = clock.instant();
    JobDataMap data = context.getMergedJobDataMap();
    Object category = data.get(CATEGORY_KEY);
    return JobRun.builder()
        .id(context.getFireInstanceId())
        .jobName(context.getJobDetail().getKey().getName())
        .jobGroup(context.getJobDetail().getKey().getGroup())
        .triggerName(context.getTrigger().getKey().getName())
        .triggerGroup(context.getTrigger().getKey().getGroup())
        .description(context.getJobDetail().getDescription())
        .scheduledTime(toInstant(context.getScheduledFireTime(), now))
        .startTime(toInstant(context.getFireTime(), now))
        .status(JobRunStatus.STARTED)
        .retryCount(context.getRefireCount())
        .data(JobData.snapshot(data.getWrappedMap()))
        .instanceName(instanceName(context))
        .priority(context.getTrigger().getPriority())
        .category(category == null ? null : category.toString())
        .build();
  }

  JobRun completedRun(JobExecutionContext context, JobExecutionException jobException) {
    JobRun started = context.get(STARTED_RUN_KEY) instanceof JobRun
        ? (JobRun) context.get(STARTED_RUN_KEY)
        : startedRun(context);
    Instant endTime = clock.instant();
    if (endTime.isBefore(started.getStartTime())) {
      endTime = started.getStartTime();
    }
    boolean failed = jobException != null;
    return started.toBuilder()
        .status(failed ? JobRunStatus.FAILED : JobRunStatus.SUCCESS)
        .endTime(endTime)
        .runTimeMs(Duration.between(started.getStartTime(), endTime).toMillis())
        .errorMessage(failed ? errorMessage(jobException) : null)
        .result(context.getResult() == null ? null : String.valueOf(context.getResult()))
        .retryCount(context.getRefireCount())
        .build();
  }

  int queuedSaves() {
    return executor.getQueue().size();
  }

  private CompletableFuture<Void> submit(JobRun run) {
    try {
      return CompletableFuture.runAsync(() -> save(run), executor);
    } catch (RejectedExecutionException e) {
      log.warn("Save queue is full, dropping run {} of job {}.{} ({})", run.getId(), run.getJobGroup(), run.getJobName(), run.getStatus());
      return CompletableFuture.failedFuture(e);
    }
  }

  private void save(JobRun run) {
    try {
      provider.saveJobRun(run);
    } catch (SchedulerException | RuntimeException e) {
      log.error("Saving run {} of job {}.{} ({}) failed", run.getId(), run.getJobGroup(), run.getJobName(), run.getStatus(), e);
    }
  }

  private void await(CompletableFuture<Void> pending, JobRun run) {
    try {
      pending.get(saveTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn("Saving run {} of job {}.{} ({}) takes longer than {}, continuing without waiting",
          run.getId(), run.getJobGroup(), run.getJobName(), run.getStatus(), saveTimeout);
    } catch (ExecutionException e) {
      log.debug("Run {} of job {}.{} was not saved", run.getId(), run.getJobGroup(), run.getJobName(), e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while saving run {} of job {}.{}", run.getId(), run.getJobGroup(), run.getJobName());
    }
  }

  private static String instanceName(JobExecutionContext context) {
    try {
      return context.getScheduler().getSchedulerInstanceId();
    } catch (SchedulerException | RuntimeException e) {
      log.debug("Scheduler instance id not available", e);
      return null;
    }
  }

  // "message: cause message", unless the message is only the wrapped cause
  static String errorMessage(JobExecutionException jobException) {
    Throwable cause = jobException.getCause();
    if (cause == null) {
      return messageOf(jobException);
    }
    String own = jobException.getMessage();
    if (own == null || own.equals(cause.toString())) {
      return messageOf(cause);
    }
    return own + ": " + messageOf(cause);
  }

  private static String messageOf(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
  }

  private static Instant toInstant(Date date, Instant fallback) {
    return date == null ? fallback : date.toInstant();
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(saveTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Pending job run saves did not finish within {}", saveTimeout);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }
}
