package molsza.quartz_history.job_store;

import molsza.quartz_history.listener.JobRunHistoryListener;
import molsza.quartz_history.model.JobInfo;
import molsza.quartz_history.model.JobRun;
import molsza.quartz_history.model.JobRunQuery;
import molsza.quartz_history.model.JobRunStatus;
import molsza.quartz_history.model.JobStatus;
import molsza.quartz_history.model.TriggerInfo;
import molsza.quartz_history.run_store.InMemoryJobRunStoreProvider;
import molsza.quartz_history.run_store.JobRunStoreException;
import molsza.quartz_history.run_store.JobRunStoreProvider;
import molsza.quartz_history.run_store.NullJobRunStoreProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.CronScheduleBuilder;
import org.quartz.InterruptableJob;
import org.quartz.Job;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.Trigger.TriggerState;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static molsza.quartz_history.run_store.JobRuns.finished;
import static molsza.quartz_history.run_store.JobRuns.started;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SchedulerJobStoreTest {

  private Scheduler scheduler;
  private InMemoryJobRunStoreProvider provider;
  private SchedulerJobStore store;

  @BeforeEach
  void setUp() throws Exception {
    scheduler = Schedulers.ramScheduler();
    provider = new InMemoryJobRunStoreProvider();
    store = new SchedulerJobStore(() -> scheduler, provider, 2);
  }

  @AfterEach
  void tearDown() throws Exception {
    store.close();
    scheduler.shutdown();
  }

  @Test
  void statusFollowsTriggerStates() throws Exception {
    schedule("Export", "Reports", "daily", "weekly");
    assertThat(store.getJobStatus("Export", "Reports")).isEqualTo(JobStatus.ACTIVE);

    scheduler.pauseTrigger(TriggerKey.triggerKey("daily", "Reports"));
    assertThat(store.getJobStatus("Export", "Reports")).isEqualTo(JobStatus.ACTIVE);

    scheduler.pauseTrigger(TriggerKey.triggerKey("weekly", "Reports"));
    assertThat(store.getJobStatus("Export", "Reports")).isEqualTo(JobStatus.PAUSED);
    assertThat(store.getTriggers("Export", "Reports"))
        .extracting(TriggerInfo::getState)
        .containsOnly("Paused");

    store.resumeJob("Export", "Reports");
    assertThat(store.getJobStatus("Export", "Reports")).isEqualTo(JobStatus.ACTIVE);
  }

  @Test
  void durableJobWithoutTriggersHasNoTriggersStatus() throws Exception {
    scheduler.addJob(JobBuilder.newJob(NoopJob.class).withIdentity("Cleanup", "Maintenance").storeDurably().build(), false);

    assertThat(store.getJobStatus("Cleanup", "Maintenance")).isEqualTo(JobStatus.NO_TRIGGERS);
    assertThat(store.getJob("Cleanup", "Maintenance")).hasValueSatisfying(job -> {
      assertThat(job.getStatus()).isEqualTo(JobStatus.NO_TRIGGERS);
      assertThat(job.getTriggerCount()).isZero();
      assertThat(job.getTriggers()).isEmpty();
    });
  }

  @Test
  void statusDerivation() {
    assertThat(SchedulerJobStore.statusOf(List.of())).isEqualTo(JobStatus.NO_TRIGGERS);
    assertThat(SchedulerJobStore.statusOf(List.of(TriggerState.PAUSED, TriggerState.PAUSED))).isEqualTo(JobStatus.PAUSED);
    assertThat(SchedulerJobStore.statusOf(List.of(TriggerState.PAUSED, TriggerState.BLOCKED))).isEqualTo(JobStatus.ACTIVE);
    assertThat(SchedulerJobStore.statusOf(List.of(TriggerState.ERROR))).isEqualTo(JobStatus.ACTIVE);
    assertThat(SchedulerJobStore.displayName(TriggerState.NORMAL)).isEqualTo("Normal");
  }

  @Test
  void historyOfRemovedJobIsNotAJob() throws Exception {
    Instant start = Instant.now().minusSeconds(60);
    provider.saveJobRun(finished(started("r1", "Ghost", "Reports", start), JobRunStatus.SUCCESS, 10));

    assertThat(store.getJob("Ghost", "Reports")).isEmpty();
    assertThat(store.getJobs()).isEmpty();
    assertThat(store.getJobRuns("Ghost", "Reports", JobRunQuery.all())).hasSize(1);
  }

  @Test
  void jobsAreListedByGroupAndNameWithHistory() throws Exception {
    schedule("Export", "Reports", "daily");
    schedule("Archive", "Reports", "nightly");
    schedule("Cleanup", "Maintenance", "hourly");
    Instant start = Instant.now().minusSeconds(60);
    provider.saveJobRun(finished(started("r1", "Export", "Reports", start), JobRunStatus.SUCCESS, 10));
    provider.saveJobRun(finished(started("r2", "Export", "Reports", start.plusSeconds(5)), JobRunStatus.FAILED, 30));

    List<JobInfo> jobs = store.getJobs();

    assertThat(jobs).extracting(JobInfo::getGroup, JobInfo::getName).containsExactly(
        tuple("Maintenance", "Cleanup"),
        tuple("Reports", "Archive"),
        tuple("Reports", "Export"));
    JobInfo export = jobs.get(2);
    assertThat(export.getType()).isEqualTo(NoopJob.class.getName());
    assertThat(export.getCategory()).isEqualTo("reporting");
    assertThat(export.getStatus()).isEqualTo(JobStatus.ACTIVE);
    assertThat(export.getLastRun().getId()).isEqualTo("r2");
    assertThat(export.getLastRunStats().getTotalRuns()).isEqualTo(2);
    assertThat(export.getLastRunStats().getFailureCount()).isEqualTo(1);
    assertThat(export.getTriggers()).singleElement().satisfies(trigger -> {
      assertThat(trigger.getName()).isEqualTo("daily");
      assertThat(trigger.getCronExpression()).isEqualTo("0 0 3 * * ?");
      assertThat(trigger.getNextFireTime()).isNotNull();
      assertThat(trigger.getState()).isEqualTo("Normal");
    });
    assertThat(jobs.get(1).getLastRun()).isNull();
  }

  @Test
  void nonCronTriggersHaveNoCronExpression() throws Exception {
    JobDetail job = JobBuilder.newJob(NoopJob.class).withIdentity("Ping", "Health").build();
    scheduler.scheduleJob(job, TriggerBuilder.newTrigger()
        .withIdentity("every-minute", "Health")
        .withSchedule(SimpleScheduleBuilder.repeatMinutelyForever())
        .build());

    assertThat(store.getTriggers("Ping", "Health")).singleElement()
        .satisfies(trigger -> assertThat(trigger.getCronExpression()).isNull());
  }

  @Test
  void worksWithoutHistory() throws Exception {
    schedule("Export", "Reports", "daily");
    try (SchedulerJobStore withoutHistory = new SchedulerJobStore(() -> scheduler, new NullJobRunStoreProvider())) {
      assertThat(withoutHistory.getJobs()).singleElement().satisfies(job -> {
        assertThat(job.getLastRun()).isNull();
        assertThat(job.getLastRunStats().getTotalRuns()).isZero();
      });
      assertThat(withoutHistory.getJob("Export", "Reports")).isPresent();
      assertThat(withoutHistory.getJobRuns("Export", "Reports", JobRunQuery.all())).isEmpty();
      assertThat(withoutHistory.getJobRunStats("Export", "Reports", null, null).getTotalRuns()).isZero();
      withoutHistory.saveJobRun(finished(started("r1", "Export", "Reports", Instant.now()), JobRunStatus.SUCCESS, 10));
      assertThat(withoutHistory.purgeJobRuns("Export", "Reports", Instant.now())).isZero();
      assertThat(withoutHistory.getJobRuns("Export", "Reports", null)).isEmpty();
    }
  }

  @Test
  void providerFailuresPropagate() throws Exception {
    schedule("Export", "Reports", "daily");
    JobRunStoreProvider failing = mock(JobRunStoreProvider.class);
    when(failing.getJobRuns(eq("Export"), eq("Reports"), any())).thenThrow(new JobRunStoreException("history unavailable"));
    try (SchedulerJobStore failingStore = new SchedulerJobStore(() -> scheduler, failing)) {
      assertThatThrownBy(() -> failingStore.getJob("Export", "Reports"))
          .isInstanceOf(JobRunStoreException.class)
          .hasMessage("history unavailable");
      assertThatThrownBy(failingStore::getJobs)
          .isInstanceOf(JobRunStoreException.class);
    }
  }

  @Test
  void missingSchedulerIsReported() {
    try (SchedulerJobStore unavailable = new SchedulerJobStore(() -> {
      throw new SchedulerException("No Quartz scheduler available");
    }, provider)) {
      assertThatThrownBy(unavailable::getJobs)
          .isInstanceOf(SchedulerException.class)
          .hasMessage("No Quartz scheduler available");
      assertThatThrownBy(() -> unavailable.pauseJob("Export", "Reports"))
          .isInstanceOf(SchedulerException.class);
    }
  }

  @Test
  void cancelledCallerDoesNotChangeTheScheduler() throws Exception {
    schedule("Export", "Reports", "daily");

    Thread.currentThread().interrupt();
    try {
      assertThatThrownBy(() -> store.pauseJob("Export", "Reports")).isInstanceOf(CancellationException.class);
      assertThatThrownBy(store::getJobs).isInstanceOf(CancellationException.class);
    } finally {
      Thread.interrupted();
    }

    assertThat(store.getJobStatus("Export", "Reports")).isEqualTo(JobStatus.ACTIVE);
  }

  @Test
  void interruptStopsARunningJob() throws Exception {
    JobKey key = JobKey.jobKey("LongExport", "Reports");
    scheduler.addJob(JobBuilder.newJob(SleepingJob.class).withIdentity(key).storeDurably().build(), false);
    SleepingJob.running = new CountDownLatch(1);

    try (JobRunHistoryListener listener = new JobRunHistoryListener(provider)) {
      scheduler.getListenerManager().addJobListener(listener);
      assertThat(store.interruptJob("LongExport", "Reports")).isFalse();

      scheduler.start();
      store.triggerJob("LongExport", "Reports", null);
      assertThat(SleepingJob.running.await(5, TimeUnit.SECONDS)).isTrue();

      assertThat(store.interruptJob("LongExport", "Reports")).isTrue();

      JobRun run = awaitFinished("LongExport", "Reports");
      assertThat(run.getStatus()).isEqualTo(JobRunStatus.FAILED);
      assertThat(run.getErrorMessage()).startsWith("Interrupted");
    } finally {
      scheduler.shutdown(true);
    }
  }

  @Test
  void purgeDelegatesToTheProvider() throws Exception {
    Instant start = Instant.now().minusSeconds(600);
    provider.saveJobRun(finished(started("old", "Export", "Reports", start), JobRunStatus.SUCCESS, 10));
    provider.saveJobRun(finished(started("new", "Export", "Reports", start.plusSeconds(500)), JobRunStatus.SUCCESS, 10));

    assertThat(store.purgeJobRuns("Export", "Reports", start.plusSeconds(100))).isEqualTo(1);
    assertThat(store.getJobRuns("Export", "Reports", null)).extracting(r -> r.getId()).containsExactly("new");
  }

  private void schedule(String name, String group, String... triggerNames) throws SchedulerException {
    JobDetail job = JobBuilder.newJob(NoopJob.class)
        .withIdentity(name, group)
        .usingJobData(SchedulerJobStore.CATEGORY_KEY, "reporting")
        .storeDurably()
        .build();
    scheduler.addJob(job, false);
    int hour = 3;
    for (String triggerName : triggerNames) {
      Trigger trigger = TriggerBuilder.newTrigger()
          .withIdentity(triggerName, group)
          .forJob(JobKey.jobKey(name, group))
          .withSchedule(CronScheduleBuilder.cronSchedule("0 0 " + hour++ + " * * ?"))
          .build();
      scheduler.scheduleJob(trigger);
    }
  }

  private JobRun awaitFinished(String name, String group) throws Exception {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (System.nanoTime() < deadline) {
      List<JobRun> runs = store.getJobRuns(name, group, JobRunQuery.latest(1));
      if (!runs.isEmpty() && runs.get(0).getStatus() != JobRunStatus.STARTED) {
        return runs.get(0);
      }
      Thread.sleep(50);
    }
    throw new AssertionError("No finished run of " + group + "." + name);
  }

  public static class SleepingJob implements InterruptableJob {
    static volatile CountDownLatch running;
    private volatile Thread worker;

    @Override
    public void execute(JobExecutionContext context) throws JobExecutionException {
      worker = Thread.currentThread();
      running.countDown();
      try {
        Thread.sleep(30_000);
      } catch (InterruptedException e) {
        throw new JobExecutionException("Interrupted", e, false);
      }
    }

    @Override
    public void interrupt() {
      Thread thread = worker;
      if (thread != null) {
        thread.interrupt();
      }
    }
  }

  public static class NoopJob implements Job {
    @Override
    public void execute(JobExecutionContext context) {
    }
  }
}
