package molsza.quartz_history.job_store;

import molsza.quartz_history.model.JobInfo;
import molsza.quartz_history.model.JobRun;
import molsza.quartz_history.model.JobRunQuery;
import molsza.quartz_history.model.JobRunStats;
import molsza.quartz_history.model.JobStatus;
import molsza.quartz_history.model.TriggerInfo;
import org.quartz.SchedulerException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operational view of the scheduled jobs: live scheduler state merged with the
 * recorded run history, plus commands against the live scheduler.
 * <p>
 * Failures of the run history backend surface as
 * {@link molsza.quartz_history.run_store.JobRunStoreException}. Cancellation
 * is requested by interrupting the calling thread; commands that were not yet
 * sent to the scheduler are then skipped with a
 * {@link java.util.concurrent.CancellationException}.
 */
public interface JobStore {

  /**
   * @return every job known to the scheduler, ordered by group and name
   */
  List<JobInfo> getJobs() throws SchedulerException;

  /**
   * @return the job, or empty if the scheduler does not know it
   */
  Optional<JobInfo> getJob(String jobName, String jobGroup) throws SchedulerException;

  List<JobRun> getJobRuns(String jobName, String jobGroup, JobRunQuery query) throws SchedulerException;

  JobRunStats getJobRunStats(String jobName, String jobGroup, Instant startDate, Instant endDate) throws SchedulerException;

  List<TriggerInfo> getTriggers(String jobName, String jobGroup) throws SchedulerException;

  JobStatus getJobStatus(String jobName, String jobGroup) throws SchedulerException;

  void saveJobRun(JobRun jobRun) throws SchedulerException;

  /**
   * Fires the job now. The run itself is recorded by the history listener
   * once the scheduler executes it.
   *
   * @param data extra job data for this firing, may be {@code null}
   */
  void triggerJob(String jobName, String jobGroup, Map<String, Object> data) throws SchedulerException;

  void pauseJob(String jobName, String jobGroup) throws SchedulerException;

  void resumeJob(String jobName, String jobGroup) throws SchedulerException;

  /**
   * @return whether at least one running instance of the job was interrupted
   */
  boolean interruptJob(String jobName, String jobGroup) throws SchedulerException;

  /**
   * @return the number of deleted runs
   */
  long purgeJobRuns(String jobName, String jobGroup, Instant olderThan) throws SchedulerException;

  /**
   * @return whether runs are recorded, so that a firing can be followed to its outcome
   */
  boolean keepsRunHistory();
}
