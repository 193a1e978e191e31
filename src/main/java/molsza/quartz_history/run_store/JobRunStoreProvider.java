package molsza.quartz_history.run_store;

import molsza.quartz_history.model.JobRun;
import molsza.quartz_history.model.JobRunQuery;
import molsza.quartz_history.model.JobRunStats;

import java.time.Instant;
import java.util.List;

/**
 * Persistence backend for run records. Knows nothing about the live scheduler.
 */
public interface JobRunStoreProvider {

  /**
   * Returns the runs of one job matching every filter of the query, newest
   * first by start time with ties broken by descending id.
   *
   * @param jobName  the job name
   * @param jobGroup the job group
   * @param query    the filters, {@link JobRunQuery#all()} for none
   * @return the matching runs, at most {@link JobRunQuery#getTake()} of them
   * @throws JobRunStoreException if the backend cannot be queried
   */
  List<JobRun> getJobRuns(String jobName, String jobGroup, JobRunQuery query) throws JobRunStoreException;

  /**
   * Aggregates the runs of one job started within the optional range. The
   * aggregation is done by the backend, not by loading the runs.
   */
  JobRunStats getJobRunStats(String jobName, String jobGroup, Instant startDate, Instant endDate) throws JobRunStoreException;

  /**
   * Inserts the run, or replaces the stored run with the same id.
   */
  void saveJobRun(JobRun jobRun) throws JobRunStoreException;

  /**
   * Deletes the runs of one job that started before {@code olderThan}.
   *
   * @return the number of deleted runs
   */
  long purgeJobRuns(String jobName, String jobGroup, Instant olderThan) throws JobRunStoreException;

  /**
   * @return {@code false} if saved runs are never returned by queries
   */
  default boolean keepsHistory() {
    return true;
  }
}
