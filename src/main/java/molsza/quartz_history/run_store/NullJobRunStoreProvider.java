package molsza.quartz_history.run_store;

import lombok.extern.slf4j.Slf4j;
import molsza.quartz_history.model.JobRun;
import molsza.quartz_history.model.JobRunQuery;
import molsza.quartz_history.model.JobRunStats;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Used when no run history backend is configured. Nothing is stored and every
 * call is reported as a warning.
 */
@Slf4j
public class NullJobRunStoreProvider implements JobRunStoreProvider {

  @Override
  public List<JobRun> getJobRuns(String jobName, String jobGroup, JobRunQuery query) {
    log.warn("No job run store configured, returning no runs for job {}.{}", jobGroup, jobName);
    return Collections.emptyList();
  }

  @Override
  public JobRunStats getJobRunStats(String jobName, String jobGroup, Instant startDate, Instant endDate) {
    log.warn("No job run store configured, returning empty stats for job {}.{}", jobGroup, jobName);
    return JobRunStats.empty();
  }

  @Override
  public void saveJobRun(JobRun jobRun) {
    log.warn("No job run store configured, run {} of job {}.{} is not saved",
        jobRun == null ? null : jobRun.getId(),
        jobRun == null ? null : jobRun.getJobGroup(),
        jobRun == null ? null : jobRun.getJobName());
  }

  @Override
  public long purgeJobRuns(String jobName, String jobGroup, Instant olderThan) {
    log.warn("No job run store configured, nothing to purge for job {}.{}", jobGroup, jobName);
    return 0;
  }

  @Override
  public boolean keepsHistory() {
    return false;
  }
}
