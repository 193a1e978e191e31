package molsza.quartz_history.run_store;

import lombok.extern.slf4j.Slf4j;
import molsza.quartz_history.model.JobRun;
import molsza.quartz_history.model.JobRunQuery;
import molsza.quartz_history.model.JobRunStats;
import molsza.quartz_history.model.JobRunStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.LongSummaryStatistics;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps runs in memory for a limited retention period. Runs that started
 * before {@code now - retention} are dropped on every access.
 */
@Slf4j
public class InMemoryJobRunStoreProvider implements JobRunStoreProvider {
  public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

  static final Comparator<JobRun> NEWEST_FIRST = Comparator
      .comparing(JobRun::getStartTime, Comparator.nullsLast(Comparator.reverseOrder()))
      .thenComparing(JobRun::getId, Comparator.nullsLast(Comparator.reverseOrder()));

  private final Map<String, JobRun> jobRuns = new ConcurrentHashMap<>();
  private final Duration retention;
  private final Clock clock;

  public InMemoryJobRunStoreProvider() {
    this(DEFAULT_RETENTION, Clock.systemUTC());
  }

  public InMemoryJobRunStoreProvider(Duration retention) {
    this(retention, Clock.systemUTC());
  }

  public InMemoryJobRunStoreProvider(Duration retention, Clock clock) {
    this.retention = retention == null ? DEFAULT_RETENTION : retention;
    this.clock = clock;
  }

  @Override
  public List<JobRun> getJobRuns(String jobName, String jobGroup, JobRunQuery query) {
    cleanupOldRuns();
    JobRunQuery filter = query == null ? JobRunQuery.all() : query;

    Stream<JobRun> runs = runsOf(jobName, jobGroup)
        .filter(r -> filter.getStartDate() == null || !r.getStartTime().isBefore(filter.getStartDate()))
        .filter(r -> filter.getEndDate() == null || !r.getStartTime().isAfter(filter.getEndDate()))
        .filter(r -> filter.getStatus() == null || filter.getStatus() == r.getStatus())
        .filter(r -> filter.getPriority() == null || filter.getPriority().equals(r.getPriority()))
        .filter(r -> filter.getInstanceName() == null || filter.getInstanceName().equals(r.getInstanceName()))
        .filter(r -> filter.getResultContains() == null || containsIgnoreCase(r.getResult(), filter.getResultContains()))
        .sorted(NEWEST_FIRST);
    if (filter.getTake() != null) {
      runs = runs.limit(Math.max(0, filter.getTake()));
    }
    return runs.collect(Collectors.toList());
  }

  @Override
  public JobRunStats getJobRunStats(String jobName, String jobGroup, Instant startDate, Instant endDate) {
    cleanupOldRuns();
    List<JobRun> runs = runsOf(jobName, jobGroup)
        .filter(r -> startDate == null || !r.getStartTime().isBefore(startDate))
        .filter(r -> endDate == null || !r.getStartTime().isAfter(endDate))
        .collect(Collectors.toList());
    if (runs.isEmpty()) {
      return JobRunStats.empty();
    }

    LongSummaryStatistics runTimes = runs.stream()
        .map(JobRun::getRunTimeMs)
        .filter(Objects::nonNull)
        .mapToLong(Long::longValue)
        .summaryStatistics();
    boolean timed = runTimes.getCount() > 0;

    return JobRunStats.builder()
        .totalRuns(runs.size())
        .successCount(runs.stream().filter(r -> r.getStatus() == JobRunStatus.SUCCESS).count())
        .failureCount(runs.stream().filter(r -> r.getStatus() == JobRunStatus.FAILED).count())
        .avgRunTimeMs(timed ? runTimes.getAverage() : 0)
        .maxRunTimeMs(timed ? runTimes.getMax() : 0)
        .minRunTimeMs(timed ? runTimes.getMin() : 0)
        .build();
  }

  @Override
  public void saveJobRun(JobRun jobRun) throws JobRunStoreException {
    JobRunUtils.checkSavable(jobRun);
    cleanupOldRuns();
    jobRuns.put(jobRun.getId(), jobRun);
  }

  @Override
  public long purgeJobRuns(String jobName, String jobGroup, Instant olderThan) {
    cleanupOldRuns();
    List<String> ids = runsOf(jobName, jobGroup)
        .filter(r -> r.getStartTime().isBefore(olderThan))
        .map(JobRun::getId)
        .collect(Collectors.toList());
    long removed = ids.stream().filter(id -> jobRuns.remove(id) != null).count();
    log.info("Purged {} job runs of {}.{} older than {}", removed, jobGroup, jobName, olderThan);
    return removed;
  }

  private Stream<JobRun> runsOf(String jobName, String jobGroup) {
    return jobRuns.values().stream()
        .filter(r -> Objects.equals(jobName, r.getJobName()) && Objects.equals(jobGroup, r.getJobGroup()));
  }

  private void cleanupOldRuns() {
    Instant cutoff = clock.instant().minus(retention);
    int before = jobRuns.size();
    jobRuns.values().removeIf(r -> r.getStartTime() != null && r.getStartTime().isBefore(cutoff));
    int removed = before - jobRuns.size();
    if (removed > 0) {
      log.debug("Cleaned up {} job runs older than {}", removed, retention);
    }
  }

  private static boolean containsIgnoreCase(String value, String part) {
    return value != null && value.toLowerCase(Locale.ROOT).contains(part.toLowerCase(Locale.ROOT));
  }
}
