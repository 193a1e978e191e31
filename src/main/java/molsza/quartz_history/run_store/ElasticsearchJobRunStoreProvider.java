package molsza.quartz_history.run_store;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Conflicts;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.Result;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.aggregations.StatsAggregate;
import co.elastic.clients.elasticsearch._types.aggregations.StringTermsBucket;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TypeMapping;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.IndexResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import co.elastic.clients.json.JsonData;
import co.elastic.clients.util.ObjectBuilder;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import molsza.quartz_history.model.JobRun;
import molsza.quartz_history.model.JobRunQuery;
import molsza.quartz_history.model.JobRunStats;
import molsza.quartz_history.model.JobRunStatus;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Stores one document per run in a dedicated index, keyed by the run id so a
 * second save of the same run replaces the first. Statistics are computed with
 * aggregations and never by loading the runs.
 */
@Slf4j
public class ElasticsearchJobRunStoreProvider implements JobRunStoreProvider {
  public static final String DEFAULT_INDEX_NAME = "quartz-job-runs";
  static final int PAGE_SIZE = 1_000;

  private final ElasticsearchClient client;
  private final String indexName;
  private final boolean refreshOnWrite;

  public ElasticsearchJobRunStoreProvider(ElasticsearchClient client) {
    this(client, DEFAULT_INDEX_NAME, false);
  }

  public ElasticsearchJobRunStoreProvider(ElasticsearchClient client, String indexName, boolean refreshOnWrite) {
    this.client = client;
    this.indexName = indexName;
    this.refreshOnWrite = refreshOnWrite;
  }

  public String getIndexName() {
    return indexName;
  }

  public void createIndex() {
    try {
      if (!client.indices().exists(ExistsRequest.of(r -> r.index(indexName))).value()) {
        log.info("Creating index {}", indexName);
        boolean result = client.indices().create(fn -> fn.index(indexName).mappings(this::indexMapping)).acknowledged();
        if (!result) {
          throw new IllegalStateException("Index " + indexName + " has not been created");
        }
      } else {
        log.debug("Index {} already exists", indexName);
      }
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
  }

  protected ObjectBuilder<TypeMapping> indexMapping(TypeMapping.Builder builder) {
    Function<Property.Builder, ObjectBuilder<Property>> keyword = b -> {
      b.keyword(a -> a.store(true));
      return b;
    };

    // results can exceed the keyword term limit, wildcard fields have none
    Function<Property.Builder, ObjectBuilder<Property>> number = b -> {
      b.long_(f -> f.index(true));
      return b;
    };

    Function<Property.Builder, ObjectBuilder<Property>> timestamp = b -> {
      b.date(f -> f.index(true));
      return b;
    };

    Function<Property.Builder, ObjectBuilder<Property>> text = b -> {
      b.text(f -> f.index(false));
      return b;
    };

    return builder.dynamic(DynamicMapping.False)
        .properties("id", keyword)
        .properties("jobName", keyword)
        .properties("jobGroup", keyword)
        .properties("triggerName", keyword)
        .properties("triggerGroup", keyword)
        .properties("status", keyword)
        .properties("instanceName", keyword)
        .properties("category", keyword)
        .properties("result", b -> b.wildcard(w -> w))
        .properties("description", text)
        .properties("errorMessage", text)
        .properties("scheduledTime", timestamp)
        .properties("startTime", timestamp)
        .properties("endTime", timestamp)
        .properties("runTimeMs", number)
        .properties("retryCount", number)
        .properties("priority", number)
        .properties("dataMap", b -> b.object(v -> v.enabled(false)));
  }

  @Override
  public List<JobRun> getJobRuns(String jobName, String jobGroup, JobRunQuery query) throws JobRunStoreException {
    JobRunQuery filter = query == null ? JobRunQuery.all() : query;
    List<Query> filters = jobFilters(jobName, jobGroup, filter.getStartDate(), filter.getEndDate());
    if (filter.getStatus() != null) {
      filters.add(Query.of(q -> q.term(t -> t.field("status").value(filter.getStatus().getDisplayName()))));
    }
    if (filter.getPriority() != null) {
      filters.add(Query.of(q -> q.term(t -> t.field("priority").value(filter.getPriority().longValue()))));
    }
    if (filter.getInstanceName() != null) {
      filters.add(Query.of(q -> q.term(t -> t.field("instanceName").value(filter.getInstanceName()))));
    }
    if (filter.getResultContains() != null) {
      String pattern = "*" + escapeWildcard(filter.getResultContains()) + "*";
      filters.add(Query.of(q -> q.wildcard(w -> w.field("result").value(pattern).caseInsensitive(true))));
    }

    int limit = filter.getTake() == null ? Integer.MAX_VALUE : Math.max(0, filter.getTake());
    List<JobRun> runs = new ArrayList<>();
    List<FieldValue> searchAfter = null;
    try {
      while (runs.size() < limit) {
        int size = Math.min(PAGE_SIZE, limit - runs.size());
        List<FieldValue> after = searchAfter;
        SearchResponse<JobRunDocument> response = client.search(s -> {
          s.index(indexName)
              .size(size)
              .query(q -> q.bool(b -> b.filter(filters)))
              .sort(so -> so.field(f -> f.field("startTime").order(SortOrder.Desc)))
              .sort(so -> so.field(f -> f.field("id").order(SortOrder.Desc)));
          if (after != null) {
            s.searchAfter(after);
          }
          return s;
        }, JobRunDocument.class);

        List<Hit<JobRunDocument>> hits = response.hits().hits();
        hits.forEach(h -> runs.add(JobRunUtils.fromDocument(h.source())));
        if (hits.size() < size) {
          break;
        }
        searchAfter = hits.get(hits.size() - 1).sort();
      }
    } catch (IOException | ElasticsearchException e) {
      throw new JobRunStoreException("Loading runs of job " + jobGroup + "." + jobName + " failed: " + e.getMessage(), e);
    }
    log.debug("Found {} runs of job {}.{}", runs.size(), jobGroup, jobName);
    return runs;
  }

  @Override
  public JobRunStats getJobRunStats(String jobName, String jobGroup, Instant startDate, Instant endDate) throws JobRunStoreException {
    List<Query> filters = jobFilters(jobName, jobGroup, startDate, endDate);
    try {
      SearchResponse<ObjectNode> response = client.search(s -> s.index(indexName)
          .size(0)
          .trackTotalHits(t -> t.enabled(true))
          .query(q -> q.bool(b -> b.filter(filters)))
          .aggregations("status", a -> a.terms(t -> t.field("status")))
          .aggregations("runTime", a -> a.stats(st -> st.field("runTimeMs"))), ObjectNode.class);

      long total = response.hits().total() == null ? 0 : response.hits().total().value();
      if (total == 0) {
        return JobRunStats.empty();
      }

      long success = 0;
      long failure = 0;
      for (StringTermsBucket bucket : response.aggregations().get("status").sterms().buckets().array()) {
        String status = bucket.key().stringValue();
        if (JobRunStatus.SUCCESS.getDisplayName().equals(status)) {
          success = bucket.docCount();
        } else if (JobRunStatus.FAILED.getDisplayName().equals(status)) {
          failure = bucket.docCount();
        }
      }

      StatsAggregate runTime = response.aggregations().get("runTime").stats();
      boolean timed = runTime.count() > 0;
      return JobRunStats.builder()
          .totalRuns(total)
          .successCount(success)
          .failureCount(failure)
          .avgRunTimeMs(timed ? finite(runTime.avg()) : 0)
          .maxRunTimeMs(timed ? (long) finite(runTime.max()) : 0)
          .minRunTimeMs(timed ? (long) finite(runTime.min()) : 0)
          .build();
    } catch (IOException | ElasticsearchException e) {
      throw new JobRunStoreException("Aggregating runs of job " + jobGroup + "." + jobName + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void saveJobRun(JobRun jobRun) throws JobRunStoreException {
    JobRunUtils.checkSavable(jobRun);
    JobRunDocument document = JobRunUtils.toDocument(jobRun);
    try {
      IndexResponse response = client.index(fn -> fn.index(indexName)
          .id(jobRun.getId())
          .document(document)
          .refresh(refreshOnWrite ? Refresh.WaitFor : Refresh.False));
      if (response.result() == Result.Created || response.result() == Result.Updated) {
        log.debug("Stored run {} of job {}.{} as {}", jobRun.getId(), jobRun.getJobGroup(), jobRun.getJobName(), jobRun.getStatus());
      }
    } catch (IOException | ElasticsearchException e) {
      throw new JobRunStoreException("Storing run " + jobRun.getId() + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public long purgeJobRuns(String jobName, String jobGroup, Instant olderThan) throws JobRunStoreException {
    List<Query> filters = jobFilters(jobName, jobGroup, null, null);
    filters.add(Query.of(q -> q.range(r -> r.field("startTime").lt(JsonData.of(olderThan.toEpochMilli())))));
    try {
      DeleteByQueryResponse response = client.deleteByQuery(d -> d.index(indexName)
          .query(q -> q.bool(b -> b.filter(filters)))
          .conflicts(Conflicts.Proceed)
          .refresh(true));
      long deleted = response.deleted() == null ? 0 : response.deleted();
      log.info("Purged {} job runs of {}.{} older than {}", deleted, jobGroup, jobName, olderThan);
      return deleted;
    } catch (IOException | ElasticsearchException e) {
      throw new JobRunStoreException("Purging runs of job " + jobGroup + "." + jobName + " failed: " + e.getMessage(), e);
    }
  }

  private static List<Query> jobFilters(String jobName, String jobGroup, Instant startDate, Instant endDate) {
    List<Query> filters = new ArrayList<>();
    filters.add(Query.of(q -> q.term(t -> t.field("jobName").value(jobName))));
    filters.add(Query.of(q -> q.term(t -> t.field("jobGroup").value(jobGroup))));
    if (startDate != null) {
      filters.add(Query.of(q -> q.range(r -> r.field("startTime").gte(JsonData.of(startDate.toEpochMilli())))));
    }
    if (endDate != null) {
      filters.add(Query.of(q -> q.range(r -> r.field("startTime").lte(JsonData.of(endDate.toEpochMilli())))));
    }
    return filters;
  }

  static String escapeWildcard(String value) {
    StringBuilder escaped = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      if (c == '*' || c == '?' || c == '\\') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  private static double finite(double value) {
    return Double.isFinite(value) ? value : 0;
  }
}
