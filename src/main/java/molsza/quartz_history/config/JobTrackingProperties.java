package molsza.quartz_history.config;

import lombok.Getter;
import lombok.Setter;
import molsza.quartz_history.job_store.SchedulerJobStore;
import molsza.quartz_history.listener.JobRunHistoryListener;
import molsza.quartz_history.run_store.ElasticsearchJobRunStoreProvider;
import molsza.quartz_history.run_store.InMemoryJobRunStoreProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "jobs.tracking")
public class JobTrackingProperties {

  public enum Provider {
    ELASTICSEARCH, MEMORY, NONE
  }

  /**
   * Where run records go. {@code none} keeps nothing.
   */
  private Provider provider = Provider.NONE;

  private String indexName = ElasticsearchJobRunStoreProvider.DEFAULT_INDEX_NAME;

  /**
   * Wait for the index refresh on every save so runs are searchable at once.
   */
  private boolean refreshOnWrite = false;

  /**
   * How long the in-memory provider keeps runs.
   */
  private Duration retention = InMemoryJobRunStoreProvider.DEFAULT_RETENTION;

  /**
   * Longest time a firing waits for its run record to be saved.
   */
  private Duration saveTimeout = JobRunHistoryListener.DEFAULT_SAVE_TIMEOUT;

  /**
   * Saves allowed to wait for a lagging store before new records are dropped.
   */
  private int saveQueueCapacity = JobRunHistoryListener.DEFAULT_QUEUE_CAPACITY;

  private boolean recordVetoed = false;

  private int enrichmentParallelism = SchedulerJobStore.DEFAULT_PARALLELISM;
}
