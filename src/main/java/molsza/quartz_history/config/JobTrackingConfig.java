package molsza.quartz_history.config;

import molsza.quartz_history.job_store.JobService;
import molsza.quartz_history.job_store.JobStore;
import molsza.quartz_history.job_store.SchedulerJobStore;
import molsza.quartz_history.job_store.SchedulerProvider;
import molsza.quartz_history.listener.JobRunHistoryListener;
import molsza.quartz_history.run_store.InMemoryJobRunStoreProvider;
import molsza.quartz_history.run_store.JobRunStoreProvider;
import molsza.quartz_history.run_store.NullJobRunStoreProvider;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.quartz.QuartzAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;

@AutoConfiguration(before = QuartzAutoConfiguration.class)
@EnableConfigurationProperties(JobTrackingProperties.class)
@Import({ElasticConfig.class, QuartzConfig.class})
public class JobTrackingConfig {

  @Bean
  @ConditionalOnMissingBean(JobRunStoreProvider.class)
  @ConditionalOnProperty(prefix = "jobs.tracking", name = "provider", havingValue = "memory")
  public InMemoryJobRunStoreProvider inMemoryJobRunStoreProvider(JobTrackingProperties properties) {
    return new InMemoryJobRunStoreProvider(properties.getRetention());
  }

  @Bean
  @ConditionalOnMissingBean(JobRunStoreProvider.class)
  @ConditionalOnProperty(prefix = "jobs.tracking", name = "provider", havingValue = "none", matchIfMissing = true)
  public NullJobRunStoreProvider nullJobRunStoreProvider() {
    return new NullJobRunStoreProvider();
  }

  @Bean
  @ConditionalOnMissingBean
  public JobRunHistoryListener jobRunHistoryListener(JobRunStoreProvider provider, JobTrackingProperties properties) {
    return new JobRunHistoryListener(provider, properties.getSaveTimeout(), properties.isRecordVetoed(), Clock.systemUTC(),
        properties.getSaveQueueCapacity());
  }

  @Bean
  public JobRunHistoryRegistrar jobRunHistoryRegistrar(ObjectProvider<Scheduler> schedulers, JobRunHistoryListener listener) {
    return new JobRunHistoryRegistrar(schedulers, listener);
  }

  @Bean
  @ConditionalOnMissingBean
  public SchedulerProvider schedulerProvider(ObjectProvider<Scheduler> scheduler) {
    return () -> {
      Scheduler available = scheduler.getIfAvailable();
      if (available == null) {
        throw new SchedulerException("No Quartz scheduler available");
      }
      return available;
    };
  }

  @Bean
  @ConditionalOnMissingBean(JobStore.class)
  public SchedulerJobStore jobStore(SchedulerProvider schedulerProvider, JobRunStoreProvider provider, JobTrackingProperties properties) {
    return new SchedulerJobStore(schedulerProvider, provider, properties.getEnrichmentParallelism());
  }

  @Bean
  @ConditionalOnMissingBean
  public JobService jobService(JobStore jobStore) {
    return new JobService(jobStore);
  }
}
