package molsza.quartz_history.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import molsza.quartz_history.job_store.JobService;
import molsza.quartz_history.job_store.JobStore;
import molsza.quartz_history.job_store.SchedulerJobStore;
import molsza.quartz_history.listener.JobRunHistoryListener;
import molsza.quartz_history.run_store.InMemoryJobRunStoreProvider;
import molsza.quartz_history.run_store.JobRunStoreProvider;
import molsza.quartz_history.run_store.NullJobRunStoreProvider;
import org.junit.jupiter.api.Test;
import org.quartz.Scheduler;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.quartz.SchedulerFactoryBean;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class JobTrackingConfigTest {

  private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(JobTrackingConfig.class));

  @Test
  void historyIsOffByDefault() {
    contextRunner.run(context -> {
      assertThat(context).hasSingleBean(NullJobRunStoreProvider.class);
      assertThat(context).hasSingleBean(JobRunHistoryListener.class);
      assertThat(context).hasSingleBean(SchedulerJobStore.class);
      assertThat(context).hasSingleBean(JobService.class);
      assertThat(context).doesNotHaveBean(ElasticsearchClient.class);
      assertThat(context.getBean(Scheduler.class).isStarted()).isFalse();
    });
  }

  @Test
  void schedulerReportsToTheHistoryListener() {
    contextRunner.run(context -> {
      Scheduler scheduler = context.getBean(Scheduler.class);
      assertThat(scheduler.getListenerManager().getJobListener(JobRunHistoryListener.NAME))
          .isSameAs(context.getBean(JobRunHistoryListener.class));
    });
  }

  @Test
  void applicationSchedulerAlsoReportsToTheHistoryListener() {
    contextRunner.withUserConfiguration(ApplicationScheduler.class).run(context -> {
      assertThat(context).hasSingleBean(Scheduler.class);
      Scheduler scheduler = context.getBean(Scheduler.class);
      assertThat(scheduler.getSchedulerName()).isEqualTo("applicationScheduler");
      assertThat(scheduler.getListenerManager().getJobListener(JobRunHistoryListener.NAME))
          .isSameAs(context.getBean(JobRunHistoryListener.class));
    });
  }

  @Test
  void inMemoryProviderWithRetention() {
    contextRunner
        .withPropertyValues("jobs.tracking.provider=memory", "jobs.tracking.retention=2h", "jobs.tracking.save-timeout=1s",
            "jobs.tracking.save-queue-capacity=50")
        .run(context -> {
          assertThat(context).hasSingleBean(InMemoryJobRunStoreProvider.class);
          assertThat(context).doesNotHaveBean(NullJobRunStoreProvider.class);
          JobTrackingProperties properties = context.getBean(JobTrackingProperties.class);
          assertThat(properties.getProvider()).isEqualTo(JobTrackingProperties.Provider.MEMORY);
          assertThat(properties.getRetention()).isEqualTo(Duration.ofHours(2));
          assertThat(properties.getSaveTimeout()).isEqualTo(Duration.ofSeconds(1));
          assertThat(properties.getSaveQueueCapacity()).isEqualTo(50);
        });
  }

  @Test
  void ownProviderAndStoreWin() {
    contextRunner.withUserConfiguration(CustomBeans.class).run(context -> {
      assertThat(context).hasSingleBean(JobRunStoreProvider.class);
      assertThat(context.getBean(JobRunStoreProvider.class)).isSameAs(context.getBean("customProvider"));
      assertThat(context).doesNotHaveBean(SchedulerJobStore.class);
      assertThat(context.getBean(JobStore.class)).isSameAs(context.getBean("customStore"));
    });
  }

  @Configuration(proxyBeanMethods = false)
  static class ApplicationScheduler {

    @Bean
    SchedulerFactoryBean applicationScheduler() {
      SchedulerFactoryBean factory = new SchedulerFactoryBean();
      factory.setSchedulerName("applicationScheduler");
      factory.setAutoStartup(false);
      return factory;
    }
  }

  @Configuration(proxyBeanMethods = false)
  static class CustomBeans {

    @Bean
    JobRunStoreProvider customProvider() {
      return new InMemoryJobRunStoreProvider();
    }

    @Bean
    JobStore customStore() {
      return mock(JobStore.class);
    }
  }
}
