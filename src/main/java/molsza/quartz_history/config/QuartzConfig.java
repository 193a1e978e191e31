package molsza.quartz_history.config;

import org.quartz.Scheduler;
import org.quartz.spi.TriggerFiredBundle;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.quartz.SchedulerFactoryBean;
import org.springframework.scheduling.quartz.SpringBeanJobFactory;

import java.util.concurrent.Executors;

/**
 * In-process Quartz scheduler, used unless the application brings its own.
 * Jobs are autowired from the application context.
 */
@Configuration
public class QuartzConfig {

  @Value("${quartz.enabled:false}")
  boolean enableQuartz;

  @Value("${quartz.thread-count:4}")
  int threadCount;

  final ApplicationContext applicationContext;

  public QuartzConfig(ApplicationContext applicationContext) {
    this.applicationContext = applicationContext;
  }

  @Bean
  @ConditionalOnMissingBean
  SpringBeanJobFactory autowiringJobFactory() {

    return new SpringBeanJobFactory() {

      @Override
      protected Object createJobInstance(final TriggerFiredBundle bundle) throws Exception {

        final Object job = super.createJobInstance(bundle);

        applicationContext
            .getAutowireCapableBeanFactory()
            .autowireBean(job);

        return job;
      }
    };
  }

  @Bean
  @ConditionalOnMissingBean({Scheduler.class, SchedulerFactoryBean.class})
  public SchedulerFactoryBean schedulerFactory(SpringBeanJobFactory jobFactory) {

    var threadFactory = new CustomizableThreadFactory("quartz-worker-");
    threadFactory.setThreadGroupName("quartz");
    threadFactory.setDaemon(true);
    SchedulerFactoryBean schedulerFactory = new SchedulerFactoryBean();
    schedulerFactory.setTaskExecutor(Executors.newFixedThreadPool(Math.max(1, threadCount), threadFactory));
    schedulerFactory.setAutoStartup(enableQuartz);
    schedulerFactory.setWaitForJobsToCompleteOnShutdown(true);

    jobFactory.setApplicationContext(applicationContext);
    schedulerFactory.setJobFactory(jobFactory);

    return schedulerFactory;
  }
}
