package molsza.quartz_history.job_store;

import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;

import java.util.Properties;
import java.util.UUID;

/**
 * Isolated in-memory schedulers for tests.
 */
final class Schedulers {

  private Schedulers() {
  }

  static Scheduler ramScheduler() throws SchedulerException {
    Properties properties = new Properties();
    properties.setProperty("org.quartz.scheduler.instanceName", "test-" + UUID.randomUUID());
    properties.setProperty("org.quartz.scheduler.instanceId", "node-1");
    properties.setProperty("org.quartz.scheduler.skipUpdateCheck", "true");
    properties.setProperty("org.quartz.threadPool.threadCount", "3");
    properties.setProperty("org.quartz.jobStore.class", "org.quartz.simpl.RAMJobStore");
    return new StdSchedulerFactory(properties).getScheduler();
  }
}
