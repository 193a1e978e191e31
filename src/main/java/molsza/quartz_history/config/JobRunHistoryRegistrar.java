package molsza.quartz_history.config;

import lombok.extern.slf4j.Slf4j;
import molsza.quartz_history.listener.JobRunHistoryListener;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;

/**
 * Attaches the run history listener to every scheduler of the context, whether
 * it comes from {@link QuartzConfig} or from the application. Runs before the
 * schedulers are started.
 */
@Slf4j
public class JobRunHistoryRegistrar implements SmartInitializingSingleton {

  private final ObjectProvider<Scheduler> schedulers;
  private final JobRunHistoryListener listener;

  public JobRunHistoryRegistrar(ObjectProvider<Scheduler> schedulers, JobRunHistoryListener listener) {
    this.schedulers = schedulers;
    this.listener = listener;
  }

  @Override
  public void afterSingletonsInstantiated() {
    schedulers.orderedStream().forEach(this::register);
  }

  void register(Scheduler scheduler) {
    try {
      if (scheduler.getListenerManager().getJobListener(listener.getName()) != null) {
        log.debug("Job run history already recorded for scheduler {}", scheduler.getSchedulerName());
        return;
      }
      scheduler.getListenerManager().addJobListener(listener);
      log.info("Recording job run history for scheduler {}", scheduler.getSchedulerName());
    } catch (SchedulerException e) {
      throw new IllegalStateException("Could not attach the job run history listener", e);
    }
  }
}
