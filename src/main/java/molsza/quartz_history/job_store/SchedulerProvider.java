package molsza.quartz_history.job_store;

import org.quartz.Scheduler;
import org.quartz.SchedulerException;

/**
 * Hands out the live scheduler the job store reads from and commands.
 */
@FunctionalInterface
public interface SchedulerProvider {

  /**
   * @return the live scheduler
   * @throws SchedulerException if no scheduler is available
   */
  Scheduler getScheduler() throws SchedulerException;
}
