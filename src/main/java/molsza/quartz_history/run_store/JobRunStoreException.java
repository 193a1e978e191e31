package molsza.quartz_history.run_store;

import org.quartz.JobPersistenceException;

/**
 * Raised when the run history backend cannot be read or written.
 */
public class JobRunStoreException extends JobPersistenceException {

  public JobRunStoreException(String msg) {
    super(msg);
  }

  public JobRunStoreException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
