package agentsync.scheduler;

import java.time.Duration;

import agentsync.Utils;

public class JobTimeoutException extends SyncJobException {

  private static final long serialVersionUID = 1L;

  public JobTimeoutException(Duration timeout) {
    super("Job timed out after " + Utils.toShortString(timeout));
  }

}
