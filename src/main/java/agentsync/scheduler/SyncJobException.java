package agentsync.scheduler;

/** A single attempt of a job failed; the scheduler records the message and maybe retries. */
public abstract class SyncJobException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  protected SyncJobException(String message) {
    super(message);
  }

  protected SyncJobException(String message, Throwable cause) {
    super(message, cause);
  }

}
