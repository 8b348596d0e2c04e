package agentsync.scheduler;

public class JobExecutionException extends SyncJobException {

  private static final long serialVersionUID = 1L;

  public JobExecutionException(String message) {
    super(message);
  }

  public JobExecutionException(String message, Throwable cause) {
    super(message, cause);
  }

}
