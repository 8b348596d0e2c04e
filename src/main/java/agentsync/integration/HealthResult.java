package agentsync.integration;

import com.google.common.base.MoreObjects;

public class HealthResult {

  public enum Status {
    HEALTHY, DEGRADED, UNHEALTHY
  }

  private final Status status;
  private final String message;

  public HealthResult(Status status, String message) {
    this.status = status;
    this.message = message;
  }

  public Status getStatus() {
    return status;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("status", status).add("message", message).toString();
  }

}
