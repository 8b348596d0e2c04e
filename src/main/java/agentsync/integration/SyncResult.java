package agentsync.integration;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

public class SyncResult {

  public enum Status {
    SUCCESS, PARTIAL, FAILED
  }

  private final Status status;
  private final int synced;
  private final List<String> errors;

  public static SyncResult success(int synced) {
    return new SyncResult(Status.SUCCESS, synced, ImmutableList.of());
  }

  public SyncResult(Status status, int synced, List<String> errors) {
    this.status = status;
    this.synced = synced;
    this.errors = ImmutableList.copyOf(errors);
  }

  public Status getStatus() {
    return status;
  }

  public int getSynced() {
    return synced;
  }

  public List<String> getErrors() {
    return errors;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("status", status).add("synced", synced).add("errors", errors).toString();
  }

}
