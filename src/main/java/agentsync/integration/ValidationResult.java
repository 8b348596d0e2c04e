package agentsync.integration;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

public class ValidationResult {

  private final List<String> errors;
  private final boolean needsSync;

  public ValidationResult(List<String> errors, boolean needsSync) {
    this.errors = ImmutableList.copyOf(errors);
    this.needsSync = needsSync;
  }

  public List<String> getErrors() {
    return errors;
  }

  /** Whether the adapter's config has drifted from the managed agents. */
  public boolean needsSync() {
    return needsSync;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("errors", errors).add("needsSync", needsSync).toString();
  }

}
