package agentsync.scheduler;

import java.util.Map;

@FunctionalInterface
public interface JobHandler {

  /** @return the job's result, e.g. per-adapter sync results */
  Map<String, Object> execute(SyncJob job) throws Exception;

}
