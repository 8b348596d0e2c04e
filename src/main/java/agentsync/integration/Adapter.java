package agentsync.integration;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/** One external tool, e.g. an IDE, that agents are synced into. */
public interface Adapter {

  String getName();

  SyncResult syncAgents(List<String> agentNames) throws Exception;

  HealthResult healthCheck() throws Exception;

  /** The tool's own config directory, if it has one worth watching. */
  default Optional<Path> getConfigDirectory() {
    return Optional.empty();
  }

}
