package agentsync.watch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import agentsync.integration.Adapter;
import agentsync.integration.IntegrationManager;

/** Reports external tool directories worth watching, e.g. an IDE's own config directory. */
@FunctionalInterface
public interface ToolPathProvider {

  List<Path> getToolPaths() throws Exception;

  /** @return a provider asking each known adapter for its config directory */
  static ToolPathProvider fromAdapters(IntegrationManager manager) {
    return () -> {
      List<Path> paths = new ArrayList<>();
      for (String name : manager.listAdapters()) {
        manager.getAdapter(name).flatMap(Adapter::getConfigDirectory).ifPresent(paths::add);
      }
      return paths;
    };
  }

}
