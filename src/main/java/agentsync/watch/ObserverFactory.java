package agentsync.watch;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.WatchService;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import agentsync.SyncSettings;

/**
 * Creates the {@link PathObserver} for a newly watched path.
 *
 * This abstracts out whether we use native OS notifications, via
 * {@link WatchServiceObserver}, or {@link PollingObserver}, with a
 * preference for the former.
 */
public interface ObserverFactory {

  PathObserver newObserver(WatchedPath path, Consumer<RawEvent> sink);

  /**
   * @return the default factory, which polls if asked to, or if the platform can't give us a WatchService
   */
  static ObserverFactory newFactory(SyncSettings settings) {
    Logger log = LoggerFactory.getLogger(ObserverFactory.class);
    return (path, sink) -> {
      if (!settings.usePolling) {
        try {
          WatchService ws = FileSystems.getDefault().newWatchService();
          return new WatchServiceObserver(ws, path, sink);
        } catch (IOException | UnsupportedOperationException e) {
          log.warn("Native file watching unavailable, polling " + path.getRoot() + " instead", e);
        }
      }
      return new PollingObserver(path, settings.pollingInterval, sink);
    };
  }

}
