package agentsync.watch;

import agentsync.tasks.TaskLogic;

/**
 * Observes one {@link WatchedPath} on its own task, pushing {@link RawEvent}s to a sink.
 *
 * The sink is called on the observer's thread, so it must be thread-safe.
 */
public interface PathObserver extends TaskLogic {

  WatchedPath getWatchedPath();

}
