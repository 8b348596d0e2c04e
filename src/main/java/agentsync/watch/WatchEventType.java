package agentsync.watch;

public enum WatchEventType {
  CREATED, MODIFIED, DELETED, MOVED;
}
