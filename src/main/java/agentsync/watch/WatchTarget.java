package agentsync.watch;

/**
 * What kind of thing a changed path is.
 *
 * Declaration order matters: it is the order patterns are checked in, and the
 * first target whose patterns match wins.
 */
public enum WatchTarget {
  CONFIG, AGENTS, TOOLS, TEMPLATES, INTEGRATIONS;
}
