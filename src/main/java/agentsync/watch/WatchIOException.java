package agentsync.watch;

import java.io.IOException;

/** Registering or polling a watched path failed; observers log it and try again later. */
public class WatchIOException extends IOException {

  private static final long serialVersionUID = 1L;

  public WatchIOException(String message, Throwable cause) {
    super(message, cause);
  }

}
