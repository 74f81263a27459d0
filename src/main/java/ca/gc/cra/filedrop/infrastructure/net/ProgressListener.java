package ca.gc.cra.filedrop.infrastructure.net;

import ca.gc.cra.filedrop.domain.protocol.Response;

/**
 * Receives client-side upload milestones. All callbacks run on the uploading thread.
 *
 * @since 0.1.0
 */
public interface ProgressListener {
  /** Listener that ignores every callback. */
  ProgressListener NONE = new ProgressListener() {};

  /**
   * Called for each status frame received from the server.
   *
   * @param response decoded frame
   */
  default void onResponse(Response response) {}

  /**
   * Called after each chunk has been written to the socket.
   *
   * @param sent cumulative payload bytes sent
   * @param total declared payload length
   */
  default void onProgress(long sent, long total) {}

  /**
   * Computes an integer percentage, treating an empty payload as complete.
   *
   * @param sent cumulative bytes sent
   * @param total declared payload length
   * @return percentage in {@code [0, 100]}
   */
  static int percent(long sent, long total) {
    if (total <= 0) {
      return 100;
    }
    return (int) Math.min(100L, sent * 100L / total);
  }
}
