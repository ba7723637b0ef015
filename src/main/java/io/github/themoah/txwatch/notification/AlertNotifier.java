package io.github.themoah.txwatch.notification;

import io.vertx.core.Future;

/**
 * Delivers alert summaries to an external channel.
 */
public interface AlertNotifier {

  /**
   * Delivers a non-empty summary.
   *
   * @param summary the summary to send
   * @return Future that fails if delivery failed
   */
  Future<Void> deliver(NotificationSummary summary);
}
