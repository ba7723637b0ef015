package io.github.themoah.txwatch.notification;

import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the rendered alert to the log instead of mailing it.
 */
public class LoggingAlertNotifier implements AlertNotifier {

  private static final Logger log = LoggerFactory.getLogger(LoggingAlertNotifier.class);

  private final AlertFormatter formatter;

  public LoggingAlertNotifier(AlertFormatter formatter) {
    this.formatter = formatter;
  }

  @Override
  public Future<Void> deliver(NotificationSummary summary) {
    if (summary.isEmpty()) {
      return Future.succeededFuture();
    }
    log.warn("{}\n{}", summary.subject(), formatter.format(summary));
    return Future.succeededFuture();
  }
}
