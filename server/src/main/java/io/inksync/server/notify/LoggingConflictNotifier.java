// file: server/src/main/java/io/inksync/server/notify/LoggingConflictNotifier.java
package io.inksync.server.notify;

import java.util.logging.Logger;

/**
 * Notifier used when no delivery channel is wired: writes one line per notification.
 */
public final class LoggingConflictNotifier implements ConflictNotifier {
    private static final Logger log = Logger.getLogger(LoggingConflictNotifier.class.getName());

    @Override
    public void notifyUsers(ConflictNotification n) {
        log.info(String.format("notify users=%s conflict=%s kind=%s: %s%s",
                n.userIds(),
                n.conflictId(),
                n.kind(),
                n.message(),
                n.suggestedAlternatives().isEmpty() ? "" : " (alternatives: " + n.suggestedAlternatives() + ")"));
    }
}
