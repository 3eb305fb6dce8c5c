// file: server/src/main/java/io/inksync/server/notify/ConflictNotifier.java
package io.inksync.server.notify;

/**
 * Delivers conflict notifications to users (websocket fan-out, mail, ...).
 * Implementations may block; they are only ever called from the async dispatcher.
 */
@FunctionalInterface
public interface ConflictNotifier {

    void notifyUsers(ConflictNotification notification);
}
