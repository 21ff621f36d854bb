package me.internalizable.warden;

import me.internalizable.warden.api.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Notification sink that writes owner messages to the log.
 *
 * <p>Used by the standalone daemon, where no chat platform is attached.</p>
 */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void notifyOwner(@Nonnull String userId, @Nonnull String message) {
        LOGGER.info("[notify {}] {}", userId, message);
    }
}
