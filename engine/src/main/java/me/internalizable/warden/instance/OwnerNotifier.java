package me.internalizable.warden.instance;

import me.internalizable.warden.api.NotificationSink;
import me.internalizable.warden.api.OwnershipGrants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Best-effort calls into the owner-facing collaborators.
 *
 * <p>Failures are logged and never reach the operation that triggered them.</p>
 */
public class OwnerNotifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(OwnerNotifier.class);

    private final NotificationSink sink;
    private final OwnershipGrants grants;

    public OwnerNotifier(@Nonnull NotificationSink sink, @Nonnull OwnershipGrants grants) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.grants = Objects.requireNonNull(grants, "grants");
    }

    public void notifyOwner(@Nonnull String userId, @Nonnull String message) {
        try {
            sink.notifyOwner(userId, message);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to notify user {}: {}", userId, e.getMessage());
        }
    }

    public void grantOwnership(@Nonnull String userId) {
        try {
            grants.grant(userId);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to grant ownership role to {}: {}", userId, e.getMessage());
        }
    }

    public void revokeOwnership(@Nonnull String userId) {
        try {
            grants.revoke(userId);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to revoke ownership role from {}: {}", userId, e.getMessage());
        }
    }
}
