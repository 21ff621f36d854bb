package me.internalizable.warden.support;

import me.internalizable.warden.api.NotificationSink;
import me.internalizable.warden.api.OwnershipGrants;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Records owner notifications and ownership-role changes.
 */
public class RecordingNotifications implements NotificationSink, OwnershipGrants {

    private final List<String> messages = new ArrayList<>();
    private final List<String> granted = new ArrayList<>();
    private final List<String> revoked = new ArrayList<>();
    private volatile boolean failing;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public synchronized void notifyOwner(@Nonnull String userId, @Nonnull String message) {
        if (failing) {
            throw new IllegalStateException("delivery failed");
        }
        messages.add(userId + ": " + message);
    }

    @Override
    public synchronized void grant(@Nonnull String userId) {
        if (failing) {
            throw new IllegalStateException("grant failed");
        }
        granted.add(userId);
    }

    @Override
    public synchronized void revoke(@Nonnull String userId) {
        revoked.add(userId);
    }

    public synchronized List<String> getMessages() {
        return new ArrayList<>(messages);
    }

    public synchronized List<String> getGranted() {
        return new ArrayList<>(granted);
    }

    public synchronized List<String> getRevoked() {
        return new ArrayList<>(revoked);
    }
}
