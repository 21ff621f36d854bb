package me.internalizable.warden.api.error;

import javax.annotation.Nonnull;

/**
 * A user already holds as many port forwards as their slot quota allows.
 */
public class QuotaExceededException extends ValidationException {

    private final int slots;

    public QuotaExceededException(@Nonnull String userId, int slots) {
        super("User " + userId + " has used all " + slots + " port slots");
        this.slots = slots;
    }

    public int getSlots() {
        return slots;
    }
}
