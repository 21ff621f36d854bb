package me.internalizable.warden.store;

import me.internalizable.warden.api.error.ValidationException;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The fixed main admin plus the delegated admins.
 *
 * <p>The main admin is never a member of the delegated set and cannot be
 * removed.</p>
 */
public class AdminRegistry {

    private final String mainAdminId;
    private final Set<String> delegated = new LinkedHashSet<>();

    public AdminRegistry(@Nonnull String mainAdminId) {
        this(mainAdminId, Set.of());
    }

    /**
     * Create a registry. The main admin is dropped from {@code delegated} if present.
     *
     * @param mainAdminId main admin id
     * @param delegated delegated admin ids
     */
    public AdminRegistry(@Nonnull String mainAdminId, @Nonnull Collection<String> delegated) {
        this.mainAdminId = Objects.requireNonNull(mainAdminId, "mainAdminId");
        for (String userId : delegated) {
            if (userId != null && !userId.equals(mainAdminId)) {
                this.delegated.add(userId);
            }
        }
    }

    /**
     * Add a delegated admin.
     *
     * @param userId user to promote
     * @throws ValidationException if the user is the main admin or already an admin
     */
    public void add(@Nonnull String userId) {
        Objects.requireNonNull(userId, "userId");
        if (isMainAdmin(userId)) {
            throw new ValidationException("User " + userId + " is the main admin");
        }
        if (!delegated.add(userId)) {
            throw new ValidationException("User " + userId + " is already an admin");
        }
    }

    /**
     * Remove a delegated admin.
     *
     * @param userId user to demote
     * @throws ValidationException if the user is the main admin or not an admin
     */
    public void remove(@Nonnull String userId) {
        Objects.requireNonNull(userId, "userId");
        if (isMainAdmin(userId)) {
            throw new ValidationException("The main admin cannot be removed");
        }
        if (!delegated.remove(userId)) {
            throw new ValidationException("User " + userId + " is not an admin");
        }
    }

    public boolean isAdmin(@Nonnull String userId) {
        return isMainAdmin(userId) || delegated.contains(userId);
    }

    public boolean isMainAdmin(@Nonnull String userId) {
        return mainAdminId.equals(userId);
    }

    @Nonnull
    public String getMainAdminId() {
        return mainAdminId;
    }

    @Nonnull
    public Set<String> getDelegated() {
        return Collections.unmodifiableSet(delegated);
    }

    /**
     * Count admins including the main admin.
     *
     * @return delegated admins + 1
     */
    public int size() {
        return delegated.size() + 1;
    }
}
