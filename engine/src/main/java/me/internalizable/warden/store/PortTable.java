package me.internalizable.warden.store;

import me.internalizable.warden.api.error.ValidationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-user port slot quotas and active forwards.
 */
public class PortTable {

    private final Map<String, Integer> slots = new LinkedHashMap<>();
    private final Map<String, List<PortForward>> forwards = new LinkedHashMap<>();

    /**
     * Get a user's slot quota.
     *
     * @param userId user
     * @return quota, 0 if never assigned
     */
    public int getSlots(@Nonnull String userId) {
        return slots.getOrDefault(userId, 0);
    }

    /**
     * Adjust a user's slot quota.
     *
     * @param userId user
     * @param amount slots to add, may be negative
     * @return new quota
     * @throws ValidationException if the quota would become negative
     */
    public int addSlots(@Nonnull String userId, int amount) {
        Objects.requireNonNull(userId, "userId");
        int updated = getSlots(userId) + amount;
        if (updated < 0) {
            throw new ValidationException("Port slots for " + userId + " cannot go below 0 (would be " + updated + ")");
        }
        slots.put(userId, updated);
        return updated;
    }

    @Nonnull
    public List<PortForward> getForwards(@Nonnull String userId) {
        List<PortForward> list = forwards.get(userId);
        return list != null ? Collections.unmodifiableList(list) : List.of();
    }

    public int countForwards(@Nonnull String userId) {
        List<PortForward> list = forwards.get(userId);
        return list != null ? list.size() : 0;
    }

    /**
     * Collect every host port in use by any user.
     *
     * @return used host ports
     */
    @Nonnull
    public Set<Integer> usedHostPorts() {
        Set<Integer> used = new HashSet<>();
        for (List<PortForward> list : forwards.values()) {
            for (PortForward forward : list) {
                used.add(forward.hostPort());
            }
        }
        return used;
    }

    /**
     * Record a forward.
     *
     * @param userId owning user
     * @param forward forward to add
     * @throws IllegalStateException if its host port is already recorded
     */
    public void addForward(@Nonnull String userId, @Nonnull PortForward forward) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(forward, "forward");
        if (usedHostPorts().contains(forward.hostPort())) {
            throw new IllegalStateException("Host port already recorded: " + forward.hostPort());
        }
        forwards.computeIfAbsent(userId, k -> new ArrayList<>()).add(forward);
    }

    /**
     * Find a user's forward by host port.
     *
     * @param userId user
     * @param hostPort host port
     * @return the forward, or null if the user holds no such forward
     */
    @Nullable
    public PortForward findForward(@Nonnull String userId, int hostPort) {
        for (PortForward forward : getForwards(userId)) {
            if (forward.hostPort() == hostPort) {
                return forward;
            }
        }
        return null;
    }

    /**
     * Remove a user's forward by host port.
     *
     * @param userId user
     * @param hostPort host port
     * @return the removed forward, or null if not found
     */
    @Nullable
    public PortForward removeForward(@Nonnull String userId, int hostPort) {
        List<PortForward> list = forwards.get(userId);
        if (list == null) {
            return null;
        }
        for (Iterator<PortForward> it = list.iterator(); it.hasNext(); ) {
            PortForward forward = it.next();
            if (forward.hostPort() == hostPort) {
                it.remove();
                if (list.isEmpty()) {
                    forwards.remove(userId);
                }
                return forward;
            }
        }
        return null;
    }

    /**
     * Remove every forward that targets an instance, whoever holds it.
     *
     * @param instanceId instance
     * @return removed forwards keyed by user
     */
    @Nonnull
    public Map<String, List<PortForward>> removeForwardsFor(@Nonnull String instanceId) {
        Map<String, List<PortForward>> removed = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, List<PortForward>>> it = forwards.entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<String, List<PortForward>> entry = it.next();
            for (Iterator<PortForward> fit = entry.getValue().iterator(); fit.hasNext(); ) {
                PortForward forward = fit.next();
                if (forward.instanceId().equals(instanceId)) {
                    fit.remove();
                    removed.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).add(forward);
                }
            }
            if (entry.getValue().isEmpty()) {
                it.remove();
            }
        }
        return removed;
    }

    @Nonnull
    Map<String, Integer> getSlotMap() {
        return Collections.unmodifiableMap(slots);
    }

    @Nonnull
    Map<String, List<PortForward>> getForwardMap() {
        return Collections.unmodifiableMap(forwards);
    }

    void putSlots(@Nonnull String userId, int amount) {
        slots.put(userId, amount);
    }

    void putForwards(@Nonnull String userId, @Nonnull List<PortForward> list) {
        forwards.put(userId, new ArrayList<>(list));
    }
}
