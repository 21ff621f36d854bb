package me.internalizable.warden.port;

import me.internalizable.warden.api.error.CommandExecutionException;
import me.internalizable.warden.api.error.QuotaExceededException;
import me.internalizable.warden.api.error.ValidationException;
import me.internalizable.warden.command.CommandExecutor;
import me.internalizable.warden.command.InstanceTool;
import me.internalizable.warden.store.InstanceStore;
import me.internalizable.warden.store.PortForward;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Hands out host ports from a fixed range and installs the matching
 * forwarding rules on the instance.
 *
 * <p>Host ports are unique across all users. A port chosen for an
 * allocation in flight is reserved until its rules are installed or have
 * failed, so two concurrent allocations never pick the same port.</p>
 */
public class PortAllocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PortAllocator.class);

    private final InstanceStore store;
    private final CommandExecutor executor;
    private final InstanceTool tool;
    private final int rangeStart;
    private final int rangeEnd;

    // guarded by the store lock
    private final Set<Integer> reserved = new HashSet<>();

    /**
     * Create a port allocator.
     *
     * @param store instance store
     * @param executor command executor
     * @param tool command builder
     * @param rangeStart first host port, inclusive
     * @param rangeEnd last host port, inclusive
     */
    public PortAllocator(@Nonnull InstanceStore store, @Nonnull CommandExecutor executor,
                         @Nonnull InstanceTool tool, int rangeStart, int rangeEnd) {
        this.store = Objects.requireNonNull(store, "store");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.tool = Objects.requireNonNull(tool, "tool");
        if (rangeStart < 1 || rangeEnd > 65535 || rangeStart > rangeEnd) {
            throw new IllegalArgumentException("Invalid port range " + rangeStart + ".." + rangeEnd);
        }
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
    }

    /**
     * Find the lowest host port not used by any user.
     *
     * @return free port, or empty if the range is exhausted
     */
    @Nonnull
    public OptionalInt nextPort() {
        return store.read(state -> lowestFree(state.getPorts().usedHostPorts()));
    }

    /**
     * Forward a new host port to a port inside an instance (TCP and UDP).
     *
     * @param userId user holding the forward
     * @param instanceId target instance
     * @param internalPort port inside the instance
     * @return the recorded forward
     * @throws QuotaExceededException if the user has no free slot; no command is run
     * @throws ValidationException if the internal port is invalid or no host port is free
     * @throws CommandExecutionException if a forwarding rule could not be installed
     */
    @Nonnull
    public PortForward allocate(@Nonnull String userId, @Nonnull String instanceId, int internalPort) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(instanceId, "instanceId");

        int hostPort = store.compute(state -> {
            int slots = state.getPorts().getSlots(userId);
            if (state.getPorts().countForwards(userId) >= slots) {
                throw new QuotaExceededException(userId, slots);
            }
            if (internalPort < 1 || internalPort > 65535) {
                throw new ValidationException("Internal port must be within 1..65535, got " + internalPort);
            }
            state.requireInstance(instanceId);

            OptionalInt free = lowestFree(state.getPorts().usedHostPorts());
            if (free.isEmpty()) {
                throw new ValidationException("No free host ports in " + rangeStart + ".." + rangeEnd);
            }
            reserved.add(free.getAsInt());
            return free.getAsInt();
        });

        try {
            executor.execute(tool.addProxyDevice(instanceId, InstanceTool.PROTOCOL_TCP, hostPort, internalPort));
            try {
                executor.execute(tool.addProxyDevice(instanceId, InstanceTool.PROTOCOL_UDP, hostPort, internalPort));
            } catch (CommandExecutionException e) {
                removeRule(instanceId, InstanceTool.PROTOCOL_TCP, hostPort);
                throw e;
            }
        } catch (RuntimeException e) {
            store.mutate(state -> reserved.remove(hostPort));
            LOGGER.warn("Failed to forward host port {} to {}:{}: {}", hostPort, instanceId, internalPort, e.getMessage());
            throw e;
        }

        PortForward forward = new PortForward(instanceId, internalPort, hostPort);
        store.mutate(state -> {
            reserved.remove(hostPort);
            state.getPorts().addForward(userId, forward);
        });
        store.save();

        LOGGER.info("Forwarded host port {} to {}:{} for user {}", hostPort, instanceId, internalPort, userId);
        return forward;
    }

    /**
     * Remove a forward. Rule removal failures are logged and the record is
     * removed regardless.
     *
     * @param userId user holding the forward
     * @param hostPort host port of the forward
     * @return the removed forward
     * @throws ValidationException if the user holds no forward on that port
     */
    @Nonnull
    public PortForward release(@Nonnull String userId, int hostPort) {
        Objects.requireNonNull(userId, "userId");

        PortForward forward = store.read(state -> state.getPorts().findForward(userId, hostPort));
        if (forward == null) {
            throw new ValidationException("User " + userId + " has no forward on host port " + hostPort);
        }

        removeRule(forward.instanceId(), InstanceTool.PROTOCOL_TCP, hostPort);
        removeRule(forward.instanceId(), InstanceTool.PROTOCOL_UDP, hostPort);

        store.mutate(state -> state.getPorts().removeForward(userId, hostPort));
        store.save();

        LOGGER.info("Released host port {} ({}:{}) of user {}", hostPort, forward.instanceId(),
                forward.internalPort(), userId);
        return forward;
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
        int total = store.compute(state -> state.getPorts().addSlots(userId, amount));
        store.save();
        LOGGER.info("Port slots of user {} adjusted by {} to {}", userId, amount, total);
        return total;
    }

    @Nonnull
    public List<PortForward> getForwards(@Nonnull String userId) {
        return store.read(state -> List.copyOf(state.getPorts().getForwards(userId)));
    }

    public int getSlots(@Nonnull String userId) {
        return store.read(state -> state.getPorts().getSlots(userId));
    }

    public int getRangeStart() {
        return rangeStart;
    }

    public int getRangeEnd() {
        return rangeEnd;
    }

    private OptionalInt lowestFree(Set<Integer> used) {
        for (int port = rangeStart; port <= rangeEnd; port++) {
            if (!used.contains(port) && !reserved.contains(port)) {
                return OptionalInt.of(port);
            }
        }
        return OptionalInt.empty();
    }

    private void removeRule(String instanceId, String protocol, int hostPort) {
        try {
            executor.execute(tool.removeProxyDevice(instanceId, protocol, hostPort));
        } catch (CommandExecutionException e) {
            LOGGER.warn("Failed to remove {} rule for host port {} on {}: {}", protocol, hostPort, instanceId,
                    e.getMessage());
        }
    }
}
