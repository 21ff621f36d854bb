package me.internalizable.warden.store;

import me.internalizable.warden.api.error.InstanceNotFoundException;
import me.internalizable.warden.api.error.ValidationException;
import me.internalizable.warden.instance.Instance;
import me.internalizable.warden.instance.InstanceStatus;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * The three record collections: instances by owner, admins and ports.
 *
 * <p>Not thread-safe; only reachable through {@link InstanceStore}.</p>
 */
public class FleetState {

    private final Map<String, List<Instance>> instancesByOwner = new LinkedHashMap<>();
    private final AdminRegistry admins;
    private final PortTable ports;

    FleetState(@Nonnull AdminRegistry admins, @Nonnull PortTable ports) {
        this.admins = Objects.requireNonNull(admins, "admins");
        this.ports = Objects.requireNonNull(ports, "ports");
    }

    // ==================== Instances ====================

    /**
     * Find an instance by id.
     *
     * @param instanceId instance id
     * @return the live record, or null if not found
     */
    @Nullable
    public Instance findInstance(@Nonnull String instanceId) {
        Objects.requireNonNull(instanceId, "instanceId");
        for (List<Instance> list : instancesByOwner.values()) {
            for (Instance instance : list) {
                if (instance.getId().equals(instanceId)) {
                    return instance;
                }
            }
        }
        return null;
    }

    /**
     * Get an instance by id.
     *
     * @param instanceId instance id
     * @return the live record
     * @throws InstanceNotFoundException if not found
     */
    @Nonnull
    public Instance requireInstance(@Nonnull String instanceId) {
        Instance instance = findInstance(instanceId);
        if (instance == null) {
            throw new InstanceNotFoundException("No instance with id " + instanceId);
        }
        return instance;
    }

    public boolean hasInstance(@Nonnull String instanceId) {
        return findInstance(instanceId) != null;
    }

    /**
     * Add an instance under its owner.
     *
     * @param instance instance to add
     * @throws ValidationException if the id is already taken
     */
    public void addInstance(@Nonnull Instance instance) {
        Objects.requireNonNull(instance, "instance");
        if (hasInstance(instance.getId())) {
            throw new ValidationException("Instance id already in use: " + instance.getId());
        }
        instancesByOwner.computeIfAbsent(instance.getOwnerId(), k -> new ArrayList<>()).add(instance);
    }

    /**
     * Remove an instance. An owner left without instances is dropped.
     *
     * @param instanceId instance id
     * @return the removed record, or null if not found
     */
    @Nullable
    public Instance removeInstance(@Nonnull String instanceId) {
        Objects.requireNonNull(instanceId, "instanceId");
        for (Iterator<Map.Entry<String, List<Instance>>> it = instancesByOwner.entrySet().iterator(); it.hasNext(); ) {
            List<Instance> list = it.next().getValue();
            for (Iterator<Instance> iit = list.iterator(); iit.hasNext(); ) {
                Instance instance = iit.next();
                if (instance.getId().equals(instanceId)) {
                    iit.remove();
                    if (list.isEmpty()) {
                        it.remove();
                    }
                    return instance;
                }
            }
        }
        return null;
    }

    @Nonnull
    public List<Instance> getInstances(@Nonnull String ownerId) {
        List<Instance> list = instancesByOwner.get(ownerId);
        return list != null ? Collections.unmodifiableList(list) : List.of();
    }

    public int countInstances(@Nonnull String ownerId) {
        List<Instance> list = instancesByOwner.get(ownerId);
        return list != null ? list.size() : 0;
    }

    @Nonnull
    public List<Instance> getAllInstances() {
        return instancesByOwner.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toList());
    }

    @Nonnull
    public List<Instance> getInstances(@Nonnull Predicate<Instance> filter) {
        return instancesByOwner.values().stream()
                .flatMap(List::stream)
                .filter(filter)
                .collect(Collectors.toList());
    }

    @Nonnull
    public List<Instance> getInstancesByStatus(@Nonnull InstanceStatus status) {
        return getInstances(instance -> instance.getInstanceStatus() == status);
    }

    @Nonnull
    public Set<String> getOwnerIds() {
        return Collections.unmodifiableSet(instancesByOwner.keySet());
    }

    @Nonnull
    Map<String, List<Instance>> getInstanceMap() {
        return Collections.unmodifiableMap(instancesByOwner);
    }

    void putInstances(@Nonnull String ownerId, @Nonnull List<Instance> instances) {
        instancesByOwner.put(ownerId, new ArrayList<>(instances));
    }

    // ==================== Admins & Ports ====================

    @Nonnull
    public AdminRegistry getAdmins() {
        return admins;
    }

    @Nonnull
    public PortTable getPorts() {
        return ports;
    }
}
