package me.internalizable.warden.store;

import me.internalizable.warden.instance.Instance;
import me.internalizable.warden.instance.InstanceStatus;
import me.internalizable.warden.instance.Resources;
import me.internalizable.warden.instance.SuspensionEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * JSON shapes of the three persisted documents and their conversion to
 * and from the in-memory records.
 */
final class FleetDocuments {

    private static final Logger LOGGER = LoggerFactory.getLogger(FleetDocuments.class);

    private FleetDocuments() {
    }

    // ==================== Instances ====================

    static Map<String, List<InstanceDocument>> fromInstances(Map<String, List<Instance>> instancesByOwner) {
        Map<String, List<InstanceDocument>> document = new LinkedHashMap<>();
        instancesByOwner.forEach((ownerId, instances) -> {
            List<InstanceDocument> list = new ArrayList<>(instances.size());
            for (Instance instance : instances) {
                list.add(InstanceDocument.from(instance));
            }
            document.put(ownerId, list);
        });
        return document;
    }

    static Map<String, List<Instance>> toInstances(Map<String, List<InstanceDocument>> document) {
        Map<String, List<Instance>> instancesByOwner = new LinkedHashMap<>();
        if (document == null) {
            return instancesByOwner;
        }
        document.forEach((ownerId, documents) -> {
            List<Instance> list = new ArrayList<>();
            if (documents != null) {
                for (InstanceDocument doc : documents) {
                    try {
                        list.add(doc.toInstance(ownerId));
                    } catch (RuntimeException e) {
                        LOGGER.warn("Skipping unreadable instance record of owner {}: {}", ownerId, e.getMessage());
                    }
                }
            }
            instancesByOwner.put(ownerId, list);
        });
        return instancesByOwner;
    }

    static int countRecords(Map<String, List<InstanceDocument>> document) {
        if (document == null) {
            return 0;
        }
        int count = 0;
        for (List<InstanceDocument> documents : document.values()) {
            if (documents != null) {
                count += documents.size();
            }
        }
        return count;
    }

    /**
     * One instance record.
     */
    static class InstanceDocument {
        String containerName;
        String ram;
        String cpu;
        String storage;
        String config;
        String status;
        boolean suspended;
        List<SuspensionDocument> suspensionHistory;
        String createdAt;
        List<String> sharedWith;

        static InstanceDocument from(Instance instance) {
            InstanceDocument doc = new InstanceDocument();
            doc.containerName = instance.getId();
            doc.ram = instance.getRamGb() + "GB";
            doc.cpu = String.valueOf(instance.getCpuCores());
            doc.storage = instance.getDiskGb() + "GB";
            doc.config = instance.getConfig();
            doc.status = instance.getStatus();
            doc.suspended = instance.isSuspended();
            doc.suspensionHistory = new ArrayList<>();
            for (SuspensionEntry entry : instance.getSuspensionHistory()) {
                SuspensionDocument sd = new SuspensionDocument();
                sd.time = entry.time().toString();
                sd.reason = entry.reason();
                sd.by = entry.actor();
                doc.suspensionHistory.add(sd);
            }
            doc.createdAt = instance.getCreatedAt().toString();
            doc.sharedWith = new ArrayList<>(instance.getSharedWith());
            return doc;
        }

        Instance toInstance(String ownerId) {
            if (containerName == null || containerName.isBlank()) {
                throw new IllegalArgumentException("record has no container_name");
            }
            Resources resources = new Resources(parseSize(ram), parseSize(cpu), parseSize(storage));

            InstanceStatus parsed = status != null ? InstanceStatus.fromName(status) : InstanceStatus.STOPPED;
            if (suspended) {
                // legacy records could carry suspended=true next to status "stopped"
                parsed = InstanceStatus.SUSPENDED;
            }

            List<SuspensionEntry> history = new ArrayList<>();
            if (suspensionHistory != null) {
                for (SuspensionDocument sd : suspensionHistory) {
                    history.add(new SuspensionEntry(
                            parseTime(sd.time),
                            sd.reason != null ? sd.reason : "",
                            sd.by != null ? sd.by : ""));
                }
            }

            Instant created = createdAt != null ? parseTime(createdAt) : Instant.EPOCH;
            List<String> shared = sharedWith != null ? sharedWith : List.of();
            return new Instance(containerName, ownerId, resources, parsed, created, history,
                    new LinkedHashSet<>(shared));
        }
    }

    /**
     * One suspension audit entry.
     */
    static class SuspensionDocument {
        String time;
        String reason;
        String by;
    }

    // ==================== Admins ====================

    /**
     * Admin registry document.
     */
    static class AdminDocument {
        String mainAdmin;
        List<String> admins;

        static AdminDocument from(AdminRegistry registry) {
            AdminDocument doc = new AdminDocument();
            doc.mainAdmin = registry.getMainAdminId();
            doc.admins = new ArrayList<>(registry.getDelegated());
            return doc;
        }

        AdminRegistry toRegistry(String mainAdminId) {
            if (mainAdmin != null && !mainAdmin.equals(mainAdminId)) {
                LOGGER.warn("Stored main admin {} differs from configured {}; using configured", mainAdmin, mainAdminId);
            }
            return new AdminRegistry(mainAdminId, admins != null ? admins : List.of());
        }
    }

    // ==================== Ports ====================

    /**
     * Port allocation document.
     */
    static class PortDocument {
        Map<String, SlotDocument> users;
        Map<String, List<ForwardDocument>> activePorts;

        static PortDocument from(PortTable table) {
            PortDocument doc = new PortDocument();
            doc.users = new LinkedHashMap<>();
            table.getSlotMap().forEach((userId, slots) -> {
                SlotDocument sd = new SlotDocument();
                sd.slots = slots;
                doc.users.put(userId, sd);
            });
            doc.activePorts = new LinkedHashMap<>();
            table.getForwardMap().forEach((userId, forwards) -> {
                List<ForwardDocument> list = new ArrayList<>(forwards.size());
                for (PortForward forward : forwards) {
                    ForwardDocument fd = new ForwardDocument();
                    fd.container = forward.instanceId();
                    fd.internalPort = forward.internalPort();
                    fd.hostPort = forward.hostPort();
                    list.add(fd);
                }
                doc.activePorts.put(userId, list);
            });
            return doc;
        }

        PortTable toTable() {
            PortTable table = new PortTable();
            if (users != null) {
                users.forEach((userId, sd) -> table.putSlots(userId, sd != null ? Math.max(0, sd.slots) : 0));
            }
            if (activePorts != null) {
                activePorts.forEach((userId, forwards) -> {
                    List<PortForward> list = new ArrayList<>();
                    if (forwards != null) {
                        for (ForwardDocument fd : forwards) {
                            if (fd != null && fd.container != null) {
                                list.add(new PortForward(fd.container, fd.internalPort, fd.hostPort));
                            }
                        }
                    }
                    table.putForwards(userId, list);
                });
            }
            return table;
        }
    }

    /**
     * Slot quota of one user.
     */
    static class SlotDocument {
        int slots;
    }

    /**
     * One active forward.
     */
    static class ForwardDocument {
        String container;
        int internalPort;
        int hostPort;
    }

    // ==================== Parsing ====================

    /**
     * Parse {@code "4GB"}, {@code "4"} or {@code "4 GB"}.
     */
    static int parseSize(String value) {
        if (value == null) {
            throw new IllegalArgumentException("missing resource value");
        }
        String digits = value.trim().toUpperCase();
        if (digits.endsWith("GB")) {
            digits = digits.substring(0, digits.length() - 2).trim();
        }
        return Integer.parseInt(digits);
    }

    /**
     * Parse an ISO instant, falling back to a local date-time in the system zone.
     */
    static Instant parseTime(String value) {
        if (value == null) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(value).atZone(ZoneId.systemDefault()).toInstant();
        }
    }
}
