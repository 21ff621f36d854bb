package me.internalizable.warden.store;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import me.internalizable.warden.api.error.PersistenceException;
import me.internalizable.warden.store.FleetDocuments.AdminDocument;
import me.internalizable.warden.store.FleetDocuments.InstanceDocument;
import me.internalizable.warden.store.FleetDocuments.PortDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Authoritative record of instances, admins and port allocations.
 *
 * <p>All access to the {@link FleetState} is serialized through one lock:
 * {@link #read(Function)} for queries, {@link #mutate(Consumer)} and
 * {@link #compute(Function)} for changes. Changes are only durable once
 * {@link #save()} returns.</p>
 *
 * <p>Each collection lives in its own JSON file and is written to a
 * temporary file that is then atomically moved over the old one, so a crash
 * leaves any single file either old or new, never half-written.</p>
 */
public class InstanceStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InstanceStore.class);

    public static final String INSTANCES_FILE = "vps_data.json";
    public static final String ADMINS_FILE = "admin_data.json";
    public static final String PORTS_FILE = "port_data.json";

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();

    private static final Type INSTANCES_TYPE = new TypeToken<Map<String, List<InstanceDocument>>>() {
    }.getType();

    private final Path dataDirectory;
    private final ReentrantLock lock = new ReentrantLock();
    private final FleetState state;

    private InstanceStore(@Nonnull Path dataDirectory, @Nonnull FleetState state) {
        this.dataDirectory = dataDirectory;
        this.state = state;
    }

    /**
     * Load the store from a data directory. Missing or corrupt files start empty;
     * a corrupt file, or one with unreadable records, is first preserved as
     * {@code <name>.corrupt-<millis>}.
     *
     * @param dataDirectory directory holding the three documents
     * @param mainAdminId configured main admin
     * @return loaded store
     * @throws PersistenceException if a damaged file cannot be preserved
     */
    @Nonnull
    public static InstanceStore load(@Nonnull Path dataDirectory, @Nonnull String mainAdminId) {
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        Objects.requireNonNull(mainAdminId, "mainAdminId");

        Map<String, List<InstanceDocument>> instances = readDocument(dataDirectory.resolve(INSTANCES_FILE), INSTANCES_TYPE);
        AdminDocument admins = readDocument(dataDirectory.resolve(ADMINS_FILE), AdminDocument.class);
        PortDocument ports = readDocument(dataDirectory.resolve(PORTS_FILE), PortDocument.class);

        FleetState state = new FleetState(
                admins != null ? admins.toRegistry(mainAdminId) : new AdminRegistry(mainAdminId),
                ports != null ? ports.toTable() : new PortTable());
        FleetDocuments.toInstances(instances).forEach(state::putInstances);

        int stored = FleetDocuments.countRecords(instances);
        if (state.getAllInstances().size() < stored) {
            setAside(dataDirectory.resolve(INSTANCES_FILE), false);
        }

        LOGGER.info("Loaded {} instance(s) of {} owner(s), {} admin(s) from {}",
                state.getAllInstances().size(), state.getOwnerIds().size(), state.getAdmins().size(),
                dataDirectory.toAbsolutePath());
        return new InstanceStore(dataDirectory, state);
    }

    /**
     * Create an empty store that saves into {@code dataDirectory}.
     *
     * @param dataDirectory directory holding the three documents
     * @param mainAdminId main admin
     * @return empty store
     */
    @Nonnull
    public static InstanceStore empty(@Nonnull Path dataDirectory, @Nonnull String mainAdminId) {
        return new InstanceStore(Objects.requireNonNull(dataDirectory, "dataDirectory"),
                new FleetState(new AdminRegistry(mainAdminId), new PortTable()));
    }

    // ==================== Access ====================

    /**
     * Run a query against the state.
     *
     * @param query function of the state; must not leak live records
     * @param <T> result type
     * @return query result
     */
    public <T> T read(@Nonnull Function<FleetState, T> query) {
        Objects.requireNonNull(query, "query");
        lock.lock();
        try {
            return query.apply(state);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply a change to the state.
     *
     * @param mutation change to apply
     */
    public void mutate(@Nonnull Consumer<FleetState> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        lock.lock();
        try {
            mutation.accept(state);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply a change to the state and return a value derived from it.
     *
     * @param mutation change to apply
     * @param <T> result type
     * @return mutation result
     */
    public <T> T compute(@Nonnull Function<FleetState, T> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        lock.lock();
        try {
            return mutation.apply(state);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Persistence ====================

    /**
     * Persist all three collections, one file at a time.
     *
     * @throws PersistenceException if any file cannot be written; files
     *                              written before the failure stay updated
     */
    public void save() {
        lock.lock();
        try {
            Files.createDirectories(dataDirectory);
            writeAtomically(dataDirectory.resolve(INSTANCES_FILE),
                    GSON.toJson(FleetDocuments.fromInstances(state.getInstanceMap()), INSTANCES_TYPE));
            writeAtomically(dataDirectory.resolve(ADMINS_FILE),
                    GSON.toJson(AdminDocument.from(state.getAdmins())));
            writeAtomically(dataDirectory.resolve(PORTS_FILE),
                    GSON.toJson(PortDocument.from(state.getPorts())));
            LOGGER.debug("Saved fleet state to {}", dataDirectory);
        } catch (IOException e) {
            LOGGER.error("Failed to save fleet state to {}", dataDirectory, e);
            throw new PersistenceException("Failed to save data: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    @Nonnull
    public Path getDataDirectory() {
        return dataDirectory;
    }

    private static void writeAtomically(Path target, String json) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(temp, json, StandardCharsets.UTF_8);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Nullable
    private static <T> T readDocument(Path file, Type type) {
        if (!Files.exists(file)) {
            LOGGER.warn("{} not found, starting with empty data", file.getFileName());
            return null;
        }
        try {
            return GSON.fromJson(Files.readString(file, StandardCharsets.UTF_8), type);
        } catch (IOException | JsonParseException e) {
            LOGGER.error("{} is unreadable or corrupted, starting with empty data: {}", file.getFileName(), e.getMessage());
            setAside(file, true);
            return null;
        }
    }

    /**
     * Keep the contents of a document that did not load completely, since the
     * next save replaces it with what is in memory.
     *
     * @param file damaged document
     * @param move true to move the file away, false to keep a copy next to it
     * @throws PersistenceException if the contents cannot be preserved
     */
    private static void setAside(Path file, boolean move) {
        Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            if (move) {
                Files.move(file, aside);
            } else {
                Files.copy(file, aside);
            }
        } catch (IOException e) {
            throw new PersistenceException("Refusing to load: could not preserve " + file.getFileName()
                    + " as " + aside.getFileName() + ": " + e.getMessage(), e);
        }
        LOGGER.error("Preserved the original contents of {} as {}", file.getFileName(), aside.getFileName());
    }
}
