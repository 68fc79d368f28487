package net.vortexdevelopment.tiercache.binding;

import net.vortexdevelopment.tiercache.CacheTier;
import net.vortexdevelopment.tiercache.database.CacheSchema;
import net.vortexdevelopment.tiercache.database.DatabaseConnector;
import net.vortexdevelopment.tiercache.debug.DebugLogger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Event bindings, stored in the binding table and mirrored in process as a map from event name
 * to bindings.
 *
 * <p>The mirror is built lazily from the table unless it was handed in through {@link #warm}.
 * Every change is applied to both the table and the mirror and marks the mirror dirty, so that
 * its owner can persist a fresh copy before the process ends.
 */
public class BindingRegistry {

    /**
     * Id of the persisted mirror in the system realm.
     */
    public static final String MIRROR_ID = "cache_bindings";

    private final DatabaseConnector connector;
    private final CacheSchema schema;

    private HashMap<String, ArrayList<Binding>> mirror;
    private boolean dirty;

    public BindingRegistry(@NotNull DatabaseConnector connector, @NotNull CacheSchema schema) {
        this.connector = connector;
        this.schema = schema;
    }

    /**
     * Adopts a previously persisted mirror.
     *
     * @return false if the value is not a mirror, in which case the registry stays cold
     */
    public boolean warm(@Nullable Object persisted) {
        if (!(persisted instanceof Map<?, ?> map)) {
            return false;
        }
        HashMap<String, ArrayList<Binding>> adopted = new HashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String event) || !(entry.getValue() instanceof Collection<?> values)) {
                return false;
            }
            ArrayList<Binding> bindings = new ArrayList<>(values.size());
            for (Object value : values) {
                if (!(value instanceof Binding binding)) {
                    return false;
                }
                bindings.add(binding);
            }
            adopted.put(event, bindings);
        }
        mirror = adopted;
        dirty = false;
        DebugLogger.log("Binding mirror warmed with %d events", adopted.size());
        return true;
    }

    public boolean isWarm() {
        return mirror != null;
    }

    /**
     * Replaces the mirror with the current content of the binding table.
     */
    public void rebuild() {
        String sql = "SELECT c_event, c_id, c_realm, c_type FROM " + schema.bindingsTable();
        HashMap<String, ArrayList<Binding>> rebuilt = connector.connect(connection -> {
            HashMap<String, ArrayList<Binding>> result = new HashMap<>();
            try (PreparedStatement ps = connection.prepareStatement(sql);
                 ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Binding binding = new Binding(rs.getString(1), rs.getString(2), rs.getString(3),
                            CacheTier.fromCode(rs.getInt(4)));
                    result.computeIfAbsent(binding.getEvent(), event -> new ArrayList<>()).add(binding);
                }
            }
            return result;
        });
        mirror = rebuilt;
        dirty = true;
        DebugLogger.log("Binding mirror rebuilt with %d events", rebuilt.size());
    }

    public void bind(@NotNull Binding binding) {
        bindAll(List.of(binding));
    }

    /**
     * Inserts the bindings in one transaction.
     *
     * @return number of bindings added
     */
    public int bindAll(@NotNull Collection<Binding> bindings) {
        if (bindings.isEmpty()) {
            return 0;
        }
        // built before the insert, a rebuild afterwards would already contain the new rows
        Map<String, ArrayList<Binding>> current = mirror();
        String sql = "INSERT INTO " + schema.bindingsTable() + " (c_event, c_id, c_realm, c_type) VALUES (?, ?, ?, ?)";
        int added = connector.transaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (Binding binding : bindings) {
                    ps.setString(1, binding.getEvent());
                    ps.setString(2, binding.getId());
                    ps.setString(3, binding.getRealm());
                    ps.setInt(4, binding.getTier().getCode());
                    ps.addBatch();
                }
                ps.executeBatch();
                return bindings.size();
            }
        });
        for (Binding binding : bindings) {
            current.computeIfAbsent(binding.getEvent(), event -> new ArrayList<>()).add(binding);
        }
        dirty = true;
        return added;
    }

    /**
     * Deletes the bindings of a realm, or of one entry when {@code id} is not empty.
     *
     * @return number of bindings removed
     */
    public int unbind(@NotNull String realm, @Nullable String id) {
        boolean byId = id != null && !id.isEmpty();
        String sql = "DELETE FROM " + schema.bindingsTable() + " WHERE c_realm = ?" + (byId ? " AND c_id = ?" : "");
        Map<String, ArrayList<Binding>> current = mirror();
        int removed = connector.connect(connection -> {
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                ps.setString(1, realm);
                if (byId) {
                    ps.setString(2, id);
                }
                return ps.executeUpdate();
            }
        });
        current.values().forEach(list -> list.removeIf(binding ->
                binding.getRealm().equals(realm) && (!byId || binding.getId().equals(id))));
        current.values().removeIf(List::isEmpty);
        dirty = true;
        return removed;
    }

    /**
     * Bindings of an event, in insertion order.
     */
    public List<Binding> bindingsFor(@NotNull String event) {
        List<Binding> bindings = mirror().get(event);
        return bindings == null ? List.of() : List.copyOf(bindings);
    }

    /**
     * Serializable copy of the mirror, suitable for storing in a cache tier.
     */
    public HashMap<String, ArrayList<Binding>> snapshot() {
        HashMap<String, ArrayList<Binding>> copy = new HashMap<>();
        mirror().forEach((event, bindings) -> copy.put(event, new ArrayList<>(bindings)));
        return copy;
    }

    public boolean isDirty() {
        return dirty;
    }

    public void markClean() {
        dirty = false;
    }

    private Map<String, ArrayList<Binding>> mirror() {
        if (mirror == null) {
            rebuild();
        }
        return mirror;
    }
}
