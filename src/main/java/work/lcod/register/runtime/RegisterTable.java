package work.lcod.register.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name to creator mapping for one (base, signature) pair.
 *
 * <p>Every access runs under the table monitor. Callers copy the entry out and invoke its creator
 * after the lock is released, so slow or reentrant constructors never hold the table.
 */
public final class RegisterTable<B extends Registrable> {
    private static final Logger logger = LoggerFactory.getLogger(RegisterTable.class);

    private final String id;
    private final Map<String, Entry<B>> entries = new HashMap<>();

    RegisterTable(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String id() {
        return id;
    }

    synchronized boolean insert(Entry<B> entry) {
        if (entries.putIfAbsent(entry.name(), entry) != null) {
            logger.debug("{}: name '{}' already registered, rejecting {}", id, entry.name(), entry.childType().getName());
            return false;
        }
        logger.debug("{}: registered '{}' -> {}", id, entry.name(), entry.childType().getName());
        return true;
    }

    synchronized Entry<B> remove(String name) {
        Entry<B> removed = entries.remove(name);
        if (removed != null) {
            logger.debug("{}: removed '{}'", id, name);
        }
        return removed;
    }

    synchronized Entry<B> get(String name) {
        return entries.get(name);
    }

    synchronized boolean contains(String name) {
        return entries.containsKey(name);
    }

    synchronized List<String> names() {
        List<String> names = new ArrayList<>(entries.keySet());
        Collections.sort(names);
        return names;
    }

    synchronized List<Entry<B>> entries() {
        List<Entry<B>> snapshot = new ArrayList<>(entries.values());
        snapshot.sort((left, right) -> left.name().compareTo(right.name()));
        return snapshot;
    }

    synchronized int size() {
        return entries.size();
    }

    /**
     * One registered child: its creator, its concrete type and the binder that installed it
     * ({@code null} for entries added directly with {@link RegisterBase#setChild}).
     */
    public record Entry<B extends Registrable>(String name, Class<?> childType, Creator<? extends B> creator, Register<?, B> binding) {
        public Entry {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(childType, "childType");
            Objects.requireNonNull(creator, "creator");
        }

        public boolean bound() {
            return binding != null;
        }
    }
}
