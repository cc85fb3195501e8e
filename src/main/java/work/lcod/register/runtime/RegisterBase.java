package work.lcod.register.runtime;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates children of a base type by registered name.
 *
 * <p>There is one instance per (base type, signature) pair for the whole process, obtained through
 * {@link #of(Class, Class[])} and created on first access. Every failure is reported as a
 * {@code null}, empty handle or {@code false} result: an unknown name is never an exception.
 * Arguments that do not fit the signature are a caller bug and raise
 * {@link IllegalArgumentException}.
 *
 * <pre>{@code
 * abstract class Fruit implements Registrable {
 *     static final RegisterBase<Fruit> BASE = RegisterBase.of(Fruit.class);
 * }
 * Fruit apple = Fruit.BASE.create("Apple");
 * }</pre>
 */
public final class RegisterBase<B extends Registrable> {
    private static final Logger logger = LoggerFactory.getLogger(RegisterBase.class);
    private static final Map<Key, RegisterBase<?>> BASES = new ConcurrentHashMap<>();

    private final Class<B> baseType;
    private final Signature signature;
    private final RegisterTable<B> table;

    private RegisterBase(Class<B> baseType, Signature signature) {
        this.baseType = baseType;
        this.signature = signature;
        this.table = new RegisterTable<>(displayId(baseType, signature));
    }

    // BASES maps a key to a base created from the same Class<B>, so the cast holds
    @SuppressWarnings("unchecked")
    public static <B extends Registrable> RegisterBase<B> of(Class<B> baseType, Class<?>... parameterTypes) {
        Objects.requireNonNull(baseType, "baseType");
        Signature signature = Signature.of(parameterTypes);
        return (RegisterBase<B>) BASES.computeIfAbsent(
            new Key(baseType, signature),
            key -> new RegisterBase<>(baseType, signature)
        );
    }

    /**
     * Every base created so far in this process, ordered by {@link #id()}.
     */
    public static List<RegisterBase<?>> all() {
        List<RegisterBase<?>> bases = new ArrayList<>(BASES.values());
        bases.sort(Comparator.comparing(RegisterBase::id));
        return bases;
    }

    public static Optional<RegisterBase<?>> find(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return BASES.values().stream().filter(base -> base.id().equals(id)).findFirst();
    }

    public Class<B> baseType() {
        return baseType;
    }

    public Signature signature() {
        return signature;
    }

    /**
     * Base simple name, followed by the parameter list when the signature is not empty
     * (e.g. {@code Fruit}, {@code Fruit(int, String)}).
     */
    public String id() {
        return table.id();
    }

    public B create(String name, Object... args) {
        return construct(name, args);
    }

    public Owned<B> createUnique(String name, Object... args) {
        return Owned.of(construct(name, args));
    }

    public Shared<B> createShared(String name, Object... args) {
        return Shared.of(construct(name, args));
    }

    public boolean hasChild(String name) {
        return name != null && table.contains(name);
    }

    public boolean removeChild(String name) {
        if (name == null) {
            return false;
        }
        RegisterTable.Entry<B> removed = table.remove(name);
        if (removed == null) {
            return false;
        }
        if (removed.bound()) {
            removed.binding().released(name);
        }
        return true;
    }

    /**
     * Registers {@code childType} under {@code name}. Fails without touching the table when the
     * name is null, empty or already taken, whichever child holds it.
     */
    public <C extends B> boolean setChild(String name, Class<C> childType, Creator<? extends C> creator) {
        Objects.requireNonNull(childType, "childType");
        Objects.requireNonNull(creator, "creator");
        return insert(name, childType, creator, null);
    }

    /**
     * Registers the child of {@code binding} under an additional name. The binder keeps its own
     * name; use {@link Register#setName(String)} to move it.
     */
    public boolean setChild(String name, Register<?, B> binding) {
        Objects.requireNonNull(binding, "binding");
        if (binding.base() != this) {
            throw new IllegalArgumentException(binding.childType().getName() + " is bound to " + binding.base().id() + ", not " + id());
        }
        binding.activate();
        return insert(name, binding.childType(), binding.creator(), binding);
    }

    public List<String> getChildren() {
        return table.names();
    }

    public Optional<Class<?>> childType(String name) {
        return lookup(name).map(RegisterTable.Entry::childType);
    }

    public Optional<Register<?, B>> binding(String name) {
        return lookup(name).map(RegisterTable.Entry::binding);
    }

    public List<RegisterTable.Entry<B>> entries() {
        return table.entries();
    }

    /**
     * Moves the child registered as {@code oldName} to {@code newName}. A binder holding
     * {@code oldName} as its own name is renamed through {@link Register#setName(String)}; any
     * other entry is removed and re-inserted. Like {@code setName}, a collision on
     * {@code newName} leaves the child without the old name.
     */
    public boolean rename(String oldName, String newName) {
        Optional<RegisterTable.Entry<B>> current = lookup(oldName);
        if (current.isEmpty()) {
            return false;
        }
        RegisterTable.Entry<B> entry = current.get();
        if (entry.bound() && oldName.equals(entry.binding().getName())) {
            return entry.binding().setName(newName);
        }
        removeChild(oldName);
        return insert(newName, entry.childType(), entry.creator(), entry.binding());
    }

    boolean insert(String name, Class<?> childType, Creator<? extends B> creator, Register<?, B> binding) {
        if (name == null || name.isEmpty()) {
            logger.debug("{}: rejecting empty name for {}", id(), childType.getName());
            return false;
        }
        return table.insert(new RegisterTable.Entry<>(name, childType, creator, binding));
    }

    private Optional<RegisterTable.Entry<B>> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(table.get(name));
    }

    private B construct(String name, Object[] args) {
        if (!signature.accepts(args)) {
            throw new IllegalArgumentException("Arguments do not match " + id() + " signature " + signature);
        }
        Optional<RegisterTable.Entry<B>> entry = lookup(name);
        if (entry.isEmpty()) {
            logger.debug("{}: no child registered as '{}'", id(), name);
            return null;
        }
        return entry.get().creator().create(args == null ? new Object[0] : args);
    }

    private static String displayId(Class<?> baseType, Signature signature) {
        String simpleName = baseType.getSimpleName();
        return signature.isEmpty() ? simpleName : simpleName + signature;
    }

    @Override
    public String toString() {
        return "RegisterBase[" + id() + "]";
    }

    private record Key(Class<?> baseType, Signature signature) {}
}
