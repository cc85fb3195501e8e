package work.lcod.register.runtime;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds one child type to a {@link RegisterBase} and, optionally, a fixed name.
 *
 * <p>A child keeps its binder in a static field and delegates {@link Registrable#name()} and
 * {@link Registrable#info()} to it:
 *
 * <pre>{@code
 * final class Apple extends Fruit {
 *     static final Register<Apple, Fruit> REGISTER = Register.child(Fruit.BASE, Apple.class, "Apple", Creators.of(Apple::new));
 *
 *     public String name() { return REGISTER.name(); }
 *     public String info() { return REGISTER.info(); }
 * }
 * }</pre>
 *
 * <p>The fixed name is installed the first time the binder is touched ({@link #activate()},
 * {@link #getName()}, {@link #setName(String)}, {@link #name()} or {@link #info()}), exactly once
 * even when several threads get there together. Unnamed binders register nothing until
 * {@link #setName(String)} is called.
 */
public final class Register<C extends B, B extends Registrable> {
    private static final Logger logger = LoggerFactory.getLogger(Register.class);

    private final RegisterBase<B> base;
    private final Class<C> childType;
    private final Creator<? extends C> creator;
    private final String fixedName;
    private volatile boolean activated;
    private volatile String name = "";

    private Register(RegisterBase<B> base, Class<C> childType, String fixedName, Creator<? extends C> creator) {
        this.base = Objects.requireNonNull(base, "base");
        this.childType = Objects.requireNonNull(childType, "childType");
        this.creator = Objects.requireNonNull(creator, "creator");
        this.fixedName = fixedName;
    }

    public static <C extends B, B extends Registrable> Register<C, B> child(
        RegisterBase<B> base,
        Class<C> childType,
        String name,
        Creator<? extends C> creator
    ) {
        Objects.requireNonNull(name, "name");
        return new Register<>(base, childType, name, creator);
    }

    public static <C extends B, B extends Registrable> Register<C, B> unnamed(
        RegisterBase<B> base,
        Class<C> childType,
        Creator<? extends C> creator
    ) {
        return new Register<>(base, childType, null, creator);
    }

    /**
     * Installs the fixed name on first call; later calls only return this binder.
     */
    public Register<C, B> activate() {
        if (!activated) {
            synchronized (this) {
                if (!activated) {
                    if (fixedName != null) {
                        if (base.insert(fixedName, childType, creator, this)) {
                            name = fixedName;
                        } else {
                            logger.warn("{}: {} could not claim its name '{}'", base.id(), childType.getName(), fixedName);
                        }
                    }
                    activated = true;
                }
            }
        }
        return this;
    }

    public boolean activated() {
        return activated;
    }

    public String getName() {
        activate();
        return name;
    }

    /**
     * Removes the current name, then registers {@code newName}. The removal is not undone when
     * {@code newName} is rejected: the child is left unregistered and {@code false} is returned.
     */
    public boolean setName(String newName) {
        activate();
        synchronized (this) {
            String oldName = name;
            if (!oldName.isEmpty()) {
                base.removeChild(oldName);
                name = "";
            }
            if (!base.insert(newName, childType, creator, this)) {
                logger.debug("{}: rename of {} from '{}' to '{}' failed, child is now unregistered", base.id(), childType.getName(), oldName, newName);
                return false;
            }
            name = newName;
            logger.debug("{}: renamed {} from '{}' to '{}'", base.id(), childType.getName(), oldName, newName);
            return true;
        }
    }

    public boolean registered() {
        return !getName().isEmpty();
    }

    public String name() {
        return getName();
    }

    public String info() {
        return "Registered sub-class \"" + getName() + "\".";
    }

    public RegisterBase<B> base() {
        return base;
    }

    public Class<C> childType() {
        return childType;
    }

    public Creator<? extends C> creator() {
        return creator;
    }

    synchronized void released(String removedName) {
        if (name.equals(removedName)) {
            name = "";
        }
    }

    @Override
    public String toString() {
        return "Register[" + childType.getSimpleName() + " -> " + base.id() + ", name='" + name + "']";
    }
}
