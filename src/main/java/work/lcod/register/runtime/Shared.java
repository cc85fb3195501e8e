package work.lcod.register.runtime;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reference-counted owner of one created child. Each handle counts as one owner: {@link #share()}
 * adds a handle, {@link #close()} drops this one, and the last close releases the instance
 * (closing it when it is {@link AutoCloseable}).
 */
public final class Shared<B> implements AutoCloseable {
    private final B value;
    private final AtomicInteger owners;
    private final AtomicBoolean closed = new AtomicBoolean();

    private Shared(B value, AtomicInteger owners) {
        this.value = value;
        this.owners = owners;
    }

    public static <B> Shared<B> empty() {
        return new Shared<>(null, new AtomicInteger());
    }

    public static <B> Shared<B> of(B value) {
        return value == null ? empty() : new Shared<>(value, new AtomicInteger(1));
    }

    public boolean isPresent() {
        return value != null && !closed.get();
    }

    public B get() {
        if (!isPresent()) {
            throw new NoSuchElementException("No instance shared by this handle");
        }
        return value;
    }

    public Optional<B> toOptional() {
        return isPresent() ? Optional.of(value) : Optional.empty();
    }

    /**
     * New handle on the same instance. Sharing an empty or closed handle returns an empty one.
     */
    public Shared<B> share() {
        if (!isPresent()) {
            return empty();
        }
        owners.incrementAndGet();
        return new Shared<>(value, owners);
    }

    public int useCount() {
        return value == null ? 0 : owners.get();
    }

    @Override
    public void close() {
        if (value == null || !closed.compareAndSet(false, true)) {
            return;
        }
        if (owners.decrementAndGet() == 0) {
            Handles.dispose(value);
        }
    }

    @Override
    public String toString() {
        return isPresent() ? "Shared[" + value + ", owners=" + owners.get() + "]" : "Shared.empty";
    }
}
