package work.lcod.register.runtime;

import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Exclusive owner of one created child. Closing the handle releases the instance, closing it as
 * well when it is {@link AutoCloseable}; use try-with-resources to tie it to a scope.
 * {@link #release()} hands the instance back to the caller without closing it.
 */
public final class Owned<B> implements AutoCloseable {
    private B value;

    private Owned(B value) {
        this.value = value;
    }

    public static <B> Owned<B> empty() {
        return new Owned<>(null);
    }

    public static <B> Owned<B> of(B value) {
        return value == null ? empty() : new Owned<>(value);
    }

    public synchronized boolean isPresent() {
        return value != null;
    }

    public synchronized B get() {
        if (value == null) {
            throw new NoSuchElementException("No instance owned");
        }
        return value;
    }

    public synchronized Optional<B> toOptional() {
        return Optional.ofNullable(value);
    }

    /**
     * Gives up ownership: the handle becomes empty and the caller is responsible for the instance.
     */
    public synchronized B release() {
        B released = value;
        value = null;
        return released;
    }

    @Override
    public void close() {
        Handles.dispose(release());
    }

    @Override
    public synchronized String toString() {
        return value == null ? "Owned.empty" : "Owned[" + value + "]";
    }
}
