package work.lcod.register.runtime;

/**
 * Builds one concrete child type from the argument list of a {@link Signature}, typed as the base.
 *
 * <p>Creators are stateless and never change once installed in a {@link RegisterTable}. Arguments
 * have already been checked against the table signature when {@link #create(Object...)} runs.
 */
@FunctionalInterface
public interface Creator<B> {
    B create(Object... args);
}
