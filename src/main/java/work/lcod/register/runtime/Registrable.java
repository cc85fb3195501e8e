package work.lcod.register.runtime;

/**
 * Runtime introspection shared by every base type managed through a {@link RegisterBase}.
 * Children bound with a {@link Register} report their registered name.
 */
public interface Registrable {
    default String name() {
        return "";
    }

    default String info() {
        return "Register base class.";
    }
}
