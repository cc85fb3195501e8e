package work.lcod.register.runtime;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fixed constructor-argument list shared by every child of one {@link RegisterTable}.
 */
public record Signature(List<Class<?>> parameterTypes) {
    public static final Signature NONE = new Signature(List.of());

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
        boolean.class, Boolean.class,
        byte.class, Byte.class,
        char.class, Character.class,
        short.class, Short.class,
        int.class, Integer.class,
        long.class, Long.class,
        float.class, Float.class,
        double.class, Double.class
    );

    public Signature {
        Objects.requireNonNull(parameterTypes, "parameterTypes");
        for (Class<?> type : parameterTypes) {
            Objects.requireNonNull(type, "parameter type");
            if (type == void.class) {
                throw new IllegalArgumentException("void is not a valid parameter type");
            }
        }
        parameterTypes = List.copyOf(parameterTypes);
    }

    public static Signature of(Class<?>... parameterTypes) {
        if (parameterTypes == null || parameterTypes.length == 0) {
            return NONE;
        }
        return new Signature(Arrays.asList(parameterTypes));
    }

    public int arity() {
        return parameterTypes.size();
    }

    public boolean isEmpty() {
        return parameterTypes.isEmpty();
    }

    /**
     * Arity matches and every argument is assignable to its parameter; {@code null} is accepted
     * for reference parameters only.
     */
    public boolean accepts(Object[] args) {
        int length = args == null ? 0 : args.length;
        if (length != parameterTypes.size()) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            Class<?> type = parameterTypes.get(i);
            Object arg = args[i];
            if (arg == null) {
                if (type.isPrimitive()) {
                    return false;
                }
                continue;
            }
            if (!boxed(type).isInstance(arg)) {
                return false;
            }
        }
        return true;
    }

    // int.class is a Class<Integer>, so its wrapper is the same Class<T>
    @SuppressWarnings("unchecked")
    static <T> Class<T> boxed(Class<T> type) {
        Objects.requireNonNull(type, "type");
        return type.isPrimitive() ? (Class<T>) WRAPPERS.get(type) : type;
    }

    @Override
    public String toString() {
        return parameterTypes.stream()
            .map(Class::getSimpleName)
            .collect(Collectors.joining(", ", "(", ")"));
    }
}
