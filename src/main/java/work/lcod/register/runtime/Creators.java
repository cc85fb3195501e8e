package work.lcod.register.runtime;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Typed adapters so children can bind constructor references ({@code Apple::new}) as creators.
 * Parameter classes are passed explicitly to pin the argument types of the reference.
 */
public final class Creators {
    private Creators() {}

    public static <B> Creator<B> of(Supplier<? extends B> factory) {
        Objects.requireNonNull(factory, "factory");
        return args -> factory.get();
    }

    public static <B, A> Creator<B> of(Class<A> type, Function<? super A, ? extends B> factory) {
        Objects.requireNonNull(factory, "factory");
        Class<A> boxed = Signature.boxed(type);
        return args -> factory.apply(boxed.cast(args[0]));
    }

    public static <B, A1, A2> Creator<B> of(
        Class<A1> first,
        Class<A2> second,
        BiFunction<? super A1, ? super A2, ? extends B> factory
    ) {
        Objects.requireNonNull(factory, "factory");
        Class<A1> boxedFirst = Signature.boxed(first);
        Class<A2> boxedSecond = Signature.boxed(second);
        return args -> factory.apply(boxedFirst.cast(args[0]), boxedSecond.cast(args[1]));
    }

    public static <B, A1, A2, A3> Creator<B> of(
        Class<A1> first,
        Class<A2> second,
        Class<A3> third,
        Function3<? super A1, ? super A2, ? super A3, ? extends B> factory
    ) {
        Objects.requireNonNull(factory, "factory");
        Class<A1> boxedFirst = Signature.boxed(first);
        Class<A2> boxedSecond = Signature.boxed(second);
        Class<A3> boxedThird = Signature.boxed(third);
        return args -> factory.apply(boxedFirst.cast(args[0]), boxedSecond.cast(args[1]), boxedThird.cast(args[2]));
    }

    @FunctionalInterface
    public interface Function3<A1, A2, A3, R> {
        R apply(A1 first, A2 second, A3 third);
    }
}
