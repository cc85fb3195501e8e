package work.lcod.register.demo;

import work.lcod.register.runtime.Creators;
import work.lcod.register.runtime.Register;

public final class Apple extends Fruit {
    public static final Register<Apple, Fruit> REGISTER =
        Register.child(Fruit.BASE, Apple.class, "Apple", Creators.of(() -> new Apple(Apple.REGISTER, DEFAULT_GRAMS)));
    public static final Register<Apple, Fruit> WEIGHED =
        Register.child(Fruit.WEIGHED, Apple.class, "Apple", Creators.of(int.class, grams -> new Apple(Apple.WEIGHED, grams)));

    // binder of the table this instance was created through
    private final Register<Apple, Fruit> binding;

    private Apple(Register<Apple, Fruit> binding, int grams) {
        super(grams);
        this.binding = binding;
    }

    @Override
    public String name() {
        return binding.name();
    }

    @Override
    public String info() {
        return binding.info();
    }
}
