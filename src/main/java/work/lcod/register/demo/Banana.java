package work.lcod.register.demo;

import work.lcod.register.runtime.Creators;
import work.lcod.register.runtime.Register;

public final class Banana extends Fruit {
    public static final Register<Banana, Fruit> REGISTER =
        Register.child(Fruit.BASE, Banana.class, "Banana", Creators.of(() -> new Banana(Banana.REGISTER, DEFAULT_GRAMS + 20)));
    public static final Register<Banana, Fruit> WEIGHED =
        Register.child(Fruit.WEIGHED, Banana.class, "Banana", Creators.of(int.class, grams -> new Banana(Banana.WEIGHED, grams)));

    // binder of the table this instance was created through
    private final Register<Banana, Fruit> binding;

    private Banana(Register<Banana, Fruit> binding, int grams) {
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
