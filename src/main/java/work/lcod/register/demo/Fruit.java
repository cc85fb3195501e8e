package work.lcod.register.demo;

import work.lcod.register.runtime.RegisterBase;
import work.lcod.register.runtime.Registrable;

/**
 * Sample base: fruits created by name, either plain or with a weight in grams.
 */
public abstract class Fruit implements Registrable {
    public static final RegisterBase<Fruit> BASE = RegisterBase.of(Fruit.class);
    public static final RegisterBase<Fruit> WEIGHED = RegisterBase.of(Fruit.class, int.class);

    static final int DEFAULT_GRAMS = 100;

    private final int grams;

    protected Fruit(int grams) {
        if (grams <= 0) {
            throw new IllegalArgumentException("grams must be positive: " + grams);
        }
        this.grams = grams;
    }

    public int grams() {
        return grams;
    }

    @Override
    public String info() {
        return "Fruits that can be created by name.";
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name() + ", " + grams + "g]";
    }
}
