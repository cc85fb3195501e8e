package work.lcod.register.demo;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.lcod.register.runtime.Creators;
import work.lcod.register.runtime.Register;

/**
 * Family of unnamed children sharing one class: each box index stands for its own child with its
 * own binder, and gets a name only once {@link Register#setName(String)} is called for it.
 */
public final class FruitInBox extends Fruit {
    private static final Map<Integer, Register<FruitInBox, Fruit>> BOXES = new ConcurrentHashMap<>();

    private final int box;

    private FruitInBox(int box) {
        super(DEFAULT_GRAMS);
        this.box = box;
    }

    /**
     * Binders for boxes {@code 0..count-1}; the same box index always yields the same binder.
     */
    public static List<Register<FruitInBox, Fruit>> family(int count) {
        List<Register<FruitInBox, Fruit>> family = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            family.add(binder(i));
        }
        return family;
    }

    public static Register<FruitInBox, Fruit> binder(int box) {
        if (box < 0) {
            throw new IllegalArgumentException("box index must not be negative: " + box);
        }
        return BOXES.computeIfAbsent(box, index -> Register.unnamed(Fruit.BASE, FruitInBox.class, Creators.of(() -> new FruitInBox(index))));
    }

    public int box() {
        return box;
    }

    @Override
    public String name() {
        return binder(box).name();
    }

    @Override
    public String info() {
        return binder(box).info();
    }
}
