package work.lcod.register.demo;

import java.util.List;
import work.lcod.register.runtime.Register;
import work.lcod.register.runtime.RegisterBase;

/**
 * Deterministic startup for the sample fruits: touches every binder in a fixed order so no
 * registration depends on class loading order.
 */
public final class DemoRegistrations {
    public static final int BOX_COUNT = 10;
    public static final String BOX_PREFIX = "FruitInBox";

    private static boolean registered;

    private DemoRegistrations() {}

    public static synchronized List<RegisterBase<?>> register() {
        if (!registered) {
            Apple.REGISTER.activate();
            Apple.WEIGHED.activate();
            Banana.REGISTER.activate();
            Banana.WEIGHED.activate();
            List<Register<FruitInBox, Fruit>> boxes = FruitInBox.family(BOX_COUNT);
            for (int i = 0; i < boxes.size(); i++) {
                boxes.get(i).setName(BOX_PREFIX + i);
            }
            registered = true;
        }
        return List.of(Fruit.BASE, Fruit.WEIGHED);
    }
}
