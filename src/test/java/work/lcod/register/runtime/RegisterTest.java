package work.lcod.register.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RegisterTest {
    private static final RegisterBase<Gadget> GADGETS = RegisterBase.of(Gadget.class);

    @AfterEach
    void clearTable() {
        for (String name : GADGETS.getChildren()) {
            GADGETS.removeChild(name);
        }
    }

    @Test
    void registersFixedNameOnFirstTouch() {
        var binding = bind("Lamp");
        assertFalse(binding.activated());
        assertFalse(GADGETS.hasChild("Lamp"));

        assertSame(binding, binding.activate());
        binding.activate();

        assertTrue(GADGETS.hasChild("Lamp"));
        assertEquals(List.of("Lamp"), GADGETS.getChildren());
        assertEquals(Optional.of(binding), GADGETS.binding("Lamp"));
    }

    @Test
    void getNameAlsoActivates() {
        var binding = bind("Radio");

        assertEquals("Radio", binding.getName());
        assertTrue(GADGETS.hasChild("Radio"));
    }

    @Test
    void createdChildReportsItsRegisteredName() {
        bind("Lamp").activate();

        Gadget gadget = GADGETS.create("Lamp");

        assertEquals("Lamp", gadget.name());
        assertEquals("Registered sub-class \"Lamp\".", gadget.info());
    }

    @Test
    void unnamedChildRegistersNothingUntilNamed() {
        var binding = unnamed();
        binding.activate();

        assertEquals("", binding.getName());
        assertFalse(binding.registered());
        assertTrue(GADGETS.getChildren().isEmpty());

        assertTrue(binding.setName("Clock"));
        assertEquals("Clock", binding.getName());
        assertEquals("Clock", GADGETS.create("Clock").name());
    }

    @Test
    void setNameMovesTheRegistration() {
        var binding = bind("Lamp");
        binding.activate();

        assertTrue(binding.setName("Torch"));

        assertFalse(GADGETS.hasChild("Lamp"));
        assertTrue(GADGETS.hasChild("Torch"));
        assertEquals("Torch", binding.getName());
        assertNull(GADGETS.create("Lamp"));
        assertEquals("Torch", GADGETS.create("Torch").name());
    }

    @Test
    void setNameToSameNameKeepsRegistration() {
        var binding = bind("Lamp");

        assertTrue(binding.setName("Lamp"));
        assertEquals(List.of("Lamp"), GADGETS.getChildren());
    }

    @Test
    void failedRenameLeavesChildUnregistered() {
        var lamp = bind("Lamp");
        var radio = bind("Radio");
        lamp.activate();
        radio.activate();

        assertFalse(lamp.setName("Radio"));

        assertEquals("", lamp.getName());
        assertFalse(GADGETS.hasChild("Lamp"));
        assertEquals(List.of("Radio"), GADGETS.getChildren());
        assertEquals("Radio", GADGETS.create("Radio").name());
        assertTrue(lamp.setName("Lamp"));
    }

    @Test
    void emptyNewNameIsRejected() {
        var binding = bind("Lamp");

        assertFalse(binding.setName(""));
        assertFalse(binding.registered());
        assertTrue(GADGETS.getChildren().isEmpty());
    }

    @Test
    void removingTheNameUnregistersTheBinder() {
        var binding = bind("Lamp");
        binding.activate();

        assertTrue(GADGETS.removeChild("Lamp"));

        assertEquals("", binding.getName());
        assertFalse(binding.registered());
    }

    @Test
    void aliasKeepsTheBinderName() {
        var binding = bind("Lamp");

        assertTrue(GADGETS.setChild("Light", binding));
        assertEquals(List.of("Lamp", "Light"), GADGETS.getChildren());
        assertEquals("Lamp", GADGETS.create("Light").name());

        assertTrue(GADGETS.removeChild("Light"));
        assertEquals("Lamp", binding.getName());
    }

    @Test
    void baseRenameGoesThroughTheBinder() {
        var binding = bind("Lamp");
        binding.activate();

        assertTrue(GADGETS.rename("Lamp", "Beacon"));

        assertEquals("Beacon", binding.getName());
        assertEquals(List.of("Beacon"), GADGETS.getChildren());
    }

    @Test
    void takenFixedNameLeavesBinderUnnamed() {
        GADGETS.setChild("Lamp", Toy.class, Creators.of(() -> new Toy(null)));
        var binding = bind("Lamp");

        binding.activate();

        assertEquals("", binding.getName());
        assertEquals(Optional.empty(), GADGETS.binding("Lamp"));
    }

    @Test
    void bindingToAnotherBaseIsRefused() {
        var other = RegisterBase.of(Gadget.class, String.class);
        var binding = bind("Lamp");

        assertThrows(IllegalArgumentException.class, () -> other.setChild("Lamp", binding));
    }

    @Test
    void familyOfChildrenGetsDistinctNames() {
        List<Register<Toy, Gadget>> family = new ArrayList<>();
        for (int i = 9; i >= 0; i--) {
            var binding = unnamed();
            assertTrue(binding.setName("Box" + i));
            family.add(binding);
        }

        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            expected.add("Box" + i);
        }
        assertEquals(expected, GADGETS.getChildren());
        for (String name : expected) {
            assertEquals(name, GADGETS.create(name).name());
        }
        assertEquals(10, family.size());
    }

    @Test
    void concurrentFirstTouchRegistersOnce() throws Exception {
        var binding = bind("Shared");
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<String> task = () -> {
                    start.await();
                    return binding.getName();
                };
                futures.add(executor.submit(task));
            }
            start.countDown();
            for (Future<String> future : futures) {
                assertEquals("Shared", future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(List.of("Shared"), GADGETS.getChildren());
    }

    @Test
    void concurrentClaimsOnOneNameHaveOneWinner() throws Exception {
        int threads = 8;
        List<Register<Toy, Gadget>> contenders = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            contenders.add(bind("Contested"));
        }
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (var contender : contenders) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return contender.activate();
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        long winners = contenders.stream().filter(Register::registered).count();
        assertEquals(1, winners);
        assertEquals(List.of("Contested"), GADGETS.getChildren());
    }

    private static Register<Toy, Gadget> bind(String name) {
        AtomicReference<Register<Toy, Gadget>> self = new AtomicReference<>();
        self.set(Register.child(GADGETS, Toy.class, name, Creators.of(() -> new Toy(self.get()))));
        return self.get();
    }

    private static Register<Toy, Gadget> unnamed() {
        AtomicReference<Register<Toy, Gadget>> self = new AtomicReference<>();
        self.set(Register.unnamed(GADGETS, Toy.class, Creators.of(() -> new Toy(self.get()))));
        return self.get();
    }

    interface Gadget extends Registrable {}

    static final class Toy implements Gadget {
        private final Register<Toy, Gadget> binding;

        Toy(Register<Toy, Gadget> binding) {
            this.binding = binding;
        }

        @Override
        public String name() {
            return binding == null ? Gadget.super.name() : binding.name();
        }

        @Override
        public String info() {
            return binding == null ? Gadget.super.info() : binding.info();
        }
    }
}
