package work.lcod.register.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.register.runtime.Creators;
import work.lcod.register.runtime.RegisterBase;
import work.lcod.register.runtime.Registrable;

class RegisterManifestTest {
    private static final Path MANIFESTS = Path.of("src", "test", "resources", "manifests");
    private static final RegisterBase<Appliance> APPLIANCES = RegisterBase.of(Appliance.class);
    private static final RegisterBase<Appliance> SIZED = RegisterBase.of(Appliance.class, int.class);

    @BeforeEach
    void register() {
        for (String name : List.of("Kettle", "Mixer", "Toaster")) {
            APPLIANCES.setChild(name, Device.class, Creators.of(() -> new Device(name)));
        }
        SIZED.setChild("Oven", Device.class, Creators.of(int.class, size -> new Device("Oven" + size)));
    }

    @AfterEach
    void clearTables() {
        for (var base : List.of(APPLIANCES, SIZED)) {
            for (String name : base.getChildren()) {
                base.removeChild(name);
            }
        }
    }

    @Test
    void parsesSectionsPerBase() {
        var manifest = RegisterManifest.load(MANIFESTS.resolve("kitchen.toml"));

        assertEquals(Set.of("Appliance", "Appliance(int)"), manifest.baseIds());
        var section = manifest.section("Appliance").orElseThrow();
        assertEquals(List.of("Toaster", "Fridge"), section.remove());
        assertEquals(Map.of("Kettle", "Boiler", "Mixer", "Blender"), section.rename());
        assertEquals(Map.of("breakfast", "Boiler", "dessert", "Blender"), section.select());
    }

    @Test
    void appliesRemovalsAndRenamesAndReportsRejections() {
        var manifest = RegisterManifest.load(MANIFESTS.resolve("kitchen.toml"));

        ManifestResult result = manifest.apply(APPLIANCES);

        assertEquals(List.of("Blender", "Boiler"), APPLIANCES.getChildren());
        assertEquals(
            List.of("remove Toaster", "rename Kettle -> Boiler", "rename Mixer -> Blender"),
            result.applied()
        );
        assertEquals(List.of("remove Fridge"), result.failed());
        assertFalse(result.ok());
    }

    @Test
    void quotedIdsTargetSignatureTables() {
        var manifest = RegisterManifest.load(MANIFESTS.resolve("kitchen.toml"));

        assertTrue(manifest.apply(SIZED).ok());

        assertEquals(List.of("Range"), SIZED.getChildren());
        assertEquals("Oven3", SIZED.create("Range", 3).label());
    }

    @Test
    void selectsChildrenByRole() {
        var manifest = RegisterManifest.load(MANIFESTS.resolve("kitchen.toml"));
        manifest.apply(APPLIANCES);

        assertEquals("Boiler", manifest.resolve(APPLIANCES, "breakfast"));
        assertEquals("Kettle", manifest.select(APPLIANCES, "breakfast").label());
        assertEquals("lunch", manifest.resolve(APPLIANCES, "lunch"));
        assertNull(manifest.select(APPLIANCES, "lunch"));
    }

    @Test
    void basesWithoutSectionAreUntouched() {
        var manifest = RegisterManifest.parse("[Other]\nremove = [\"Kettle\"]\n");

        ManifestResult result = manifest.apply(APPLIANCES);

        assertTrue(result.ok());
        assertTrue(result.applied().isEmpty());
        assertEquals(List.of("Kettle", "Mixer", "Toaster"), APPLIANCES.getChildren());
    }

    @Test
    void missingFileIsEmpty() {
        var manifest = RegisterManifest.load(MANIFESTS.resolve("absent.toml"));

        assertSame(RegisterManifest.empty(), manifest);
        assertTrue(manifest.isEmpty());
        assertSame(RegisterManifest.empty(), RegisterManifest.load(null));
    }

    @Test
    void invalidTomlIsRejected() {
        var error = assertThrows(ManifestException.class, () -> RegisterManifest.load(MANIFESTS.resolve("invalid.toml")));
        assertTrue(error.getMessage().startsWith("Invalid manifest"));
    }

    @Test
    void wrongValueTypesAreRejected() {
        assertThrows(ManifestException.class, () -> RegisterManifest.load(MANIFESTS.resolve("wrong-types.toml")));
        assertThrows(ManifestException.class, () -> RegisterManifest.parse("[Appliance.rename]\nKettle = 3\n"));
        assertThrows(ManifestException.class, () -> RegisterManifest.parse("Appliance = 1\n"));
    }

    @Test
    void resultSerializesOperations() {
        var result = new ManifestResult("Appliance", List.of("remove Toaster"), List.of());

        assertEquals(
            Map.of("base", "Appliance", "applied", List.of("remove Toaster"), "failed", List.of()),
            result.toSerializableMap()
        );
    }

    interface Appliance extends Registrable {
        String label();
    }

    record Device(String label) implements Appliance {}
}
