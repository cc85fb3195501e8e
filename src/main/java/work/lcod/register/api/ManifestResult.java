package work.lcod.register.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of applying one manifest section to a base: operations that took effect and those the
 * registry rejected (absent name on removal, taken or empty name on rename).
 */
public record ManifestResult(String baseId, List<String> applied, List<String> failed) {
    public ManifestResult {
        applied = List.copyOf(applied);
        failed = List.copyOf(failed);
    }

    public static ManifestResult untouched(String baseId) {
        return new ManifestResult(baseId, List.of(), List.of());
    }

    public boolean ok() {
        return failed.isEmpty();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("base", baseId);
        serializable.put("applied", applied);
        serializable.put("failed", failed);
        return serializable;
    }
}
