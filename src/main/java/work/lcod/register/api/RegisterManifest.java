package work.lcod.register.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.register.runtime.RegisterBase;
import work.lcod.register.runtime.Registrable;

/**
 * Startup adjustments for registered children, read from a TOML file with one table per base id.
 *
 * <pre>
 * [Fruit]
 * remove = ["Banana"]
 *
 * [Fruit.rename]
 * Apple = "GreenApple"
 *
 * [Fruit.select]
 * snack = "GreenApple"
 * </pre>
 *
 * Ids with a signature are quoted: {@code ["Fruit(int)".rename]}.
 */
public final class RegisterManifest {
    private static final Logger logger = LoggerFactory.getLogger(RegisterManifest.class);
    private static final RegisterManifest EMPTY = new RegisterManifest(Map.of());

    private final Map<String, Section> sections;

    private RegisterManifest(Map<String, Section> sections) {
        this.sections = Collections.unmodifiableMap(new TreeMap<>(sections));
    }

    public static RegisterManifest empty() {
        return EMPTY;
    }

    /**
     * Missing files yield an empty manifest; unreadable or invalid ones raise {@link ManifestException}.
     */
    public static RegisterManifest load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return EMPTY;
        }
        try {
            return parse(Files.readString(path));
        } catch (IOException ex) {
            throw new ManifestException("Unable to read manifest " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static RegisterManifest parse(String toml) {
        TomlParseResult result = Toml.parse(toml == null ? "" : toml);
        if (result.hasErrors()) {
            String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new ManifestException("Invalid manifest: " + errors);
        }
        Map<String, Section> sections = new TreeMap<>();
        for (String baseId : result.keySet()) {
            TomlTable table = asTable(result, baseId);
            sections.put(baseId, readSection(baseId, table));
        }
        return new RegisterManifest(sections);
    }

    public Set<String> baseIds() {
        return sections.keySet();
    }

    public Optional<Section> section(String baseId) {
        return Optional.ofNullable(sections.get(baseId));
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    /**
     * Runs the removals, then the renames (in name order), of the section matching {@code base}.
     * Rejected operations are collected in the result, never thrown.
     */
    public ManifestResult apply(RegisterBase<?> base) {
        Section section = sections.get(base.id());
        if (section == null) {
            return ManifestResult.untouched(base.id());
        }
        List<String> applied = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (String name : section.remove()) {
            String operation = "remove " + name;
            (base.removeChild(name) ? applied : failed).add(operation);
        }
        for (Map.Entry<String, String> rename : section.rename().entrySet()) {
            String operation = "rename " + rename.getKey() + " -> " + rename.getValue();
            (base.rename(rename.getKey(), rename.getValue()) ? applied : failed).add(operation);
        }
        for (String operation : failed) {
            logger.warn("{}: manifest operation rejected: {}", base.id(), operation);
        }
        return new ManifestResult(base.id(), applied, failed);
    }

    /**
     * Name configured for {@code role} under the base, or the role itself when none is configured.
     */
    public String resolve(RegisterBase<?> base, String role) {
        return section(base.id())
            .map(Section::select)
            .map(select -> select.get(role))
            .orElse(role);
    }

    public <B extends Registrable> B select(RegisterBase<B> base, String role, Object... args) {
        return base.create(resolve(base, role), args);
    }

    private static Section readSection(String baseId, TomlTable table) {
        List<String> remove = new ArrayList<>();
        TomlArray removeArray = readArray(baseId, table, "remove");
        if (removeArray != null) {
            for (Object value : removeArray.toList()) {
                if (!(value instanceof String name)) {
                    throw new ManifestException(baseId + ".remove must only contain strings");
                }
                remove.add(name);
            }
        }
        return new Section(
            baseId,
            remove,
            readStrings(baseId, table, "rename"),
            readStrings(baseId, table, "select")
        );
    }

    private static TomlArray readArray(String baseId, TomlTable table, String key) {
        try {
            return table.getArray(List.of(key));
        } catch (TomlInvalidTypeException ex) {
            throw new ManifestException(baseId + "." + key + " must be an array", ex);
        }
    }

    private static Map<String, String> readStrings(String baseId, TomlTable table, String key) {
        TomlTable nested = asTable(table, baseId + "." + key, key);
        if (nested == null) {
            return Map.of();
        }
        Map<String, String> values = new TreeMap<>();
        for (Map.Entry<String, Object> entry : nested.entrySet()) {
            if (!(entry.getValue() instanceof String value)) {
                throw new ManifestException(baseId + "." + key + "." + entry.getKey() + " must be a string");
            }
            values.put(entry.getKey(), value);
        }
        return values;
    }

    private static TomlTable asTable(TomlTable parent, String baseId) {
        TomlTable table = asTable(parent, baseId, baseId);
        if (table == null) {
            throw new ManifestException("Manifest entry '" + baseId + "' must be a table");
        }
        return table;
    }

    private static TomlTable asTable(TomlTable parent, String label, String key) {
        try {
            return parent.getTable(List.of(key));
        } catch (TomlInvalidTypeException ex) {
            throw new ManifestException(label + " must be a table", ex);
        }
    }

    /**
     * Manifest table for one base.
     */
    public record Section(String baseId, List<String> remove, Map<String, String> rename, Map<String, String> select) {
        public Section {
            remove = List.copyOf(remove);
            rename = Collections.unmodifiableMap(new TreeMap<>(rename));
            select = Collections.unmodifiableMap(new TreeMap<>(select));
        }
    }
}
