package work.lcod.register.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.register.api.LogLevel;
import work.lcod.register.api.ManifestException;
import work.lcod.register.api.ManifestResult;
import work.lcod.register.api.RegisterManifest;
import work.lcod.register.demo.DemoRegistrations;
import work.lcod.register.runtime.RegisterBase;

@CommandLine.Command(
    name = "lcod-register",
    description = "Inspect and exercise the name-keyed child registry.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        ListCommand.class,
        CreateCommand.class,
        RenameCommand.class
    }
)
final class RegisterCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-m", "--manifest"},
        paramLabel = "PATH",
        description = "TOML manifest with per-base removals, renames and role selections."
    )
    private Path manifestPath;

    private LogLevel logLevel = LogLevel.WARN;

    @CommandLine.Option(
        names = "--log-level",
        paramLabel = "LEVEL",
        description = "Log threshold (trace|debug|info|warn|error|off)."
    )
    void setLogLevel(String raw) {
        logLevel = LogLevel.from(raw);
        logLevel.install();
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    LogLevel logLevel() {
        return logLevel;
    }

    RegisterManifest manifest() {
        if (manifestPath == null) {
            return RegisterManifest.empty();
        }
        if (!Files.isRegularFile(manifestPath)) {
            throw new ManifestException("Manifest not found: " + manifestPath);
        }
        return RegisterManifest.load(manifestPath);
    }

    /**
     * Registers the sample families, applies the manifest and reports what it rejected on stderr.
     */
    Bootstrap bootstrap() {
        RegisterManifest manifest = manifest();
        List<RegisterBase<?>> bases = DemoRegistrations.register();
        List<ManifestResult> results = new ArrayList<>();
        for (RegisterBase<?> base : bases) {
            ManifestResult result = manifest.apply(base);
            results.add(result);
            for (String failure : result.failed()) {
                spec.commandLine().getErr().printf("%s: manifest operation rejected: %s%n", base.id(), failure);
            }
        }
        return new Bootstrap(bases, manifest, results);
    }

    RegisterBase<?> requireBase(List<RegisterBase<?>> bases, String id) {
        return bases.stream()
            .filter(base -> base.id().equals(id))
            .findFirst()
            .orElseThrow(() -> new CommandLine.ParameterException(
                spec.commandLine(),
                "Unknown base '" + id + "' (known: " + bases.stream().map(RegisterBase::id).toList() + ")"
            ));
    }

    record Bootstrap(List<RegisterBase<?>> bases, RegisterManifest manifest, List<ManifestResult> results) {}
}
