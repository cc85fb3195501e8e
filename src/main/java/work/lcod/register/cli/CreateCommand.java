package work.lcod.register.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.register.runtime.Owned;
import work.lcod.register.runtime.RegisterBase;
import work.lcod.register.runtime.Registrable;

@CommandLine.Command(
    name = "create",
    description = "Create a child by name (or by manifest role) and print what it reports.",
    mixinStandardHelpOptions = true
)
final class CreateCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.ParentCommand
    private RegisterCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "BASE", description = "Base id, e.g. Fruit or Fruit(int).")
    private String baseId;

    @CommandLine.Parameters(index = "1", paramLabel = "NAME", description = "Child name, or a role selected in the manifest.")
    private String name;

    @CommandLine.Parameters(index = "2..*", paramLabel = "ARG", description = "Constructor arguments for the base signature.")
    private List<String> args = new ArrayList<>();

    @Override
    public Integer call() throws Exception {
        RegisterCommand.Bootstrap bootstrap = parent.bootstrap();
        RegisterBase<?> base = parent.requireBase(bootstrap.bases(), baseId);
        Object[] converted = Arguments.convert(base.signature(), args);
        String resolved = bootstrap.manifest().resolve(base, name);

        PrintWriter out = spec.commandLine().getOut();
        try (Owned<? extends Registrable> created = base.createUnique(resolved, converted)) {
            if (!created.isPresent()) {
                spec.commandLine().getErr().printf("%s: no child registered as '%s'%n", base.id(), resolved);
                return 1;
            }
            Registrable instance = created.get();
            Map<String, Object> report = new LinkedHashMap<>();
            report.put("base", base.id());
            report.put("requested", name);
            report.put("name", instance.name());
            report.put("info", instance.info());
            report.put("type", instance.getClass().getName());
            report.put("instance", instance.toString());
            out.println(JSON_WRITER.writeValueAsString(report));
            out.flush();
            return 0;
        }
    }
}
