package work.lcod.register.cli;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.register.api.RegisterSnapshot;

@CommandLine.Command(
    name = "list",
    description = "List the registered children of every base.",
    mixinStandardHelpOptions = true
)
final class ListCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private RegisterCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--json", description = "Print the registry snapshot as JSON.")
    private boolean json;

    @Override
    public Integer call() {
        RegisterCommand.Bootstrap bootstrap = parent.bootstrap();
        RegisterSnapshot snapshot = RegisterSnapshot.of(bootstrap.bases());
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(snapshot.toPrettyJson());
        } else {
            for (RegisterSnapshot.BaseView base : snapshot.bases()) {
                out.printf("%s: %s%n", base.id(), String.join(", ", base.names()));
            }
        }
        out.flush();
        return bootstrap.results().stream().allMatch(result -> result.ok()) ? 0 : 1;
    }
}
