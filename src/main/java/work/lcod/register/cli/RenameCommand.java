package work.lcod.register.cli;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.register.runtime.RegisterBase;

@CommandLine.Command(
    name = "rename",
    description = "Rename a registered child, then print the children of its base.",
    mixinStandardHelpOptions = true
)
final class RenameCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    private RegisterCommand parent;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "BASE")
    private String baseId;

    @CommandLine.Parameters(index = "1", paramLabel = "OLD")
    private String oldName;

    @CommandLine.Parameters(index = "2", paramLabel = "NEW")
    private String newName;

    @Override
    public Integer call() {
        RegisterCommand.Bootstrap bootstrap = parent.bootstrap();
        RegisterBase<?> base = parent.requireBase(bootstrap.bases(), baseId);
        boolean renamed = base.rename(oldName, newName);
        PrintWriter out = spec.commandLine().getOut();
        if (!renamed) {
            spec.commandLine().getErr().printf("%s: could not rename '%s' to '%s'%n", base.id(), oldName, newName);
        }
        out.printf("%s: %s%n", base.id(), String.join(", ", base.getChildren()));
        out.flush();
        return renamed ? 0 : 1;
    }
}
