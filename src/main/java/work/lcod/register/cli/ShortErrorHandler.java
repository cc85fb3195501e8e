package work.lcod.register.cli;

import picocli.CommandLine;
import work.lcod.register.api.ManifestException;

/**
 * Prints one line per failure. Manifest problems exit with {@link #MANIFEST_EXIT_CODE}; full stack
 * traces need {@code -Dlcod.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final int MANIFEST_EXIT_CODE = 3;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        } else if (!(ex instanceof ManifestException) && !(ex instanceof IllegalArgumentException)) {
            message = ex.getClass().getSimpleName() + ": " + message;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (ex instanceof ManifestException) {
            return MANIFEST_EXIT_CODE;
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
