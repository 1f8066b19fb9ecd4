package work.lcod.scoring.cli;

import picocli.CommandLine;

/**
 * Prints execution failures as a single line; the stack trace only with {@code -Dlcod.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        Throwable root = ex;
        while (root.getCause() != null && (root.getMessage() == null || root.getMessage().isBlank())) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = root.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText("lcod-score: " + message));
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
