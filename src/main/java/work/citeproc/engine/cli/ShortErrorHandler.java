package work.citeproc.engine.cli;

import java.nio.file.NoSuchFileException;
import picocli.CommandLine;
import work.citeproc.engine.style.StyleException;

/**
 * Prints the innermost cause of a failed render on one line. Stack traces only with {@code -Dciteproc.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        err.println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean("citeproc.debug")) {
            ex.printStackTrace(err);
        }
        // bad --config contents or --log-level values are input errors, not render failures
        return ex instanceof IllegalArgumentException
            ? commandLine.getCommandSpec().exitCodeOnInvalidInput()
            : commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Throwable ex) {
        var root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        var message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = root.getClass().getSimpleName();
        }
        if (root instanceof StyleException style) {
            return "Style error [" + style.code() + "]: " + message;
        }
        if (root instanceof NoSuchFileException) {
            return "File not found: " + message;
        }
        return message;
    }
}
