package work.lcod.build.cli;

import java.io.PrintWriter;
import picocli.CommandLine;
import work.lcod.build.api.PreparationReport;

/**
 * Prints a short explanation of why preparation stopped; stack traces only with {@code -Dlcod.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DELETE_HINT = "Rerun with --delete-conflicting-outputs to delete them.";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        PrintWriter err = commandLine.getErr();
        CommandLine.Help.ColorScheme colors = commandLine.getColorScheme();
        if (ex instanceof PreparationFailedException failed) {
            explain(failed.failure(), err, colors);
            return PreparationReport.Status.FAILURE.exitCode();
        }
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        err.println(colors.errorText(message));
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace(err);
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    private static void explain(PreparationReport.Failure failure, PrintWriter err, CommandLine.Help.ColorScheme colors) {
        switch (failure.reason()) {
            case CONFLICTING_OUTPUTS -> {
                err.println(colors.errorText(
                    failure.conflictingOutputs().size() + " declared outputs already exist on disk:"));
                failure.conflictingOutputs().forEach(id -> err.println("  " + id));
                err.println(failure.deletable()
                    ? DELETE_HINT
                    : "They belong to dependency packages, which the build never deletes from.");
            }
            case INVALID_BUILD_ACTION -> {
                err.println(colors.errorText("Invalid build action "
                    + failure.buildAction().orElse("(unknown)") + ":"));
                err.println("  " + failure.message());
            }
            default -> err.println(colors.errorText(failure.message()));
        }
    }
}
