package work.lcod.build.cli;

import java.util.Objects;
import work.lcod.build.api.PreparationReport;

/**
 * Raised by the command once the failure report is printed, so the error handler can explain it on stderr.
 */
final class PreparationFailedException extends RuntimeException {
    private final PreparationReport.Failure failure;

    PreparationFailedException(PreparationReport.Failure failure) {
        super(Objects.requireNonNull(failure, "failure").message());
        this.failure = failure;
    }

    PreparationReport.Failure failure() {
        return failure;
    }
}
