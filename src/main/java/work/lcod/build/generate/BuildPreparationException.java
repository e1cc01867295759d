package work.lcod.build.generate;

/**
 * Fatal condition that stops a build before any build action runs.
 */
public class BuildPreparationException extends RuntimeException {
    public BuildPreparationException(String message) {
        super(message);
    }
}
