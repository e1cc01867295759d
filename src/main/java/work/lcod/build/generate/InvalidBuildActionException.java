package work.lcod.build.generate;

import work.lcod.build.config.BuildAction;

/**
 * A build action is configured in a way the build cannot honour.
 */
public final class InvalidBuildActionException extends BuildPreparationException {
    private final BuildAction action;

    private InvalidBuildActionException(BuildAction action, String message) {
        super(message);
        this.action = action;
    }

    public static InvalidBuildActionException nonRootPackage(BuildAction action, String rootPackage) {
        return new InvalidBuildActionException(action,
            "Invalid build action " + action + ": only the root package '" + rootPackage
                + "' may run builders whose outputs are not hidden, but this action targets package '"
                + action.packageName() + "'.");
    }

    public BuildAction action() {
        return action;
    }
}
