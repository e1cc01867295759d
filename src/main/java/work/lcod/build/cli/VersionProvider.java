package work.lcod.build.cli;

import picocli.CommandLine;
import work.lcod.build.graph.AssetGraph;

/**
 * Reports the tool version and the asset graph layout it reads and writes.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = PrepareCommand.class.getPackage().getImplementationVersion();
        return new String[] {
            "lcod-build " + (implementationVersion != null ? implementationVersion : "(unreleased)"),
            "asset graph format v" + AssetGraph.VERSION
        };
    }
}
