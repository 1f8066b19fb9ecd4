package work.lcod.scoring.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        Package pkg = Main.class.getPackage();
        String version = pkg != null && pkg.getImplementationVersion() != null
            ? pkg.getImplementationVersion()
            : "development";
        return new String[] { "lcod-score (java) " + version };
    }
}
