package work.lcod.pumslabel.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        return new String[] {
            "pumslabel " + version,
            "Header layouts: NAME WIDTH (before 2017), NAME TYPE WIDTH (2017 and later)"
        };
    }
}
