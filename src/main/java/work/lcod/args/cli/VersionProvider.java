package work.lcod.args.cli;

import picocli.CommandLine;

/**
 * Reports the jar's implementation version and the running JVM.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "lcod-args " + (implementationVersion != null ? implementationVersion : "development"),
            "JVM " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")"
        };
    }
}
