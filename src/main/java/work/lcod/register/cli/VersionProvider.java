package work.lcod.register.cli;

import picocli.CommandLine;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = RegisterCommand.class.getPackage().getImplementationVersion();
        return new String[] {
            "lcod-register " + (implementationVersion != null ? implementationVersion : "development"),
            "JVM " + Runtime.version()
        };
    }
}
