package work.citeproc.engine.cli;

import picocli.CommandLine;
import work.citeproc.engine.locale.BuiltinLocales;

/**
 * Reports the jar's implementation version together with what the engine understands out of the box.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String CSL_VERSION = "1.0.2";

    @Override
    public String[] getVersion() {
        var implementationVersion = Main.class.getPackage().getImplementationVersion();
        var version = implementationVersion != null ? implementationVersion : "development";
        return new String[] {
            "csl-render " + version,
            "styles: CSL " + CSL_VERSION + ", CSL-M",
            "built-in locales: " + String.join(", ", BuiltinLocales.shipped())
        };
    }
}
