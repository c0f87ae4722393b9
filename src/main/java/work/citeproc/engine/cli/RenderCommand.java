package work.citeproc.engine.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.citeproc.engine.api.CiteprocRunner;
import work.citeproc.engine.api.EngineConfig;
import work.citeproc.engine.api.LogLevel;
import work.citeproc.engine.api.RenderConfiguration;
import work.citeproc.engine.api.RenderResult;
import work.citeproc.engine.output.OutputFormat;

@CommandLine.Command(
    name = "csl-render",
    description = "Render citations and a bibliography with a CSL or CSL-M style.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class RenderCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-s", "--style"},
        required = true,
        description = "CSL style file."
    )
    private Path style;

    @CommandLine.Option(
        names = {"-b", "--bibliography"},
        required = true,
        description = "CSL-JSON or YAML bibliography."
    )
    private Path bibliography;

    @CommandLine.Option(
        names = {"-c", "--citations"},
        description = "JSON or YAML citation clusters (default: cite every entry once, bibliography only).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path citations;

    @CommandLine.Option(
        names = {"-l", "--locale"},
        description = "Locale tag overriding the style's default-locale.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String locale;

    @CommandLine.Option(
        names = "--locale-file",
        description = "Additional CSL locale XML file (repeatable)."
    )
    private List<Path> localeFiles = new ArrayList<>();

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output format (text|html).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String format;

    @CommandLine.Option(
        names = "--config",
        description = "Engine configuration (default: ./" + EngineConfig.FILE_NAME + " when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--strict",
        description = "Reject styles that call undefined macros."
    )
    private boolean strict;

    @CommandLine.Option(
        names = "--json",
        description = "Print the full result as JSON."
    )
    private boolean json;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        var logLevel = LogLevel.from(logLevelRaw);
        logLevel.apply();
        var configPath = config != null ? config : Path.of(EngineConfig.FILE_NAME);
        if (config != null && !Files.isRegularFile(config)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Configuration file not found: " + config);
        }
        var configuration = RenderConfiguration.builder()
            .style(style)
            .bibliography(bibliography)
            .citations(Optional.ofNullable(citations))
            .localeFiles(localeFiles)
            .locale(Optional.ofNullable(locale))
            .format(Optional.ofNullable(format).map(OutputFormat::from))
            .engineConfig(EngineConfig.load(configPath))
            .strict(strict)
            .logLevel(logLevel)
            .build();

        var result = new CiteprocRunner().run(configuration);
        var out = spec.commandLine().getOut();
        if (json) {
            out.println(result.toPrettyJson());
        } else if (result.status() == RenderResult.Status.SUCCESS) {
            printText(result, out);
        } else {
            spec.commandLine().getErr().println(spec.commandLine().getColorScheme()
                .errorText(result.error().orElse("render failed")));
        }
        out.flush();
        return result.status().exitCode();
    }

    private static void printText(RenderResult result, PrintWriter out) {
        var citationTexts = result.citationTexts();
        citationTexts.forEach(out::println);
        var bibliographyTexts = result.bibliographyTexts();
        if (!citationTexts.isEmpty() && !bibliographyTexts.isEmpty()) {
            out.println();
        }
        bibliographyTexts.forEach(out::println);
    }
}
