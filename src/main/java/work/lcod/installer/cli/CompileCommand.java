package work.lcod.installer.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.installer.api.CompileConfiguration;
import work.lcod.installer.api.CompileResult;
import work.lcod.installer.api.Dialect;
import work.lcod.installer.api.InstallerCompiler;

@CommandLine.Command(
    name = "lcod-installer",
    description = "Compile an installer configuration (YAML or TOML) into an installer script.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CompileCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--config"},
        required = true,
        paramLabel = "PATH",
        description = "Installer configuration file (.yaml, .yml or .toml)."
    )
    private Path config;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "PATH",
        description = "Script output path (default: <config-dir>/<app.name> plus the format's extension).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Script format (nsis, wix, inno).",
        defaultValue = "nsis"
    )
    private String format;

    @CommandLine.Option(
        names = "--strict",
        description = "Fail on variable references that cannot be resolved."
    )
    private boolean strict;

    @CommandLine.Option(
        names = "--dry-run",
        description = "Print the script to stdout instead of writing it."
    )
    private boolean dryRun;

    @CommandLine.Option(
        names = "--verbose",
        description = "Enable debug logging."
    )
    private boolean verbose;

    @Override
    public Integer call() {
        if (verbose) {
            // must happen before the first logger is created
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        Dialect dialect;
        try {
            dialect = Dialect.from(format);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }

        var configuration = CompileConfiguration.builder()
            .configPath(config.toAbsolutePath().normalize())
            .dialect(dialect)
            .outputPath(output)
            .strictReferences(strict)
            .dryRun(dryRun)
            .build();
        CompileResult result = new InstallerCompiler().compile(configuration);

        var out = spec.commandLine().getOut();
        if (!dryRun) {
            out.println(result.toPrettyJson());
        } else if (result.isSuccess()) {
            out.println(result.script());
        } else {
            var err = spec.commandLine().getErr();
            err.println(spec.commandLine().getColorScheme().errorText(String.valueOf(result.metadata().get("error"))));
            err.flush();
        }
        out.flush();
        return result.status().exitCode();
    }
}
