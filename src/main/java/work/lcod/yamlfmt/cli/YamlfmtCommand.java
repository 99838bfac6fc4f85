package work.lcod.yamlfmt.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.yamlfmt.api.FormattedYaml;
import work.lcod.yamlfmt.api.FormatterOptions;
import work.lcod.yamlfmt.config.FormatterOptionsLoader;
import work.lcod.yamlfmt.load.YamlParseException;

@CommandLine.Command(
    name = "yamlfmt",
    description = "Reformat YAML files in place using the canonical house style.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class YamlfmtCommand implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(YamlfmtCommand.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        paramLabel = "FILE",
        arity = "1..*",
        description = "YAML files to reformat."
    )
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(
        names = "--check",
        description = "Write nothing; exit with 1 when a file would be reformatted."
    )
    private boolean check;

    @CommandLine.Option(
        names = "--stdout",
        description = "Print the reformatted text instead of rewriting the files."
    )
    private boolean stdout;

    @CommandLine.Option(
        names = "--json",
        description = "Print a JSON report of the run."
    )
    private boolean json;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "TOML",
        description = "Formatter configuration file ([yaml] table).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--preferred-quote",
        paramLabel = "QUOTE",
        description = "Quote character for quoted scalars (\" or ').",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String preferredQuote;

    @CommandLine.Option(
        names = "--no-indent-sequences",
        description = "Keep nested sequence dashes flush with their parent key."
    )
    private boolean noIndentSequences;

    @Override
    public Integer call() {
        if (stdout && json) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--stdout and --json cannot be combined.");
        }
        var yaml = new FormattedYaml(resolveOptions());
        var results = new ArrayList<FormatReport.FileResult>();
        for (Path file : files) {
            results.add(format(yaml, file));
        }
        var report = new FormatReport(results, check);
        if (json) {
            spec.commandLine().getOut().println(report.toPrettyJson());
        }
        spec.commandLine().getOut().flush();
        return report.exitCode();
    }

    private FormatterOptions resolveOptions() {
        var options = FormatterOptionsLoader.load(config);
        var builder = options.toBuilder();
        if (preferredQuote != null) {
            builder.preferredQuote(preferredQuote);
        }
        if (noIndentSequences) {
            builder.indentSequences(false);
        }
        return builder.build();
    }

    private FormatReport.FileResult format(FormattedYaml yaml, Path file) {
        String name = file.toString();
        try {
            String original = Files.readString(file, StandardCharsets.UTF_8);
            String formatted = yaml.reformat(original);
            boolean changed = !formatted.equals(original);
            if (stdout) {
                spec.commandLine().getOut().print(formatted);
            } else if (check) {
                if (changed && !json) {
                    spec.commandLine().getOut().println("would reformat " + name);
                }
            } else if (changed) {
                Files.writeString(file, formatted, StandardCharsets.UTF_8);
                LOGGER.info("Reformatted {}", name);
            }
            LOGGER.debug("{}: {}", name, changed ? "changed" : "unchanged");
            return FormatReport.FileResult.of(name, changed ? FormatReport.Status.CHANGED : FormatReport.Status.UNCHANGED);
        } catch (YamlParseException ex) {
            String message = ex.line() > 0
                ? "line " + ex.line() + ", column " + ex.column() + ": " + ex.getMessage()
                : ex.getMessage();
            reportFailure(name, message);
            return new FormatReport.FileResult(name, FormatReport.Status.FAILED, message);
        } catch (IOException ex) {
            String message = "Unable to access " + name + ": " + ex.getMessage();
            reportFailure(name, message);
            return new FormatReport.FileResult(name, FormatReport.Status.FAILED, message);
        }
    }

    private void reportFailure(String name, String message) {
        if (json) {
            LOGGER.warn("Failed to format {}: {}", name, message);
        } else {
            spec.commandLine().getErr().println(spec.commandLine().getColorScheme().errorText(name + ": " + message));
        }
    }
}
