package work.lcod.pumslabel.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.pumslabel.api.CacheMode;
import work.lcod.pumslabel.api.DictionaryTarget;
import work.lcod.pumslabel.api.LabelRunConfiguration;
import work.lcod.pumslabel.api.LabelRunner;
import work.lcod.pumslabel.api.LogLevel;
import work.lcod.pumslabel.api.RunResult;
import work.lcod.pumslabel.config.LabelerSettings;
import work.lcod.pumslabel.config.SettingsLoader;
import work.lcod.pumslabel.dictionary.LineTokenizer;
import work.lcod.pumslabel.runtime.DatasetLabelApplier;
import work.lcod.pumslabel.runtime.DictionaryFetcher;
import work.lcod.pumslabel.runtime.HttpDictionaryFetcher;
import work.lcod.pumslabel.shared.DurationParser;

@CommandLine.Command(
    name = "pumslabel",
    description = "Generate (and optionally apply) variable and value labels from ACS PUMS data dictionaries.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class LabelCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-y", "--year"},
        required = true,
        description = "Dictionary year; repeat or list several to label more than one.",
        arity = "1..*"
    )
    private List<Integer> years = new ArrayList<>();

    @CommandLine.Option(
        names = {"-s", "--sample"},
        description = "Sample period in years (1 or 5).",
        defaultValue = "1"
    )
    private int samplePeriod = 1;

    @CommandLine.Option(
        names = "--cache-dir",
        description = "Cache location (overrides --global-cache, the settings file and the local default).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String cacheDir;

    @CommandLine.Option(
        names = {"-g", "--global-cache"},
        description = "Use ~/.pumslabel/cache instead of ./.pumslabel/cache."
    )
    private boolean globalCache;

    @CommandLine.Option(
        names = "--refresh",
        description = "Download and parse again even when cached copies are fresh."
    )
    private boolean refresh;

    @CommandLine.Option(
        names = "--ttl",
        description = "Cache lifetime (e.g. 12h, 30d; 0 never expires; default: 30d).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String ttlRaw;

    @CommandLine.Option(
        names = "--url-template",
        description = "Dictionary URL with {file}, {year} or {period} placeholders.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String urlTemplate;

    @CommandLine.Option(
        names = "--timeout",
        description = "Download timeout (e.g. 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--line-width",
        description = "Fixed dictionary line width; longer lines are truncated (default: 244).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer lineWidth;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "PATH",
        description = "TOML settings file (default: ./pumslabel.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String configPath;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "PATH",
        description = "Also write the label script to this file (single year only).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String output;

    @CommandLine.Option(
        names = {"-d", "--data"},
        paramLabel = "CSV",
        description = "PUMS extract (CSV with header row) to apply the labels to.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String data;

    @CommandLine.Option(
        names = "--metadata",
        paramLabel = "PATH",
        description = "Write the labelled dataset's metadata as JSON (requires --data).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String metadata;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    private final DictionaryFetcher fetcherOverride;

    LabelCommand() {
        this(null);
    }

    LabelCommand(DictionaryFetcher fetcherOverride) {
        this.fetcherOverride = fetcherOverride;
    }

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = resolveLogLevel();
        logLevel.install();

        if (years.size() > 1 && output != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--output is not supported with several --year values.");
        }
        if (years.size() > 1 && metadata != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--metadata is not supported with several --year values.");
        }
        if (metadata != null && data == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--metadata requires --data.");
        }

        LabelerSettings settings = loadSettings();
        Duration ttl = parseDuration(ttlRaw, "--ttl")
            .or(settings::cacheTtl)
            .orElse(LabelRunConfiguration.DEFAULT_CACHE_TTL);
        Optional<Duration> timeout = parseDuration(timeoutRaw, "--timeout").or(settings::fetchTimeout);
        String template = urlTemplate != null
            ? urlTemplate
            : settings.urlTemplate().orElse(HttpDictionaryFetcher.DEFAULT_URL_TEMPLATE);
        int width = lineWidth != null ? lineWidth : settings.lineWidth().orElse(LineTokenizer.DEFAULT_LINE_WIDTH);
        if (width <= 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--line-width must be positive.");
        }

        CacheMode cacheMode = determineCacheMode(settings);
        Path cacheDirectory = resolveCacheDirectory(cacheMode, settings);
        Optional<Path> dataset = Optional.ofNullable(data).map(this::existingFile);

        DictionaryFetcher fetcher = fetcherOverride != null ? fetcherOverride : new HttpDictionaryFetcher(template, timeout);
        LabelRunner runner = new LabelRunner(fetcher, new DatasetLabelApplier(), Clock.systemUTC());
        int exitCode = 0;

        for (int year : years) {
            LabelRunConfiguration configuration = LabelRunConfiguration.builder()
                .target(toTarget(year))
                .cacheDirectory(cacheDirectory)
                .cacheMode(cacheMode)
                .cacheTtl(ttl)
                .forceRefresh(refresh)
                .lineWidth(width)
                .scriptOutput(Optional.ofNullable(output).map(LabelCommand::toPath))
                .dataset(dataset)
                .metadataOutput(Optional.ofNullable(metadata).map(LabelCommand::toPath))
                .logLevel(logLevel)
                .build();

            RunResult result = runner.run(configuration);
            exitCode = Math.max(exitCode, result.status().exitCode());
            spec.commandLine().getOut().println(result.toPrettyJson());
        }
        spec.commandLine().getOut().flush();
        return exitCode;
    }

    private DictionaryTarget toTarget(int year) {
        try {
            return new DictionaryTarget(year, samplePeriod);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private LabelerSettings loadSettings() {
        Path path;
        if (configPath != null) {
            path = toPath(configPath);
            if (!Files.isRegularFile(path)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Settings file not found: " + path);
            }
        } else {
            path = Paths.get(SettingsLoader.DEFAULT_FILE_NAME).toAbsolutePath().normalize();
            if (!Files.isRegularFile(path)) {
                return LabelerSettings.EMPTY;
            }
        }
        try {
            return SettingsLoader.load(path);
        } catch (IOException ex) {
            throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read settings " + path + ": " + ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), path + ": " + ex.getMessage());
        }
    }

    private CacheMode determineCacheMode(LabelerSettings settings) {
        if (cacheDir != null) {
            return CacheMode.CUSTOM;
        }
        if (globalCache) {
            return CacheMode.GLOBAL;
        }
        return settings.cacheDirectory().isPresent() ? CacheMode.CUSTOM : CacheMode.LOCAL;
    }

    private Path resolveCacheDirectory(CacheMode cacheMode, LabelerSettings settings) {
        if (cacheMode != CacheMode.CUSTOM) {
            return cacheMode.defaultDirectory(Paths.get("").toAbsolutePath());
        }
        if (cacheDir != null) {
            return toPath(cacheDir);
        }
        return settings.cacheDirectory().orElseThrow();
    }

    private Optional<Duration> parseDuration(String raw, String option) {
        try {
            return DurationParser.parse(raw);
        } catch (IllegalArgumentException | ArithmeticException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), option + ": " + ex.getMessage());
        }
    }

    private Path existingFile(String value) {
        Path path = toPath(value);
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Dataset not found: " + path);
        }
        return path;
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("PUMSLABEL_LOG_LEVEL");
        }
        try {
            return LogLevel.from(candidate);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private static Path toPath(String value) {
        return Paths.get(value).toAbsolutePath().normalize();
    }
}
