package com.aiusage.attribution.cli;

import com.aiusage.attribution.adapters.SourceNormalizerRegistry;
import com.aiusage.attribution.config.AttributionProperties;
import com.aiusage.attribution.ingestion.FetchWindow;
import com.aiusage.attribution.pipeline.AttributionPipeline;
import com.aiusage.attribution.pipeline.PipelineRun;
import com.aiusage.attribution.pipeline.RunRequest;
import com.aiusage.attribution.pipeline.RunSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Command line entry point: one pipeline run per process.
 *
 * OPTIONS:
 * --from=YYYY-MM-DD, --to=YYYY-MM-DD  inclusive UTC window; both default to yesterday
 * --sources=a,b                        sources to ingest; defaults to attribution.default-sources,
 *                                      or every enabled source when that is empty
 * --reconcile                          reconcile the window against invoice totals afterwards
 * --backfill --reason=TEXT             delete stored facts of the window before ingesting
 *
 * The run summary is logged and, when attribution.summary-path is set, written there as JSON.
 * The process exit code comes from the summary; invalid options exit with 64.
 */
@Component
@ConditionalOnProperty(name = "attribution.cli.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class PipelineCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private final AttributionPipeline pipeline;
    private final AttributionProperties properties;
    private final SourceNormalizerRegistry normalizerRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String summaryPath;

    private volatile PipelineRun activeRun;
    private int exitCode = RunSummary.EXIT_SUCCESS;

    public PipelineCommandRunner(
            AttributionPipeline pipeline,
            AttributionProperties properties,
            SourceNormalizerRegistry normalizerRegistry,
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${attribution.summary-path:}") String summaryPath) {
        this.pipeline = pipeline;
        this.properties = properties;
        this.normalizerRegistry = normalizerRegistry;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
        this.summaryPath = summaryPath;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunRequest request;
        try {
            request = parse(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            log.error("Usage: --from=YYYY-MM-DD --to=YYYY-MM-DD [--sources=a,b] [--reconcile] [--backfill --reason=TEXT]");
            exitCode = RunSummary.EXIT_USAGE;
            return;
        }

        activeRun = PipelineRun.start(request);
        RunSummary summary;
        try {
            summary = pipeline.run(activeRun);
        } finally {
            activeRun = null;
        }
        report(summary);
        exitCode = summary.exitCode();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Context shutdown (SIGTERM) cancels the active run between stages.
     */
    @PreDestroy
    public void cancelActiveRun() {
        PipelineRun run = activeRun;
        if (run != null) {
            log.warn("Shutdown requested, cancelling run {}", run.getRunId());
            run.cancel();
        }
    }

    RunRequest parse(ApplicationArguments args) {
        LocalDate yesterday = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1);
        LocalDate from = date(args, "from", yesterday);
        LocalDate to = date(args, "to", from.isAfter(yesterday) ? from : yesterday);
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("--to " + to + " precedes --from " + from);
        }

        List<String> sources = single(args, "sources")
                .map(value -> Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList())
                .orElseGet(this::defaultSources);
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("--sources names no source");
        }

        String backfillReason = null;
        if (args.containsOption("backfill")) {
            backfillReason = single(args, "reason")
                    .filter(reason -> !reason.isBlank())
                    .orElseThrow(() -> new IllegalArgumentException("--backfill requires --reason=TEXT"));
        } else if (args.containsOption("reason")) {
            throw new IllegalArgumentException("--reason is only valid with --backfill");
        }
        return new RunRequest(new FetchWindow(from, to), sources, args.containsOption("reconcile"), backfillReason);
    }

    private List<String> defaultSources() {
        if (!properties.getDefaultSources().isEmpty()) {
            return properties.getDefaultSources();
        }
        return normalizerRegistry.sourceIds().stream()
                .filter(properties::isEnabled)
                .toList();
    }

    private void report(RunSummary summary) {
        String json;
        try {
            json = objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize run summary " + summary.runId(), e);
        }
        log.info("Run summary:\n{}", json);
        if (summaryPath == null || summaryPath.isBlank()) {
            return;
        }
        try {
            Path path = Path.of(summaryPath);
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, json);
        } catch (IOException e) {
            log.error("Failed to write run summary to {}: {}", summaryPath, e.getMessage());
        }
    }

    private static LocalDate date(ApplicationArguments args, String name, LocalDate fallback) {
        String value = single(args, name).orElse(null);
        if (value == null) {
            return fallback;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("--" + name + " is not a date (YYYY-MM-DD): " + value, e);
        }
    }

    private static Optional<String> single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        if (values.size() > 1) {
            throw new IllegalArgumentException("--" + name + " given more than once");
        }
        return Optional.ofNullable(values.get(0));
    }
}
