package com.aiusage.attribution.ingestion;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads pre-fetched vendor responses dropped under {@code <inbox>/<sourceId>/*.json}.
 *
 * Files whose name starts with an ISO date are only delivered when that date lies
 * in the fetch window, and carry that single day as their window. Other files are
 * delivered for every window and carry the whole run window. Files are read in
 * name order so page order is stable across runs.
 */
@Component
@Slf4j
public class FileDropSourceAdapter implements SourceAdapter {

    private static final Pattern DATE_PREFIX = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}).*");

    private final Path inboxDir;

    public FileDropSourceAdapter(@Value("${attribution.inbox-dir:inbox}") String inboxDir) {
        this.inboxDir = Path.of(inboxDir);
    }

    @Override
    public boolean supports(String sourceId) {
        return true;
    }

    @Override
    public List<SourcePayload> fetch(String sourceId, FetchWindow window) {
        Path sourceDir = inboxDir.resolve(sourceId);
        if (!Files.isDirectory(sourceDir)) {
            throw new SourceFetchException(sourceId, "No inbox directory for source: " + sourceDir);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(sourceDir)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".json"))
                    .filter(path -> inWindow(path, window))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new SourceFetchException(sourceId, "Cannot list inbox directory " + sourceDir, e);
        }

        List<SourcePayload> payloads = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                String body = Files.readString(file, StandardCharsets.UTF_8);
                String fileName = file.getFileName().toString();
                FetchWindow pageWindow = datePrefix(fileName).map(FetchWindow::ofDay).orElse(window);
                payloads.add(new SourcePayload(sourceId, body, pageWindow, fileName));
            } catch (IOException e) {
                throw new SourceFetchException(sourceId, "Cannot read payload file " + file, e);
            }
        }

        log.info("Loaded {} payload file(s) for source {} in window {}", payloads.size(), sourceId, window);
        return payloads;
    }

    private boolean inWindow(Path file, FetchWindow window) {
        return datePrefix(file.getFileName().toString())
                .map(window::contains)
                .orElse(true);
    }

    private Optional<LocalDate> datePrefix(String fileName) {
        Matcher matcher = DATE_PREFIX.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(matcher.group(1)));
        } catch (DateTimeParseException e) {
            log.debug("Ignoring malformed date prefix in {}", fileName);
            return Optional.empty();
        }
    }
}
