package com.storesync.deploy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.storesync.common.StoreSyncException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Stores deployment reports as pretty-printed JSON files and keeps only the newest ones.
 */
@Slf4j
public class ReportStorage {

    static final String PREFIX = "deployment-";
    static final String SUFFIX = ".json";
    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final Path directory;
    private final int maxReports;
    private final ObjectMapper mapper;

    public ReportStorage(Path directory, int maxReports) {
        this.directory = directory;
        this.maxReports = Math.max(1, maxReports);
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path save(DeploymentReport report) {
        try {
            Files.createDirectories(directory);
            Path file = directory.resolve(PREFIX + FILE_TIMESTAMP.format(report.startedAt()) + SUFFIX);
            mapper.writeValue(file.toFile(), report);
            log.info("Deployment report saved to {}", file);
            prune();
            return file;
        } catch (IOException e) {
            throw new StoreSyncException("Failed to write deployment report to " + directory, e);
        }
    }

    /** Stored reports, newest first. */
    public List<Path> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(PREFIX) && name.endsWith(SUFFIX);
                    })
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList();
        } catch (IOException e) {
            throw new StoreSyncException("Failed to list deployment reports in " + directory, e);
        }
    }

    public DeploymentReport load(Path file) {
        try {
            return mapper.readValue(file.toFile(), DeploymentReport.class);
        } catch (IOException e) {
            throw new StoreSyncException("Failed to read deployment report " + file, e);
        }
    }

    private void prune() {
        List<Path> reports = list();
        for (Path old : reports.subList(Math.min(maxReports, reports.size()), reports.size())) {
            try {
                Files.deleteIfExists(old);
                log.debug("Removed old deployment report {}", old);
            } catch (IOException e) {
                log.warn("Could not remove old deployment report {}: {}", old, e.getMessage());
            }
        }
    }
}
