package com.proposalagents.reports;

import static com.proposalagents.orchestration.OrchestrationConstants.REPORT_HEADING_TEMPLATE;
import static com.proposalagents.orchestration.OrchestrationConstants.UNTITLED_REPORT_TITLE;

import com.proposalagents.config.ProposalAgentsProperties;
import com.proposalagents.exception.ReportStorageException;
import com.proposalagents.orchestration.api.PersistenceSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
@Slf4j
public class ReportStorageService implements PersistenceSink {

    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[\\\\/*?:\"<>|]");
    private static final DateTimeFormatter DATE_SUFFIX = DateTimeFormatter.ofPattern("MMdd");

    private final Path reportsRoot;
    private final ProposalAgentsProperties.ReportsConfig config;
    private final Clock clock;

    public ReportStorageService(ProposalAgentsProperties properties, Clock clock) {
        this.config = properties.getReports();
        String configuredRoot = config.getDirectory();
        String rootValue = StringUtils.hasText(configuredRoot) ? configuredRoot : "reports";
        this.reportsRoot = Paths.get(rootValue).toAbsolutePath().normalize();
        this.clock = clock;
    }

    @Override
    public Path save(String topic, String content) {
        String dateSuffix = LocalDate.now(clock).format(DATE_SUFFIX);
        String document = render(topic, content);
        Path primary = reportsRoot.resolve(fileName(topic, dateSuffix));
        try {
            write(primary, document);
            log.info("Report saved: {}", primary);
            return primary;
        } catch (IOException | RuntimeException ex) {
            log.error("Error saving report {}: {}", primary, ex.toString());
            Path fallback = reportsRoot.resolve(config.getFallbackPrefix() + "_" + dateSuffix + config.getExtension());
            try {
                write(fallback, document);
                log.warn("Report saved with fallback name: {}", fallback);
                return fallback;
            } catch (IOException | RuntimeException fallbackEx) {
                log.error("Fallback save also failed for {}: {}", fallback, fallbackEx.toString());
                fallbackEx.addSuppressed(ex);
                throw new ReportStorageException("Report could not be saved as " + primary.getFileName()
                        + " or " + fallback.getFileName() + ": " + fallbackEx.getMessage(), fallbackEx);
            }
        }
    }

    public ReportListing list() {
        if (!Files.isDirectory(reportsRoot)) {
            log.warn("Reports directory not found at: {}", reportsRoot);
            return new ReportListing(reportsRoot.toString(), List.of());
        }
        try (Stream<Path> stream = Files.list(reportsRoot)) {
            List<ReportEntry> entries = stream
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(config.getExtension()))
                    .map(this::toEntry)
                    .sorted(Comparator.comparing(ReportEntry::lastModified).reversed()
                            .thenComparing(ReportEntry::name))
                    .toList();
            log.info("Found {} reports in {}.", entries.size(), reportsRoot);
            return new ReportListing(reportsRoot.toString(), entries);
        } catch (IOException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to list reports.", ex);
        }
    }

    public Resource read(String name) {
        Path file = resolveReport(name);
        if (!Files.isRegularFile(file)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Report not found.");
        }
        return new FileSystemResource(file);
    }

    public Path getReportsRoot() {
        return reportsRoot;
    }

    String fileName(String topic, String dateSuffix) {
        String rawTitle = topic == null ? "" : Arrays.stream(topic.trim().split("\\s+"))
                .filter(StringUtils::hasText)
                .limit(Math.max(1, config.getTitleWords()))
                .collect(Collectors.joining("_"));
        String title = UNSAFE_CHARACTERS.matcher(rawTitle).replaceAll("");
        if (title.length() > config.getMaxTitleLength()) {
            title = title.substring(0, config.getMaxTitleLength());
        }
        // Separators alone, "." and ".." are not usable names.
        if (!StringUtils.hasText(title.replace("_", "")) || title.equals(".") || title.equals("..")) {
            title = UNTITLED_REPORT_TITLE;
        }
        return title + "-" + dateSuffix + config.getExtension();
    }

    private String render(String topic, String content) {
        String heading = REPORT_HEADING_TEMPLATE.formatted(topic == null ? "" : topic.trim());
        return heading + "\n\n" + (content == null ? "" : content) + "\n";
    }

    private void write(Path file, String document) throws IOException {
        Files.createDirectories(reportsRoot);
        if (Files.exists(file) && !Files.isRegularFile(file)) {
            throw new IOException("Path exists and is not a regular file: " + file);
        }
        Files.writeString(file, document);
    }

    private Path resolveReport(String name) {
        if (!StringUtils.hasText(name)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Report name is required.");
        }
        Path target = reportsRoot.resolve(name).normalize();
        if (!target.startsWith(reportsRoot) || target.equals(reportsRoot)
                || !target.getParent().equals(reportsRoot)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid report name.");
        }
        return target;
    }

    private ReportEntry toEntry(Path path) {
        try {
            return new ReportEntry(
                    path.getFileName().toString(),
                    Files.size(path),
                    Instant.ofEpochMilli(Files.getLastModifiedTime(path).toMillis())
            );
        } catch (IOException ex) {
            // Removed or unreadable between listing and stat.
            return new ReportEntry(path.getFileName().toString(), 0L, Instant.EPOCH);
        }
    }
}
