package com.phillippitts.callscribe.service.transcript;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deletes old transcript files: first by age, then by count, keeping the newest.
 *
 * <p>A limit of zero disables that rule. Directories and {@code .gitkeep} are never touched.
 * Failures are logged and never thrown.
 */
public class RetentionPruner {

    private static final Logger LOG = LogManager.getLogger(RetentionPruner.class);
    static final String KEEP_FILE = ".gitkeep";

    private final int maxFiles;
    private final int maxAgeDays;
    private final Clock clock;

    public RetentionPruner(int maxFiles, int maxAgeDays) {
        this(maxFiles, maxAgeDays, Clock.systemUTC());
    }

    RetentionPruner(int maxFiles, int maxAgeDays, Clock clock) {
        this.maxFiles = Math.max(0, maxFiles);
        this.maxAgeDays = Math.max(0, maxAgeDays);
        this.clock = clock;
    }

    public boolean isEnabled() {
        return maxFiles > 0 || maxAgeDays > 0;
    }

    /**
     * @return number of files deleted
     */
    public int prune(Path dir) {
        if (!isEnabled() || !Files.isDirectory(dir)) {
            return 0;
        }
        List<Entry> entries = list(dir);
        int deleted = 0;

        List<Entry> remaining = new ArrayList<>(entries.size());
        if (maxAgeDays > 0) {
            Instant cutoff = clock.instant().minus(Duration.ofDays(maxAgeDays));
            for (Entry e : entries) {
                if (e.modified().toInstant().isBefore(cutoff)) {
                    if (delete(e.path(), "age")) {
                        deleted++;
                        continue;
                    }
                }
                remaining.add(e);
            }
        } else {
            remaining.addAll(entries);
        }

        if (maxFiles > 0 && remaining.size() > maxFiles) {
            remaining.sort(Comparator.comparing(Entry::modified).reversed());
            for (Entry e : remaining.subList(maxFiles, remaining.size())) {
                if (delete(e.path(), "max-files")) {
                    deleted++;
                }
            }
        }
        return deleted;
    }

    private List<Entry> list(Path dir) {
        List<Entry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path p : stream) {
                if (KEEP_FILE.equals(p.getFileName().toString()) || !Files.isRegularFile(p)) {
                    continue;
                }
                try {
                    entries.add(new Entry(p, Files.getLastModifiedTime(p)));
                } catch (IOException e) {
                    LOG.debug("Skipping unreadable transcript file {}: {}", p.getFileName(), e.toString());
                }
            }
        } catch (IOException e) {
            LOG.warn("Cannot list transcript directory {}: {}", dir, e.toString());
        }
        return entries;
    }

    private boolean delete(Path file, String reason) {
        try {
            Files.deleteIfExists(file);
            LOG.info("Pruned transcript file {} (reason={})", file.getFileName(), reason);
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to prune transcript file {}: {}", file.getFileName(), e.toString());
            return false;
        }
    }

    private record Entry(Path path, FileTime modified) {
    }
}
