package com.phillippitts.callscribe.service.transcript;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class RetentionPrunerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @TempDir
    Path dir;

    private Path file(String name, Duration age) throws IOException {
        Path p = Files.writeString(dir.resolve(name), name);
        Files.setLastModifiedTime(p, FileTime.from(NOW.minus(age)));
        return p;
    }

    private static Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    void deletesFilesOlderThanMaxAge() throws IOException {
        Path old = file("old.txt", Duration.ofDays(8));
        Path fresh = file("fresh.txt", Duration.ofDays(1));

        int deleted = new RetentionPruner(0, 7, clock()).prune(dir);

        assertThat(deleted).isEqualTo(1);
        assertThat(old).doesNotExist();
        assertThat(fresh).exists();
    }

    @Test
    void keepsNewestWhenOverCount() throws IOException {
        Path a = file("a.txt", Duration.ofHours(3));
        Path b = file("b.txt", Duration.ofHours(2));
        Path c = file("c.txt", Duration.ofHours(1));

        int deleted = new RetentionPruner(2, 0, clock()).prune(dir);

        assertThat(deleted).isEqualTo(1);
        assertThat(a).doesNotExist();
        assertThat(b).exists();
        assertThat(c).exists();
    }

    @Test
    void keepFileAndDirectoriesAreNeverTouched() throws IOException {
        Path keep = file(RetentionPruner.KEEP_FILE, Duration.ofDays(100));
        Path sub = Files.createDirectory(dir.resolve("nested"));
        file("x.txt", Duration.ofDays(100));

        new RetentionPruner(0, 1, clock()).prune(dir);

        assertThat(keep).exists();
        assertThat(sub).isDirectory();
    }

    @Test
    void disabledOrMissingDirectoryDoesNothing() throws IOException {
        file("a.txt", Duration.ofDays(100));

        assertThat(new RetentionPruner(0, 0, clock()).prune(dir)).isZero();
        assertThat(new RetentionPruner(1, 1, clock()).prune(dir.resolve("missing"))).isZero();
        assertThat(new RetentionPruner(-3, 0).isEnabled()).isFalse();
    }
}
