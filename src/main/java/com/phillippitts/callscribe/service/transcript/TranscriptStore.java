package com.phillippitts.callscribe.service.transcript;

import com.phillippitts.callscribe.util.LogSanitizer;
import com.phillippitts.callscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Archives the transcript of every finalized session as a text file, then applies retention.
 *
 * <p>File name: {@code <startedAt with ':' replaced by '-'>__<channel name>.txt}.
 */
public class TranscriptStore {

    private static final Logger LOG = LogManager.getLogger(TranscriptStore.class);
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^\\p{L}\\p{N}._-]+");
    private static final int MAX_NAME_CHARS = 80;

    private final Path dir;
    private final RetentionPruner pruner;

    /**
     * @param dir archive directory, already validated against the working directory
     */
    public TranscriptStore(Path dir, RetentionPruner pruner) {
        this.dir = dir;
        this.pruner = pruner;
    }

    public Path directory() {
        return dir;
    }

    /**
     * Writes the document and prunes old files.
     *
     * @return the written file
     * @throws UncheckedIOException when the directory or file cannot be written
     */
    public Path save(TranscriptDocument doc) {
        Path file = dir.resolve(fileName(doc));
        String content = "Channel: " + doc.channelName() + "\n"
                + "Started: " + doc.startedAt() + "\n"
                + "Ended: " + doc.endedAt() + "\n"
                + "Participants: " + doc.participantList() + "\n\n"
                + doc.body() + "\n";
        try {
            Files.createDirectories(dir);
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write transcript " + file.getFileName(), e);
        }
        LOG.info("Transcript saved: {} ({} chars)", file.getFileName(), doc.body().length());
        int pruned = pruner.prune(dir);
        if (pruned > 0) {
            LOG.info("Retention removed {} transcript file(s)", pruned);
        }
        return file;
    }

    static String fileName(TranscriptDocument doc) {
        String safeName = UNSAFE_FILE_CHARS.matcher(LogSanitizer.sanitizeLabel(doc.channelName(), MAX_NAME_CHARS))
                .replaceAll("_");
        if (safeName.isEmpty()) {
            safeName = "channel";
        }
        return TimeUtils.fileStamp(doc.startedAt()) + "__" + safeName + ".txt";
    }
}
