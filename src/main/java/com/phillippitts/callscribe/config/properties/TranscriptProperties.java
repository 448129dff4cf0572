package com.phillippitts.callscribe.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bounds of the in-memory transcript and the on-disk transcript archive.
 */
@Validated
@ConfigurationProperties(prefix = "transcript")
public class TranscriptProperties {

    @Min(50)
    @Max(10_000)
    private int maxItems = 800;

    @Min(100)
    private int maxSegmentChars = 4000;

    @NotBlank
    private String dir = "transcripts";

    private boolean allowAbsolutePaths = false;

    @Valid
    private Retention retention = new Retention();

    public int getMaxItems() {
        return maxItems;
    }

    public void setMaxItems(int maxItems) {
        this.maxItems = maxItems;
    }

    public int getMaxSegmentChars() {
        return maxSegmentChars;
    }

    public void setMaxSegmentChars(int maxSegmentChars) {
        this.maxSegmentChars = maxSegmentChars;
    }

    public String getDir() {
        return dir;
    }

    public void setDir(String dir) {
        this.dir = dir;
    }

    public boolean isAllowAbsolutePaths() {
        return allowAbsolutePaths;
    }

    public void setAllowAbsolutePaths(boolean allowAbsolutePaths) {
        this.allowAbsolutePaths = allowAbsolutePaths;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    /**
     * Archive pruning; zero disables a rule.
     */
    public static class Retention {
        @Min(0)
        private int maxFiles = 0;
        @Min(0)
        private int maxAgeDays = 0;

        public int getMaxFiles() {
            return maxFiles;
        }

        public void setMaxFiles(int maxFiles) {
            this.maxFiles = maxFiles;
        }

        public int getMaxAgeDays() {
            return maxAgeDays;
        }

        public void setMaxAgeDays(int maxAgeDays) {
            this.maxAgeDays = maxAgeDays;
        }
    }
}
