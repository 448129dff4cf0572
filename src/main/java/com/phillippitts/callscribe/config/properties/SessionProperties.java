package com.phillippitts.callscribe.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Timing and limits of the voice session state machine.
 *
 * <p>Example application.properties:
 * <pre>
 * session.guild-id=123456789012345678
 * session.join-debounce=2s
 * session.finalize-barrier-timeout=30s
 * session.intro.enabled=true
 * session.intro.path=assets/intro.wav
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "session")
public class SessionProperties {

    /** Guild whose voice channels are watched. */
    private String guildId = "";

    /** Period of the background tick, in milliseconds. */
    @Min(100)
    private long tickIntervalMs = 5000;

    /** How long a candidate channel must stay occupied before the bot joins. */
    @NotNull
    private Duration joinDebounce = Duration.ofSeconds(2);

    /** Added to timer-driven re-checks so they land after the window has elapsed. */
    @NotNull
    private Duration joinRecheckSlack = Duration.ofMillis(200);

    @NotNull
    private Duration joinTimeout = Duration.ofSeconds(30);

    /** Delay between detecting an empty channel and starting the finalize barrier. */
    @NotNull
    private Duration finalizeGrace = Duration.ofMillis(1500);

    /** Upper bound on waiting for in-flight captures during finalize. */
    @NotNull
    private Duration finalizeBarrierTimeout = Duration.ofSeconds(30);

    /** Sessions shorter than this with an empty transcript are not summarized or delivered. */
    @NotNull
    private Duration skipEmptyCallUnder = Duration.ofSeconds(20);

    @Min(1)
    private int maxConcurrentCaptures = 32;

    @Valid
    private Intro intro = new Intro();

    public String getGuildId() {
        return guildId;
    }

    public void setGuildId(String guildId) {
        this.guildId = guildId;
    }

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    public void setTickIntervalMs(long tickIntervalMs) {
        this.tickIntervalMs = tickIntervalMs;
    }

    public Duration getJoinDebounce() {
        return joinDebounce;
    }

    public void setJoinDebounce(Duration joinDebounce) {
        this.joinDebounce = joinDebounce;
    }

    public Duration getJoinRecheckSlack() {
        return joinRecheckSlack;
    }

    public void setJoinRecheckSlack(Duration joinRecheckSlack) {
        this.joinRecheckSlack = joinRecheckSlack;
    }

    public Duration getJoinTimeout() {
        return joinTimeout;
    }

    public void setJoinTimeout(Duration joinTimeout) {
        this.joinTimeout = joinTimeout;
    }

    public Duration getFinalizeGrace() {
        return finalizeGrace;
    }

    public void setFinalizeGrace(Duration finalizeGrace) {
        this.finalizeGrace = finalizeGrace;
    }

    public Duration getFinalizeBarrierTimeout() {
        return finalizeBarrierTimeout;
    }

    public void setFinalizeBarrierTimeout(Duration finalizeBarrierTimeout) {
        this.finalizeBarrierTimeout = finalizeBarrierTimeout;
    }

    public Duration getSkipEmptyCallUnder() {
        return skipEmptyCallUnder;
    }

    public void setSkipEmptyCallUnder(Duration skipEmptyCallUnder) {
        this.skipEmptyCallUnder = skipEmptyCallUnder;
    }

    public int getMaxConcurrentCaptures() {
        return maxConcurrentCaptures;
    }

    public void setMaxConcurrentCaptures(int maxConcurrentCaptures) {
        this.maxConcurrentCaptures = maxConcurrentCaptures;
    }

    public Intro getIntro() {
        return intro;
    }

    public void setIntro(Intro intro) {
        this.intro = intro;
    }

    /**
     * Optional welcome clip played once per session.
     */
    public static class Intro {
        private boolean enabled = false;
        private String path = "assets/intro.wav";
        @NotNull
        private Duration delay = Duration.ofSeconds(12);
        @Min(1)
        private int minHumans = 2;
        @NotNull
        private Duration playbackTimeout = Duration.ofSeconds(15);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Duration getDelay() {
            return delay;
        }

        public void setDelay(Duration delay) {
            this.delay = delay;
        }

        public int getMinHumans() {
            return minHumans;
        }

        public void setMinHumans(int minHumans) {
            this.minHumans = minHumans;
        }

        public Duration getPlaybackTimeout() {
            return playbackTimeout;
        }

        public void setPlaybackTimeout(Duration playbackTimeout) {
            this.playbackTimeout = playbackTimeout;
        }
    }
}
