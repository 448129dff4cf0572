package com.phillippitts.callscribe.gateway;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * An established voice connection to one channel.
 */
public interface VoiceConnection {

    String channelId();

    /**
     * Registers a listener receiving the user id of every speaking-start event on this connection.
     */
    void onSpeakingStart(Consumer<String> listener);

    /**
     * Opens the audio stream of one speaker. The stream ends on its own after the platform stops
     * delivering frames; callers still close it.
     */
    SpeakerAudioSource subscribe(String speakerId);

    /**
     * Plays an audio file into the channel, unmuting for the duration of the playback.
     */
    CompletableFuture<Void> play(Path audioFile);

    void disconnect();
}
