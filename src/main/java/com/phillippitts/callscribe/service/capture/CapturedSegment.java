package com.phillippitts.callscribe.service.capture;

import java.nio.file.Path;

/**
 * One completed utterance of one speaker, stored as raw PCM in a temporary file owned by the
 * capture pipeline until transcription is done.
 *
 * @param speakerId platform user id
 * @param pcmFile mono 16-bit little-endian PCM, no header
 * @param sampleRate rate of the PCM in {@code pcmFile}
 * @param seconds audio duration derived from the byte count
 */
public record CapturedSegment(String speakerId, Path pcmFile, int sampleRate, double seconds) {
}
