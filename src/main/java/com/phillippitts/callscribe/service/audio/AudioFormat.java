package com.phillippitts.callscribe.service.audio;

/**
 * Audio format accepted by every speech-to-text engine: 16 kHz, 16-bit signed PCM, mono,
 * little-endian. Captured voice audio arrives at the gateway's rate (48 kHz) and is resampled
 * to this format by {@link PcmSegmentDecoder}.
 */
public final class AudioFormat {

    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    public static final int REQUIRED_CHANNELS = 1;

    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    /** Bytes per mono 16-bit sample. */
    public static final int BYTES_PER_SAMPLE = 2;

    public static final int WAV_HEADER_SIZE = 44;

    private AudioFormat() {}

    /**
     * Duration of mono 16-bit PCM of the given size at the given rate.
     */
    public static double secondsOf(long pcmBytes, int sampleRate) {
        if (sampleRate <= 0) {
            return 0.0;
        }
        return pcmBytes / (double) (sampleRate * BYTES_PER_SAMPLE);
    }
}
