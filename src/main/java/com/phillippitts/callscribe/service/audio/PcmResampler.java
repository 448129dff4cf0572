package com.phillippitts.callscribe.service.audio;

/**
 * Converts mono 16-bit little-endian PCM between sample rates.
 *
 * <p>Integer down-sampling ratios (48 kHz to 16 kHz) average each group of input samples,
 * which also acts as a crude low-pass filter. Other ratios use linear interpolation.
 */
public final class PcmResampler {

    private PcmResampler() {}

    public static byte[] resample(byte[] pcm, int fromRate, int toRate) {
        if (fromRate <= 0 || toRate <= 0) {
            throw new IllegalArgumentException("sample rates must be positive");
        }
        int inSamples = pcm.length / AudioFormat.BYTES_PER_SAMPLE;
        if (fromRate == toRate || inSamples == 0) {
            return evenLength(pcm);
        }
        if (fromRate > toRate && fromRate % toRate == 0) {
            return decimate(pcm, inSamples, fromRate / toRate);
        }
        return interpolate(pcm, inSamples, fromRate, toRate);
    }

    private static byte[] decimate(byte[] pcm, int inSamples, int factor) {
        int outSamples = inSamples / factor;
        byte[] out = new byte[outSamples * 2];
        for (int i = 0; i < outSamples; i++) {
            int sum = 0;
            for (int k = 0; k < factor; k++) {
                sum += sampleAt(pcm, i * factor + k);
            }
            writeSample(out, i, sum / factor);
        }
        return out;
    }

    private static byte[] interpolate(byte[] pcm, int inSamples, int fromRate, int toRate) {
        int outSamples = (int) ((long) inSamples * toRate / fromRate);
        byte[] out = new byte[outSamples * 2];
        double step = (double) fromRate / toRate;
        for (int i = 0; i < outSamples; i++) {
            double pos = i * step;
            int idx = (int) pos;
            double frac = pos - idx;
            int a = sampleAt(pcm, Math.min(idx, inSamples - 1));
            int b = sampleAt(pcm, Math.min(idx + 1, inSamples - 1));
            writeSample(out, i, (int) Math.round(a + (b - a) * frac));
        }
        return out;
    }

    private static byte[] evenLength(byte[] pcm) {
        if (pcm.length % 2 == 0) {
            return pcm;
        }
        byte[] out = new byte[pcm.length - 1];
        System.arraycopy(pcm, 0, out, 0, out.length);
        return out;
    }

    private static int sampleAt(byte[] pcm, int index) {
        int lo = pcm[index * 2] & 0xFF;
        int hi = pcm[index * 2 + 1];
        return (hi << 8) | lo;
    }

    private static void writeSample(byte[] out, int index, int value) {
        int clamped = Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, value));
        out[index * 2] = (byte) (clamped & 0xFF);
        out[index * 2 + 1] = (byte) ((clamped >> 8) & 0xFF);
    }
}
