package com.phillippitts.callscribe.service.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PcmResamplerTest {

    private static byte[] samples(int... values) {
        byte[] out = new byte[values.length * 2];
        for (int i = 0; i < values.length; i++) {
            out[i * 2] = (byte) (values[i] & 0xFF);
            out[i * 2 + 1] = (byte) ((values[i] >> 8) & 0xFF);
        }
        return out;
    }

    private static int sample(byte[] pcm, int index) {
        return (pcm[index * 2 + 1] << 8) | (pcm[index * 2] & 0xFF);
    }

    @Test
    void downsamples48kTo16kByAveragingTriples() {
        byte[] out = PcmResampler.resample(samples(300, 600, 900, -300, -600, -900, 1), 48_000, 16_000);

        assertThat(out).hasSize(4);
        assertThat(sample(out, 0)).isEqualTo(600);
        assertThat(sample(out, 1)).isEqualTo(-600);
    }

    @Test
    void oneSecondOf48kBecomesOneSecondOf16k() {
        byte[] out = PcmResampler.resample(new byte[48_000 * 2], 48_000, 16_000);

        assertThat(out).hasSize(AudioFormat.REQUIRED_BYTE_RATE);
    }

    @Test
    void nonIntegerRatioInterpolates() {
        byte[] out = PcmResampler.resample(samples(0, 100, 200, 300), 8_000, 16_000);

        assertThat(out).hasSize(16);
        assertThat(sample(out, 1)).isEqualTo(50);
        assertThat(sample(out, 2)).isEqualTo(100);
    }

    @Test
    void sameRateDropsOddTrailingByte() {
        assertThat(PcmResampler.resample(new byte[5], 16_000, 16_000)).hasSize(4);
    }

    @Test
    void rejectsNonPositiveRates() {
        assertThatThrownBy(() -> PcmResampler.resample(new byte[4], 0, 16_000))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
