package com.phillippitts.callscribe.service.audio;

import com.phillippitts.callscribe.exception.SegmentDecodeException;
import com.phillippitts.callscribe.service.capture.CapturedSegment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;

/**
 * Reads the raw PCM file written by the capture task and resamples it to 16 kHz.
 */
@Component
public class PcmSegmentDecoder implements SegmentDecoder {

    @Override
    public byte[] decode(CapturedSegment segment) {
        try {
            byte[] raw = Files.readAllBytes(segment.pcmFile());
            if (raw.length < AudioFormat.BYTES_PER_SAMPLE) {
                throw new SegmentDecodeException("segment has no samples", null);
            }
            return PcmResampler.resample(raw, segment.sampleRate(), AudioFormat.REQUIRED_SAMPLE_RATE);
        } catch (IOException e) {
            throw new SegmentDecodeException("cannot read segment " + segment.pcmFile().getFileName(), e);
        } catch (IllegalArgumentException e) {
            throw new SegmentDecodeException("cannot resample segment: " + e.getMessage(), e);
        }
    }
}
