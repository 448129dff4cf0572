package com.phillippitts.callscribe.service.audio;

import com.phillippitts.callscribe.exception.SegmentDecodeException;
import com.phillippitts.callscribe.service.capture.CapturedSegment;

/**
 * Turns a captured segment into engine-ready audio (see {@link AudioFormat}).
 */
public interface SegmentDecoder {

    /**
     * @return 16 kHz mono 16-bit PCM
     * @throws SegmentDecodeException if the segment cannot be read or converted
     */
    byte[] decode(CapturedSegment segment);
}
