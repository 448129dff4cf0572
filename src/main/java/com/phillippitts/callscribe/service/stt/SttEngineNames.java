package com.phillippitts.callscribe.service.stt;

/**
 * Engine identifiers used in logs, exceptions and metric tags.
 */
public final class SttEngineNames {

    public static final String WHISPER = "whisper";
    public static final String FASTER_WHISPER = "faster-whisper";
    public static final String VOSK = "vosk";

    private SttEngineNames() {
    }
}
