package com.phillippitts.callscribe.exception;

/**
 * A file the selected speech-to-text engine needs is missing: model, binary or bundled script.
 */
public class ModelNotFoundException extends CallScribeException {

    private final String path;

    public ModelNotFoundException(String path) {
        super("STT engine file not found: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
