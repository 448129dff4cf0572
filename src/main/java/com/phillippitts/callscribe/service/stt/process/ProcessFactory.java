package com.phillippitts.callscribe.service.stt.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over process creation so engines can be tested without spawning binaries.
 */
public interface ProcessFactory {
    Process start(List<String> command, Path workingDir) throws IOException;
}
