package com.phillippitts.callscribe.service.stt.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts engine commands directly with {@link ProcessBuilder}; arguments are never interpreted
 * by a shell.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(false);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        // python engines would otherwise buffer stdout until exit
        builder.environment().put("PYTHONUNBUFFERED", "1");
        return builder.start();
    }
}
