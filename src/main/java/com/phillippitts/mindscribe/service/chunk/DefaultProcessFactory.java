package com.phillippitts.mindscribe.service.chunk;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // stdout carries the encoded audio, so stderr must stay separate
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
