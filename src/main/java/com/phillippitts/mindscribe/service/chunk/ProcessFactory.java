package com.phillippitts.mindscribe.service.chunk;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of the external encoder.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests provide a stub that returns a fake
 * {@link Process} with controlled stdout/stderr/exit behavior.
 */
interface ProcessFactory {
    /**
     * Starts a new process with the given command and working directory.
     *
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
