package com.phillippitts.agentcore.exception;

import java.net.URI;
import java.nio.file.Path;

/**
 * Thrown when a model asset cannot be downloaded to its target path.
 * No partial file is left at the target when this is thrown.
 */
public class AssetAcquisitionException extends AgentCoreException {

    private final URI source;
    private final Path target;

    public AssetAcquisitionException(URI source, Path target, Throwable cause) {
        super("Failed to fetch " + source + " into " + target + ": "
                + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.source = source;
        this.target = target;
    }

    public URI getSource() {
        return source;
    }

    public Path getTarget() {
        return target;
    }
}
