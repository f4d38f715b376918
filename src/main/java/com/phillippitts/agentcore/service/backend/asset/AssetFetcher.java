package com.phillippitts.agentcore.service.backend.asset;

import java.net.URI;
import java.nio.file.Path;

/**
 * Downloads provider assets (model files) on first use.
 */
public interface AssetFetcher {

    /**
     * Ensures {@code target} exists, downloading it from {@code source} when absent or empty.
     * Repeated calls for an existing file do no network I/O. A failed download leaves no file at
     * {@code target}.
     *
     * @return {@code target}
     * @throws com.phillippitts.agentcore.exception.AssetAcquisitionException on download or write failure
     */
    Path fetch(URI source, Path target);
}
