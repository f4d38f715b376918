package com.phillippitts.agentcore.service.backend.asset;

import com.phillippitts.agentcore.exception.AssetAcquisitionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * {@link AssetFetcher} over HTTP(S) using Spring's {@link RestClient}.
 *
 * <p>The body is streamed into {@code <target>.part} and moved into place only after the
 * download completed, so readers never observe a truncated model file.
 */
public final class HttpAssetFetcher implements AssetFetcher {

    private static final Logger LOG = LogManager.getLogger(HttpAssetFetcher.class);

    private final RestClient restClient;

    public HttpAssetFetcher() {
        this(RestClient.create());
    }

    public HttpAssetFetcher(RestClient restClient) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
    }

    @Override
    public Path fetch(URI source, Path target) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (isPresent(target)) {
            LOG.debug("Asset already present at {}", target);
            return target;
        }
        Path partial = target.resolveSibling(target.getFileName() + ".part");
        long start = System.nanoTime();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            LOG.info("Downloading asset {} -> {}", source, target);
            long bytes = restClient.get()
                    .uri(source)
                    .exchange((request, response) -> {
                        if (!response.getStatusCode().is2xxSuccessful()) {
                            throw new IOException("HTTP " + response.getStatusCode().value());
                        }
                        try (InputStream in = response.getBody()) {
                            return Files.copy(in, partial, StandardCopyOption.REPLACE_EXISTING);
                        }
                    });
            if (bytes <= 0) {
                throw new IOException("empty response body");
            }
            moveIntoPlace(partial, target);
            LOG.info("Downloaded {} bytes to {} in {} ms", bytes, target,
                    (System.nanoTime() - start) / 1_000_000L);
            return target;
        } catch (IOException | UncheckedIOException | RestClientException e) {
            deletePartial(partial);
            throw new AssetAcquisitionException(source, target, e);
        }
    }

    private static boolean isPresent(Path target) {
        try {
            return Files.isRegularFile(target) && Files.size(target) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    private static void moveIntoPlace(Path partial, Path target) throws IOException {
        try {
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deletePartial(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            LOG.warn("Could not delete partial download {}: {}", partial, e.toString());
        }
    }
}
