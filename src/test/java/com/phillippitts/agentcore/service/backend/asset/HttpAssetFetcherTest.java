package com.phillippitts.agentcore.service.backend.asset;

import com.phillippitts.agentcore.exception.AssetAcquisitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpAssetFetcherTest {

    private static final URI SOURCE = URI.create("https://models.example/ggml-tiny.bin");

    @TempDir
    Path dir;

    private MockRestServiceServer server;
    private HttpAssetFetcher fetcher;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        fetcher = new HttpAssetFetcher(builder.build());
    }

    @Test
    void downloadsIntoPlaceAndLeavesNoPartialFile() throws IOException {
        server.expect(requestTo(SOURCE))
                .andRespond(withSuccess(new byte[]{7, 7, 7, 7}, MediaType.APPLICATION_OCTET_STREAM));
        Path target = dir.resolve("models/ggml-tiny.bin");

        Path result = fetcher.fetch(SOURCE, target);

        assertThat(result).isEqualTo(target);
        assertThat(Files.readAllBytes(target)).containsExactly(7, 7, 7, 7);
        assertThat(dir.resolve("models/ggml-tiny.bin.part")).doesNotExist();
        server.verify();
    }

    @Test
    void existingFileIsReusedWithoutNetwork() throws IOException {
        Path target = Files.write(dir.resolve("ggml-tiny.bin"), new byte[]{1});

        fetcher.fetch(SOURCE, target);

        assertThat(Files.readAllBytes(target)).containsExactly(1);
        server.verify();
    }

    @Test
    void httpErrorLeavesNoFileBehind() {
        server.expect(requestTo(SOURCE)).andRespond(withStatus(HttpStatus.NOT_FOUND));
        Path target = dir.resolve("ggml-tiny.bin");

        assertThatThrownBy(() -> fetcher.fetch(SOURCE, target))
                .isInstanceOf(AssetAcquisitionException.class)
                .hasMessageContaining(SOURCE.toString());
        assertThat(target).doesNotExist();
        assertThat(dir.resolve("ggml-tiny.bin.part")).doesNotExist();
    }
}
