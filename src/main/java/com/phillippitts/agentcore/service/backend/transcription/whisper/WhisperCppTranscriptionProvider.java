package com.phillippitts.agentcore.service.backend.transcription.whisper;

import com.phillippitts.agentcore.config.properties.WhisperCppProperties;
import com.phillippitts.agentcore.domain.HealthProbe;
import com.phillippitts.agentcore.domain.TranscriptionResult;
import com.phillippitts.agentcore.exception.ModelNotFoundException;
import com.phillippitts.agentcore.service.backend.AbstractBackendProvider;
import com.phillippitts.agentcore.service.backend.asset.AssetFetcher;
import com.phillippitts.agentcore.service.backend.process.ProcessRunner;
import com.phillippitts.agentcore.service.backend.process.ProcessSpec;
import com.phillippitts.agentcore.service.backend.transcription.TranscriptionProvider;
import com.phillippitts.agentcore.service.audio.WavCodec;
import com.phillippitts.agentcore.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Transcription through the whisper.cpp CLI.
 *
 * <p>Each call writes the clip to a temporary WAV file and runs
 * <pre>
 *   ${binary} -m ${model} -f ${wav} -l ${language} -otxt -of stdout -t ${threads}
 * </pre>
 * Preparation downloads the model when {@code modelUrl} is set and the file is absent, then
 * checks that the binary and model exist.
 */
public final class WhisperCppTranscriptionProvider extends AbstractBackendProvider implements TranscriptionProvider {

    public static final String ID = "whisper-cpp";

    private static final Logger LOG = LogManager.getLogger(WhisperCppTranscriptionProvider.class);

    private final WhisperCppProperties cfg;
    private final ProcessRunner runner;
    private final AssetFetcher assetFetcher;

    public WhisperCppTranscriptionProvider(WhisperCppProperties cfg, ProcessRunner runner, AssetFetcher assetFetcher) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.assetFetcher = Objects.requireNonNull(assetFetcher, "assetFetcher");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String displayName() {
        return "whisper.cpp";
    }

    @Override
    protected void doPrepare() {
        long start = System.nanoTime();
        Path model = resolvePath(cfg.modelPath());
        if (cfg.modelUrl() != null && !cfg.modelUrl().isBlank()) {
            assetFetcher.fetch(URI.create(cfg.modelUrl()), model);
        }
        if (!Files.isRegularFile(model)) {
            throw new ModelNotFoundException(model.toString());
        }
        Path binary = resolvePath(cfg.binaryPath());
        if (!Files.isExecutable(binary)) {
            throw new IllegalStateException("whisper.cpp binary not executable: " + binary);
        }
        LOG.info("whisper.cpp prepared in {} ms: bin={}, model={}, lang={}, threads={}",
                TimeUtils.elapsedMillis(start), binary, model, cfg.language(), cfg.threads());
    }

    @Override
    protected HealthProbe doHealthCheck() {
        Path model = resolvePath(cfg.modelPath());
        if (!Files.isRegularFile(model)) {
            return HealthProbe.down("Model file missing: " + model,
                    "Restore the model or set backend.whisper-cpp.model-url and reinitialize");
        }
        if (!Files.isExecutable(resolvePath(cfg.binaryPath()))) {
            return HealthProbe.down("whisper.cpp binary missing or not executable",
                    "Check backend.whisper-cpp.binary-path");
        }
        return HealthProbe.up();
    }

    @Override
    public TranscriptionResult transcribe(byte[] audio) {
        if (audio == null || audio.length == 0) {
            throw new IllegalArgumentException("audio must not be null or empty");
        }
        ensurePrepared();
        Path wav = null;
        long start = System.nanoTime();
        try {
            wav = Files.createTempFile("whisper-", ".wav");
            WavCodec.writeFile(audio, wav);
            String stdout = runner.run(new ProcessSpec(ID, buildCommand(wav), wav.getParent(), null,
                    Duration.ofSeconds(cfg.timeoutSeconds()), cfg.maxStdoutBytes(),
                    Map.of("binaryPath", cfg.binaryPath(), "modelPath", cfg.modelPath())));
            String text = stdout.trim();
            LOG.debug("whisper.cpp transcribed clip in {} ms (chars={})", TimeUtils.elapsedMillis(start), text.length());
            return TranscriptionResult.of(text, 1.0, ID);
        } catch (Exception e) {
            throw operationFailure("Transcription", e);
        } finally {
            deleteQuietly(wav);
        }
    }

    List<String> buildCommand(Path wav) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-m");
        cmd.add(resolvePath(cfg.modelPath()).toString());
        cmd.add("-f");
        cmd.add(wav.toAbsolutePath().toString());
        cmd.add("-l");
        cmd.add(cfg.language());
        cmd.add("-otxt");
        cmd.add("-of");
        cmd.add("stdout");
        cmd.add("-t");
        cmd.add(String.valueOf(cfg.threads()));
        return cmd;
    }

    @Override
    protected void doClose() {
        LOG.debug("whisper.cpp provider closed");
    }

    static Path resolvePath(String path) {
        Path p = Path.of(path);
        return p.isAbsolute() ? p : Path.of(".").toAbsolutePath().normalize().resolve(p).normalize();
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.debug("Could not delete temp file {}: {}", file, e.toString());
        }
    }
}
