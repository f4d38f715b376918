package com.phillippitts.agentcore.service.backend.synthesis.piper;

import com.phillippitts.agentcore.config.properties.PiperProperties;
import com.phillippitts.agentcore.domain.HealthProbe;
import com.phillippitts.agentcore.domain.SynthesisResult;
import com.phillippitts.agentcore.exception.BackendExceptionBuilder;
import com.phillippitts.agentcore.exception.ModelNotFoundException;
import com.phillippitts.agentcore.service.backend.AbstractBackendProvider;
import com.phillippitts.agentcore.service.backend.asset.AssetFetcher;
import com.phillippitts.agentcore.service.backend.process.ProcessRunner;
import com.phillippitts.agentcore.service.backend.process.ProcessSpec;
import com.phillippitts.agentcore.service.backend.synthesis.AudioPlayback;
import com.phillippitts.agentcore.service.backend.synthesis.JavaSoundAudioPlayback;
import com.phillippitts.agentcore.service.backend.synthesis.SynthesisProvider;
import com.phillippitts.agentcore.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Speech synthesis through the piper CLI; the text is fed on stdin and the WAV is read back
 * from a temporary output file:
 * <pre>
 *   ${binary} --model ${model} --output_file ${wav} [--speaker ${voice}]
 * </pre>
 * Also plays audio locally by delegating to {@link JavaSoundAudioPlayback}.
 */
public final class PiperSynthesisProvider extends AbstractBackendProvider implements SynthesisProvider, AudioPlayback {

    public static final String ID = "piper";

    private static final Logger LOG = LogManager.getLogger(PiperSynthesisProvider.class);
    private static final int MAX_LOG_OUTPUT = 64 * 1024;

    private final PiperProperties cfg;
    private final ProcessRunner runner;
    private final AssetFetcher assetFetcher;
    private final AudioPlayback playback;

    public PiperSynthesisProvider(PiperProperties cfg, ProcessRunner runner, AssetFetcher assetFetcher) {
        this(cfg, runner, assetFetcher, new JavaSoundAudioPlayback(ID));
    }

    PiperSynthesisProvider(PiperProperties cfg, ProcessRunner runner, AssetFetcher assetFetcher,
                           AudioPlayback playback) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.assetFetcher = Objects.requireNonNull(assetFetcher, "assetFetcher");
        this.playback = Objects.requireNonNull(playback, "playback");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String displayName() {
        return "Piper";
    }

    @Override
    protected void doPrepare() {
        Path model = resolvePath(cfg.modelPath());
        if (cfg.modelUrl() != null && !cfg.modelUrl().isBlank()) {
            assetFetcher.fetch(URI.create(cfg.modelUrl()), model);
            // piper needs the voice config next to the model
            Path config = model.resolveSibling(model.getFileName() + ".json");
            assetFetcher.fetch(URI.create(cfg.modelUrl() + ".json"), config);
        }
        if (!Files.isRegularFile(model)) {
            throw new ModelNotFoundException(model.toString());
        }
        Path binary = resolvePath(cfg.binaryPath());
        if (!Files.isExecutable(binary)) {
            throw new IllegalStateException("piper binary not executable: " + binary);
        }
        LOG.info("Piper prepared: bin={}, model={}", binary, model);
    }

    @Override
    protected HealthProbe doHealthCheck() {
        if (!Files.isRegularFile(resolvePath(cfg.modelPath()))) {
            return HealthProbe.down("Voice model missing: " + cfg.modelPath(),
                    "Restore the model or set backend.piper.model-url and reinitialize");
        }
        return HealthProbe.up();
    }

    @Override
    public SynthesisResult synthesize(String text, String voice) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }
        ensurePrepared();
        Path out = null;
        long start = System.nanoTime();
        try {
            out = Files.createTempFile("piper-", ".wav");
            runner.run(new ProcessSpec(ID, buildCommand(out, voice), out.getParent(),
                    (text.strip() + "\n").getBytes(StandardCharsets.UTF_8),
                    Duration.ofSeconds(cfg.timeoutSeconds()), MAX_LOG_OUTPUT,
                    Map.of("binaryPath", cfg.binaryPath(), "modelPath", cfg.modelPath())));
            byte[] audio = Files.readAllBytes(out);
            if (audio.length == 0) {
                throw BackendExceptionBuilder.create("Piper produced no audio")
                        .backend(ID)
                        .durationMs(TimeUtils.elapsedMillis(start))
                        .build();
            }
            LOG.debug("Piper synthesized {} chars into {} bytes in {} ms", text.length(), audio.length,
                    TimeUtils.elapsedMillis(start));
            return SynthesisResult.wav(audio, ID);
        } catch (Exception e) {
            throw operationFailure("Synthesis", e);
        } finally {
            deleteQuietly(out);
        }
    }

    @Override
    public void play(SynthesisResult audio) {
        ensurePrepared();
        playback.play(audio);
    }

    List<String> buildCommand(Path output, String voice) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("--model");
        cmd.add(resolvePath(cfg.modelPath()).toString());
        cmd.add("--output_file");
        cmd.add(output.toAbsolutePath().toString());
        if (voice != null && voice.chars().allMatch(Character::isDigit) && !voice.isEmpty()) {
            cmd.add("--speaker");
            cmd.add(voice);
        }
        return cmd;
    }

    @Override
    protected void doClose() {
        LOG.debug("Piper provider closed");
    }

    private static Path resolvePath(String path) {
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
