package com.phillippitts.agentcore.service.backend.synthesis;

import com.phillippitts.agentcore.domain.SynthesisResult;
import com.phillippitts.agentcore.exception.BackendOperationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.SourceDataLine;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * {@link AudioPlayback} on the default Java Sound output line.
 *
 * <p>Accepts any container Java Sound can decode (WAV for the bundled providers). Providers
 * that support local playback compose this class instead of inheriting playback behaviour.
 */
public final class JavaSoundAudioPlayback implements AudioPlayback {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioPlayback.class);
    private static final int BUFFER_BYTES = 4096;

    private final String ownerId;

    /**
     * @param ownerId provider id used in error reports
     */
    public JavaSoundAudioPlayback(String ownerId) {
        this.ownerId = ownerId;
    }

    @Override
    public void play(SynthesisResult audio) {
        try (InputStream raw = new ByteArrayInputStream(audio.audio());
             AudioInputStream stream = AudioSystem.getAudioInputStream(raw)) {
            AudioFormat format = stream.getFormat();
            DataLine.Info info = new DataLine.Info(SourceDataLine.class, format);
            try (SourceDataLine line = (SourceDataLine) AudioSystem.getLine(info)) {
                line.open(format);
                line.start();
                byte[] buffer = new byte[BUFFER_BYTES];
                int read;
                while ((read = stream.read(buffer, 0, buffer.length)) != -1) {
                    line.write(buffer, 0, read);
                }
                line.drain();
                line.stop();
            }
            LOG.debug("Played {} bytes of {} audio", audio.sizeBytes(), audio.mediaType());
        } catch (UnsupportedAudioFileException | LineUnavailableException | IOException | IllegalArgumentException e) {
            throw new BackendOperationException("Audio playback failed: " + e.getMessage(), ownerId, e);
        }
    }
}
