package com.phillippitts.agentcore.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Minimal RIFF/WAVE helpers for the fixed {@link PcmFormat}.
 */
public final class WavCodec {

    private WavCodec() {
    }

    /** Whether the bytes start with a RIFF/WAVE header. */
    public static boolean isWav(byte[] a) {
        return a != null && a.length >= PcmFormat.RIFF_HEADER_SIZE
                && a[0] == 'R' && a[1] == 'I' && a[2] == 'F' && a[3] == 'F'
                && a[8] == 'W' && a[9] == 'A' && a[10] == 'V' && a[11] == 'E';
    }

    /**
     * Writes audio to {@code target} as a WAV file. WAV input is written unchanged; raw PCM is
     * wrapped in a 44-byte header.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public static void writeFile(byte[] audio, Path target) {
        Objects.requireNonNull(audio, "audio");
        Objects.requireNonNull(target, "target");
        try (OutputStream os = Files.newOutputStream(target)) {
            if (isWav(audio)) {
                os.write(audio);
            } else {
                writeHeader(os, audio.length);
                os.write(audio);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write WAV file " + target, e);
        }
    }

    /** Wraps raw PCM in an in-memory WAV container. */
    public static byte[] wrapPcm(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm");
        ByteArrayOutputStream out = new ByteArrayOutputStream(PcmFormat.WAV_HEADER_SIZE + pcm.length);
        try {
            writeHeader(out, pcm.length);
            out.write(pcm);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    private static void writeHeader(OutputStream os, int dataSize) throws IOException {
        os.write(new byte[] {'R', 'I', 'F', 'F'});
        writeLEInt(os, 36 + dataSize);
        os.write(new byte[] {'W', 'A', 'V', 'E'});
        os.write(new byte[] {'f', 'm', 't', ' '});
        writeLEInt(os, PcmFormat.FMT_CHUNK_MIN_SIZE);
        writeLEShort(os, PcmFormat.AUDIO_FORMAT_PCM);
        writeLEShort(os, PcmFormat.CHANNELS);
        writeLEInt(os, PcmFormat.SAMPLE_RATE);
        writeLEInt(os, PcmFormat.BYTE_RATE);
        writeLEShort(os, PcmFormat.BLOCK_ALIGN);
        writeLEShort(os, PcmFormat.BITS_PER_SAMPLE);
        os.write(new byte[] {'d', 'a', 't', 'a'});
        writeLEInt(os, dataSize);
    }

    static int readLEShort(byte[] a, int off) {
        return (a[off] & 0xFF) | ((a[off + 1] & 0xFF) << 8);
    }

    static int readLEInt(byte[] a, int off) {
        return (a[off] & 0xFF)
                | ((a[off + 1] & 0xFF) << 8)
                | ((a[off + 2] & 0xFF) << 16)
                | ((a[off + 3] & 0xFF) << 24);
    }

    private static void writeLEShort(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
