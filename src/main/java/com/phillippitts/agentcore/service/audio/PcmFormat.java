package com.phillippitts.agentcore.service.audio;

/**
 * Audio format accepted by the transcription stage: 16 kHz, 16-bit signed PCM, mono,
 * little-endian, either raw or in a RIFF/WAVE container.
 */
public final class PcmFormat {

    public static final int SAMPLE_RATE = 16_000;
    public static final int BITS_PER_SAMPLE = 16;
    public static final int CHANNELS = 1;

    /** Bytes per frame. */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS;
    /** Bytes per second. */
    public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;

    // RIFF/WAVE layout
    public static final int WAV_HEADER_SIZE = 44;
    public static final int RIFF_HEADER_SIZE = 12;
    public static final int CHUNK_HEADER_SIZE = 8;
    public static final int FMT_CHUNK_MIN_SIZE = 16;
    public static final int AUDIO_FORMAT_PCM = 1;

    private PcmFormat() {
    }

    /** Approximate clip duration for a PCM payload of the given size. */
    public static long durationMillis(int pcmBytes) {
        return (pcmBytes * 1000L) / BYTE_RATE;
    }
}
