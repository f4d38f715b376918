package com.phillippitts.agentcore.service.audio;

import com.phillippitts.agentcore.exception.InvalidAudioException;

import java.nio.charset.StandardCharsets;

/**
 * Parsed fmt/data chunk information of a WAV clip.
 *
 * @param audioFormat format code (1 = PCM)
 * @param channels channel count
 * @param sampleRate sample rate in Hz
 * @param byteRate bytes per second
 * @param blockAlign bytes per frame
 * @param bitsPerSample bit depth
 * @param dataSize size of the data chunk in bytes
 */
public record WavHeader(int audioFormat, int channels, int sampleRate, int byteRate,
                        int blockAlign, int bitsPerSample, int dataSize) {

    /**
     * Walks the RIFF chunks, tolerating extra chunks and extended fmt chunks.
     *
     * @throws InvalidAudioException on truncated or inconsistent chunk structure
     */
    public static WavHeader parse(byte[] wav) {
        if (!WavCodec.isWav(wav)) {
            throw new InvalidAudioException("Not a RIFF/WAVE container");
        }
        int offset = PcmFormat.RIFF_HEADER_SIZE;
        int fmtOffset = -1;
        int fmtSize = 0;
        int dataSize = -1;
        while (offset + PcmFormat.CHUNK_HEADER_SIZE <= wav.length) {
            String id = new String(wav, offset, 4, StandardCharsets.US_ASCII);
            int size = WavCodec.readLEInt(wav, offset + 4);
            if (size < 0 || offset + PcmFormat.CHUNK_HEADER_SIZE + (long) size > wav.length) {
                throw new InvalidAudioException(wav.length, "Invalid chunk size " + size + " at offset " + offset);
            }
            if ("fmt ".equals(id)) {
                fmtOffset = offset + PcmFormat.CHUNK_HEADER_SIZE;
                fmtSize = size;
            } else if ("data".equals(id)) {
                dataSize = size;
                break;
            }
            // chunks are padded to even boundaries
            offset += PcmFormat.CHUNK_HEADER_SIZE + size + (size % 2);
        }
        if (fmtOffset < 0) {
            throw new InvalidAudioException("Missing fmt chunk in WAV file");
        }
        if (fmtSize < PcmFormat.FMT_CHUNK_MIN_SIZE) {
            throw new InvalidAudioException("fmt chunk too small: " + fmtSize + " bytes");
        }
        if (dataSize < 0) {
            throw new InvalidAudioException("Missing data chunk in WAV file");
        }
        return new WavHeader(
                WavCodec.readLEShort(wav, fmtOffset),
                WavCodec.readLEShort(wav, fmtOffset + 2),
                WavCodec.readLEInt(wav, fmtOffset + 4),
                WavCodec.readLEInt(wav, fmtOffset + 8),
                WavCodec.readLEShort(wav, fmtOffset + 12),
                WavCodec.readLEShort(wav, fmtOffset + 14),
                dataSize);
    }
}
