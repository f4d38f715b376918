package com.phillippitts.agentcore.service.validation;

import com.phillippitts.agentcore.config.properties.AudioValidationProperties;
import com.phillippitts.agentcore.exception.InvalidAudioException;
import com.phillippitts.agentcore.service.audio.PcmFormat;
import com.phillippitts.agentcore.service.audio.WavCodec;
import com.phillippitts.agentcore.service.audio.WavHeader;

/**
 * Capture-stage check for pipeline audio: WAV in the fixed {@link PcmFormat} or raw PCM of that
 * format, within the configured size and duration bounds.
 */
public class AudioValidator {

    private final AudioValidationProperties props;

    public AudioValidator(AudioValidationProperties props) {
        this.props = props;
    }

    /**
     * @throws InvalidAudioException when format, size or duration constraints are violated
     */
    public void validate(byte[] data) {
        if (data == null || data.length == 0) {
            throw new InvalidAudioException("Audio data is empty");
        }
        if (data.length > props.getMaxFileSizeBytes()) {
            throw new InvalidAudioException(data.length, "Audio payload too large. Max: "
                    + props.getMaxFileSizeBytes() + " bytes");
        }
        int pcmBytes = WavCodec.isWav(data) ? validateWav(data) : data.length;
        if (pcmBytes % PcmFormat.BLOCK_ALIGN != 0) {
            throw new InvalidAudioException(data.length, "PCM not aligned to block size ("
                    + PcmFormat.BLOCK_ALIGN + " bytes)");
        }
        long durationMs = PcmFormat.durationMillis(pcmBytes);
        if (durationMs < props.getMinDurationMs()) {
            throw new InvalidAudioException(data.length, "Audio too short: ~" + durationMs
                    + " ms. Min: " + props.getMinDurationMs() + " ms");
        }
        if (durationMs > props.getMaxDurationMs()) {
            throw new InvalidAudioException(data.length, "Audio too long: ~" + durationMs
                    + " ms. Max: " + props.getMaxDurationMs() + " ms");
        }
    }

    private static int validateWav(byte[] wav) {
        WavHeader h = WavHeader.parse(wav);
        if (h.audioFormat() != PcmFormat.AUDIO_FORMAT_PCM) {
            throw new InvalidAudioException("Unsupported audio format: " + h.audioFormat() + " (expected PCM)");
        }
        if (h.channels() != PcmFormat.CHANNELS) {
            throw new InvalidAudioException("Invalid channel count: " + h.channels()
                    + ". Expected: " + PcmFormat.CHANNELS);
        }
        if (h.sampleRate() != PcmFormat.SAMPLE_RATE) {
            throw new InvalidAudioException("Invalid sample rate: " + h.sampleRate()
                    + " Hz. Expected: " + PcmFormat.SAMPLE_RATE + " Hz");
        }
        if (h.bitsPerSample() != PcmFormat.BITS_PER_SAMPLE) {
            throw new InvalidAudioException("Invalid bit depth: " + h.bitsPerSample()
                    + "-bit. Expected: " + PcmFormat.BITS_PER_SAMPLE + "-bit");
        }
        if (h.blockAlign() != PcmFormat.BLOCK_ALIGN || h.byteRate() != PcmFormat.BYTE_RATE) {
            throw new InvalidAudioException("Inconsistent block align/byte rate: "
                    + h.blockAlign() + "/" + h.byteRate());
        }
        return h.dataSize();
    }
}
