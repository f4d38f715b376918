package com.phillippitts.agentcore.service.backend;

import com.phillippitts.agentcore.exception.BackendOperationException;
import com.phillippitts.agentcore.testutil.FakeTranscriptionProvider;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbstractBackendProviderTest {

    private final FakeTranscriptionProvider provider = new FakeTranscriptionProvider("fake", "hello");

    @Test
    void prepareIsIdempotent() {
        provider.prepare();
        provider.prepare();

        assertThat(provider.prepareCalls.get()).isEqualTo(1);
        assertThat(provider.healthCheck().ready()).isTrue();
    }

    @Test
    void failedPrepareCanBeRetried() {
        provider.failPrepare = true;
        assertThatThrownBy(provider::prepare).hasMessage("model missing for fake");
        assertThat(provider.healthCheck().reason()).isEqualTo("fake has not been prepared");

        provider.failPrepare = false;
        provider.prepare();

        assertThat(provider.prepareCalls.get()).isEqualTo(2);
        assertThat(provider.healthCheck().ready()).isTrue();
    }

    @Test
    void closedProviderCannotBePreparedAgain() {
        provider.prepare();
        provider.close();
        provider.close();

        assertThat(provider.closeCalls.get()).isEqualTo(1);
        assertThat(provider.healthCheck().ready()).isFalse();
        assertThatThrownBy(provider::prepare)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("fake is closed");
    }

    @Test
    void ensurePreparedGuardsOperations() {
        assertThatThrownBy(provider::ensurePrepared)
                .isInstanceOf(BackendOperationException.class)
                .hasMessageContaining("not prepared or closed");
    }

    @Test
    void operationFailureWrapsWithProviderId() {
        BackendOperationException wrapped = provider.operationFailure("Transcription", new IOException("disk full"));
        BackendOperationException existing = new BackendOperationException("exit 1", "fake");

        assertThat(wrapped).hasMessage("Transcription failed: disk full (backend: fake)")
                .hasCauseInstanceOf(IOException.class);
        assertThat(provider.operationFailure("Transcription", existing)).isSameAs(existing);
    }
}
