package org.Aayush.locus.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NetworkPipelineExceptionTest {

    @Test
    @DisplayName("Message carries the reason code prefix and the cause is kept")
    void testFormatting() {
        IllegalStateException cause = new IllegalStateException("boom");
        NetworkPipelineException ex = new NetworkPipelineException("LOCUS_TEST", "failed", cause);

        assertEquals("LOCUS_TEST", ex.getReasonCode());
        assertEquals("[LOCUS_TEST] failed", ex.getMessage());
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank or null reason codes are rejected")
    void testReasonCodeValidation() {
        assertThrows(IllegalArgumentException.class, () -> new NetworkPipelineException(" ", "failed"));
        assertThrows(NullPointerException.class, () -> new NetworkPipelineException(null, "failed"));
    }
}
