package com.phillippitts.phiredaction.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectorExceptionBuilderTest {

    @Test
    void buildsUnavailableWithMetadataInMessage() {
        IOException cause = new IOException("missing");

        DetectorUnavailableException ex = DetectorExceptionBuilder.create("Lexicon failed to load")
                .detector("lexicon")
                .cause(cause)
                .metadata("resource", "phi/given-names.txt")
                .buildUnavailable();

        assertThat(ex.getDetectorName()).isEqualTo("lexicon");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getMessage())
                .contains("Lexicon failed to load")
                .contains("resource=phi/given-names.txt");
    }

    @Test
    void buildsTimeoutWithDurationFirst() {
        DetectorTimeoutException ex = DetectorExceptionBuilder.create("Slow-lane pass timed out")
                .detector("contextual")
                .session("s-1")
                .durationMs(3000)
                .buildTimeout(3000);

        assertThat(ex.getTimeoutMs()).isEqualTo(3000);
        assertThat(ex.getMessage()).contains("(durationMs=3000, session=s-1)");
    }

    @Test
    void defaultsDetectorToUnknownAndSkipsNullMetadata() {
        DetectorUnavailableException ex = DetectorExceptionBuilder.create("boom")
                .metadata("ignored", null)
                .buildUnavailable();

        assertThat(ex.getDetectorName()).isEqualTo("unknown");
        assertThat(ex.getMessage()).doesNotContain("ignored");
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> DetectorExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
