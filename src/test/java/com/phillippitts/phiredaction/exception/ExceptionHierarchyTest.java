package com.phillippitts.phiredaction.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void phiRedactionExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        PhiRedactionException ex = new PhiRedactionException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void chunkValidationExceptionCarriesIds() {
        ChunkValidationException ex = new ChunkValidationException("s-1", "c-9", "Chunk text is empty");

        assertThat(ex).isInstanceOf(PhiRedactionException.class);
        assertThat(ex.getSessionId()).isEqualTo("s-1");
        assertThat(ex.getChunkId()).isEqualTo("c-9");
        assertThat(ex.getReason()).isEqualTo("Chunk text is empty");
        assertThat(ex.getMessage()).contains("s-1").contains("c-9");
    }

    @Test
    void unknownEntityExceptionListsIdsSorted() {
        UnknownEntityException ex = new UnknownEntityException("snap-1", Set.of("e-9", "e-10", "e-2"));

        assertThat(ex.getSnapshotId()).isEqualTo("snap-1");
        assertThat(ex.getUnknownIds()).containsExactlyInAnyOrder("e-9", "e-10", "e-2");
        assertThat(ex.getMessage()).contains("[e-10, e-2, e-9]");
    }

    @Test
    void staleSnapshotExceptionOptionallyNamesEntity() {
        StaleSnapshotException whole = new StaleSnapshotException("snap-1", "s-1", "text changed");
        StaleSnapshotException entity = new StaleSnapshotException("snap-1", "s-1", "e-3", "offsets moved");

        assertThat(whole.getEntityId()).isNull();
        assertThat(entity.getEntityId()).isEqualTo("e-3");
        assertThat(entity.getSessionId()).isEqualTo("s-1");
    }

    @Test
    void notFoundExceptionsCarryIds() {
        assertThat(new SessionNotFoundException("s-404").getSessionId()).isEqualTo("s-404");
        assertThat(new SnapshotNotFoundException("snap-404").getSnapshotId()).isEqualTo("snap-404");
    }

    @Test
    void egressBlockedExceptionCarriesReasonAndDestination() {
        EgressBlockedException ex = new EgressBlockedException("offline mode is enabled", "llm");

        assertThat(ex.getReason()).isEqualTo("offline mode is enabled");
        assertThat(ex.getDestination()).isEqualTo("llm");
        assertThat(ex.getMessage()).contains("llm");
    }

    @Test
    void detectorExceptionsIncludeDetectorName() {
        DetectorUnavailableException unavailable = new DetectorUnavailableException("model gone", "lexicon");
        DetectorTimeoutException timeout = new DetectorTimeoutException("too slow", "lexicon", 3000);

        assertThat(unavailable.getDetectorName()).isEqualTo("lexicon");
        assertThat(unavailable.getMessage()).contains("lexicon");
        assertThat(timeout.getTimeoutMs()).isEqualTo(3000);
        assertThat(timeout.getDetectorName()).isEqualTo("lexicon");
    }
}
