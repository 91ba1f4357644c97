package com.phillippitts.phiredaction.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityTest {

    private static final EntityContext CTX_A = new EntityContext("c-1", "call me at", Channel.PRIMARY, 0.0, 1.0);
    private static final EntityContext CTX_B = new EntityContext("c-2", "again at", Channel.SECONDARY, 1.0, 2.0);

    private static Entity phone(List<EntityContext> contexts) {
        return new Entity("e-1", PhiLabel.PHONE, "555-123-4567", 19, 31, 0.8, DetectionMethod.PATTERN, contexts);
    }

    @Test
    void rejectsEmptyOrNegativeSpans() {
        assertThatThrownBy(() -> new Entity("e-1", PhiLabel.PHONE, "x", 5, 5, 0.5, DetectionMethod.PATTERN, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Entity("e-1", PhiLabel.PHONE, "x", -1, 2, 0.5, DetectionMethod.PATTERN, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsConfidenceOutsideUnitInterval() {
        assertThatThrownBy(() -> new Entity("e-1", PhiLabel.PHONE, "x", 0, 1, 1.2, DetectionMethod.PATTERN, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1.2");
    }

    @Test
    void overlapUsesHalfOpenIntervals() {
        Entity e = phone(null);
        assertThat(e.overlaps(30, 40)).isTrue();
        assertThat(e.overlaps(31, 40)).isFalse();
        assertThat(e.overlaps(0, 19)).isFalse();
        assertThat(e.contains(19, 31)).isTrue();
        assertThat(e.contains(18, 25)).isFalse();
        assertThat(e.length()).isEqualTo(12);
    }

    @Test
    void withContextsUnionsWithoutDuplicates() {
        Entity e = phone(List.of(CTX_A));

        Entity merged = e.withContexts(List.of(CTX_A, CTX_B));

        assertThat(merged.id()).isEqualTo("e-1");
        assertThat(merged.contexts()).containsExactly(CTX_A, CTX_B);
    }

    @Test
    void withContextsReturnsSameInstanceWhenNothingNew() {
        Entity e = phone(List.of(CTX_A));

        assertThat(e.withContexts(List.of(CTX_A))).isSameAs(e);
        assertThat(e.withContexts(List.of())).isSameAs(e);
    }

    @Test
    void fromCopiesDetectionFields() {
        Detection d = new Detection(PhiLabel.EMAIL, "a@b.io", 3, 9, 0.95, DetectionMethod.PATTERN, List.of(CTX_A));

        Entity e = Entity.from("e-7", d);

        assertThat(e.id()).isEqualTo("e-7");
        assertThat(e.label()).isEqualTo(PhiLabel.EMAIL);
        assertThat(e.start()).isEqualTo(3);
        assertThat(e.end()).isEqualTo(9);
        assertThat(e.contexts()).containsExactly(CTX_A);
    }
}
