package com.ryuqq.lifecycle.core.track.design;

import com.ryuqq.lifecycle.core.config.GateConfig;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DesignTrackMachine 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class DesignTrackMachineTest {

    private static final Instant AT = Instant.parse("2026-03-03T10:00:00Z");

    private final DesignTrackMachine machine = new DesignTrackMachine(GateConfig.defaults());

    @Test
    void wireframesOnly_IsWireframesReady() {
        // When
        DesignTrackState state = machine.apply(machine.initialState(), new AttachWireframes("drive://wireframes", "designer"), AT);

        // Then
        assertEquals(DesignStatus.WIREFRAMES_READY, state.status());
        assertEquals(1, state.version());
    }

    @Test
    void figmaThenSpec_IsComplete() {
        // Given
        DesignTrackState figma = machine.apply(machine.initialState(),
            new AttachFigma("https://www.figma.com/file/abc", "designer"), AT);

        // When
        DesignTrackState complete = machine.apply(figma, new AttachDesignSpec("docs/design-spec.md", "designer"), AT);

        // Then
        assertEquals(DesignStatus.FIGMA_ATTACHED, figma.status());
        assertEquals(DesignStatus.COMPLETE, complete.status());
        assertEquals(2, complete.version());
    }

    @Test
    void specWithoutFigma_StaysInProgressWhenFigmaRequired() {
        // When
        DesignTrackState state = machine.apply(machine.initialState(), new AttachDesignSpec("docs/design-spec.md", "designer"), AT);

        // Then
        assertEquals(DesignStatus.IN_PROGRESS, state.status());
    }

    @Test
    void specWithoutFigma_IsCompleteWhenFigmaOptional() {
        // Given
        DesignTrackMachine optionalFigma = new DesignTrackMachine(GateConfig.defaults().withFigmaRequired(false));

        // When
        DesignTrackState state = optionalFigma.apply(optionalFigma.initialState(),
            new AttachDesignSpec("docs/design-spec.md", "designer"), AT);

        // Then
        assertEquals(DesignStatus.COMPLETE, state.status());
        assertEquals(1, state.version());
    }

    @Test
    void transitionTable_AllowsNotStartedToComplete() {
        assertTrue(machine.getTransitionTable().isAllowed(DesignStatus.NOT_STARTED, DesignStatus.COMPLETE));
    }

    @Test
    void reconcile_ReplacesStaleStatusWithoutBumpingVersion() {
        // Given
        DesignTrackState figma = machine.apply(machine.initialState(),
            new AttachFigma("https://www.figma.com/file/abc", "designer"), AT);
        DesignTrackState stale = new DesignTrackState(DesignStatus.IN_PROGRESS, figma.version(), figma.metadata(),
            figma.started(), figma.blockedReason(), figma.specRef(), figma.figmaRef(), figma.wireframesRef());

        // When
        DesignTrackState reconciled = machine.reconcile(stale);

        // Then
        assertEquals(DesignStatus.FIGMA_ATTACHED, reconciled.status());
        assertEquals(stale.version(), reconciled.version());
        assertSame(figma, machine.reconcile(figma));
    }

    @Test
    void sameReferenceTwice_DoesNotBumpVersion() {
        // Given
        DesignTrackState first = machine.apply(machine.initialState(), new AttachWireframes("drive://wf", "designer"), AT);

        // When
        DesignTrackState second = machine.apply(first, new AttachWireframes("drive://wf", "designer"), AT.plusSeconds(5));

        // Then
        assertSame(first, second);
    }

    @Test
    void blankReference_IsRejectedByCommand() {
        assertThrows(IllegalArgumentException.class, () -> new AttachFigma(" ", "designer"));
    }
}
