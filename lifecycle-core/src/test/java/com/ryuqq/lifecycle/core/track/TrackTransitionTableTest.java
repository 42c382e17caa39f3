package com.ryuqq.lifecycle.core.track;

import com.ryuqq.lifecycle.core.exception.InvalidTrackTransitionException;
import com.ryuqq.lifecycle.core.track.businesscase.BusinessCaseStatus;
import com.ryuqq.lifecycle.core.track.businesscase.BusinessCaseTrackMachine;
import com.ryuqq.lifecycle.core.track.context.ContextStatus;
import com.ryuqq.lifecycle.core.track.context.ContextTrackMachine;
import com.ryuqq.lifecycle.core.track.design.DesignStatus;
import com.ryuqq.lifecycle.core.track.design.DesignTrackMachine;
import com.ryuqq.lifecycle.core.track.engineering.EngineeringStatus;
import com.ryuqq.lifecycle.core.track.engineering.EngineeringTrackMachine;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Track 전이 테이블 테스트.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
class TrackTransitionTableTest {

    @Test
    void engineering_NotStartedToComplete_IsRejected() {
        // Given
        TrackTransitionTable<EngineeringStatus> table = EngineeringTrackMachine.transitionTable();

        // When & Then
        InvalidTrackTransitionException exception = assertThrows(
            InvalidTrackTransitionException.class,
            () -> table.validate(EngineeringStatus.NOT_STARTED, EngineeringStatus.COMPLETE)
        );
        assertThat(exception.getTrack()).isEqualTo(TrackType.ENGINEERING);
        assertThat(exception.getMessage()).isEqualTo("Invalid Engineering track transition: not_started → complete");
    }

    @Test
    void engineering_CompleteCanReopen() {
        TrackTransitionTable<EngineeringStatus> table = EngineeringTrackMachine.transitionTable();

        assertThat(table.isAllowed(EngineeringStatus.COMPLETE, EngineeringStatus.IN_PROGRESS)).isTrue();
        assertThat(table.isAllowed(EngineeringStatus.COMPLETE, EngineeringStatus.NOT_STARTED)).isFalse();
    }

    @Test
    void terminalStates_AllowOnlySelfTransition() {
        TrackTransitionTable<ContextStatus> context = ContextTrackMachine.transitionTable();
        TrackTransitionTable<DesignStatus> design = DesignTrackMachine.transitionTable();
        TrackTransitionTable<BusinessCaseStatus> businessCase = BusinessCaseTrackMachine.transitionTable();

        assertThat(context.allowedTargets(ContextStatus.COMPLETE)).isEmpty();
        assertThat(context.isAllowed(ContextStatus.COMPLETE, ContextStatus.COMPLETE)).isTrue();
        assertThat(design.isAllowed(DesignStatus.COMPLETE, DesignStatus.IN_PROGRESS)).isFalse();
        assertThat(businessCase.isAllowed(BusinessCaseStatus.APPROVED, BusinessCaseStatus.REJECTED)).isFalse();
    }

    @Test
    void businessCase_RejectedReturnsOnlyThroughInProgress() {
        TrackTransitionTable<BusinessCaseStatus> table = BusinessCaseTrackMachine.transitionTable();

        assertThat(table.allowedTargets(BusinessCaseStatus.REJECTED))
            .containsExactlyInAnyOrder(BusinessCaseStatus.IN_PROGRESS, BusinessCaseStatus.BLOCKED);
        assertThat(table.isAllowed(BusinessCaseStatus.REJECTED, BusinessCaseStatus.APPROVED)).isFalse();
    }

    @Test
    void builder_TransitionOutOfTerminalState_IsRejected() {
        assertThatThrownBy(() -> TrackTransitionTable.builder(TrackType.DESIGN, DesignStatus.class)
            .allow(DesignStatus.COMPLETE, DesignStatus.IN_PROGRESS))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        TrackTransitionTable<DesignStatus> table = DesignTrackMachine.transitionTable();

        assertThrows(IllegalArgumentException.class, () -> table.validate(null, DesignStatus.COMPLETE));
    }
}
