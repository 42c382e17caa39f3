package com.ryuqq.lifecycle.core.track.engineering;

import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.track.TrackCommand;
import com.ryuqq.lifecycle.core.track.TrackStateMachine;
import com.ryuqq.lifecycle.core.track.TrackTransitionTable;
import com.ryuqq.lifecycle.core.track.TrackType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.ryuqq.lifecycle.core.track.engineering.EngineeringStatus.*;

/**
 * Engineering Track 상태 머신.
 *
 * <p><strong>완료 조건:</strong></p>
 * <ul>
 *   <li>컴포넌트 1개 이상</li>
 *   <li>PROPOSED 상태 ADR 없음</li>
 *   <li>추정치 기록됨</li>
 *   <li>완화 방안 없는 고영향 위험 없음</li>
 * </ul>
 *
 * <p><strong>상태 도출 규칙 (우선순위 순):</strong></p>
 * <ol>
 *   <li>차단 사유 있음 → BLOCKED</li>
 *   <li>완료 조건 충족 → COMPLETE</li>
 *   <li>추정 요청 후 추정치 없음 → ESTIMATION_PENDING</li>
 *   <li>시작했거나 사실이 기록됨 → IN_PROGRESS</li>
 *   <li>그 외 → NOT_STARTED</li>
 * </ol>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class EngineeringTrackMachine extends TrackStateMachine<EngineeringStatus, EngineeringTrackState> {

    private static final TrackTransitionTable<EngineeringStatus> TABLE =
        TrackTransitionTable.builder(TrackType.ENGINEERING, EngineeringStatus.class)
            .allow(NOT_STARTED, IN_PROGRESS, ESTIMATION_PENDING, BLOCKED)
            .allow(IN_PROGRESS, ESTIMATION_PENDING, COMPLETE, BLOCKED)
            .allow(ESTIMATION_PENDING, IN_PROGRESS, COMPLETE, BLOCKED)
            .allow(BLOCKED, IN_PROGRESS, ESTIMATION_PENDING, COMPLETE)
            .allow(COMPLETE, IN_PROGRESS, BLOCKED)
            .build();

    private static final String RISK_ID_PREFIX = "R-";

    public EngineeringTrackMachine(GateConfig config) {
        super(TrackType.ENGINEERING, TABLE);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
    }

    public static TrackTransitionTable<EngineeringStatus> transitionTable() {
        return TABLE;
    }

    @Override
    public EngineeringTrackState initialState() {
        return EngineeringTrackState.initial();
    }

    @Override
    protected EngineeringTrackState mutate(EngineeringTrackState current, TrackCommand command, Instant at) {
        if (command instanceof AddComponent add) {
            return addComponent(current, add);
        }
        if (command instanceof CreateAdr create) {
            return createAdr(current, create, at);
        }
        if (command instanceof DecideAdr decide) {
            return decideAdr(current, decide);
        }
        if (command instanceof RecordEstimate estimate) {
            return current.withEstimate(
                new Estimate(estimate.size(), estimate.confidence(), estimate.breakdown(), estimate.actor(), at),
                false);
        }
        if (command instanceof RequestEstimate) {
            if (current.estimate() != null) {
                throw precondition("Estimate already recorded (" + current.estimate().size() + ")");
            }
            return current.withEstimate(null, true);
        }
        if (command instanceof AddRisk add) {
            return addRisk(current, add);
        }
        if (command instanceof MitigateRisk mitigate) {
            return mitigateRisk(current, mitigate);
        }
        if (command instanceof AddDependency add) {
            return addDependency(current, add);
        }
        if (command instanceof UpdateDependency update) {
            return updateDependency(current, update);
        }
        throw unsupported(command);
    }

    private EngineeringTrackState addComponent(EngineeringTrackState current, AddComponent command) {
        for (Component component : current.components()) {
            if (component.name().equals(command.name())) {
                throw precondition("Component already exists: " + command.name());
            }
        }
        List<Component> components = new ArrayList<>(current.components());
        components.add(new Component(command.name(), command.description()));
        return current.withComponents(components);
    }

    private EngineeringTrackState createAdr(EngineeringTrackState current, CreateAdr command, Instant at) {
        List<Adr> adrs = new ArrayList<>(current.adrs());
        if (command.supersedes() != null) {
            int index = indexOfAdr(adrs, command.supersedes());
            if (index < 0) {
                throw precondition(String.format("Cannot supersede ADR-%03d: not found", command.supersedes()));
            }
            adrs.set(index, adrs.get(index).withStatus(AdrStatus.SUPERSEDED));
        }
        adrs.add(new Adr(adrs.size() + 1, command.title(), AdrStatus.PROPOSED,
            command.context(), command.decision(), command.supersedes(), at));
        return current.withAdrs(adrs);
    }

    private EngineeringTrackState decideAdr(EngineeringTrackState current, DecideAdr command) {
        List<Adr> adrs = new ArrayList<>(current.adrs());
        int index = indexOfAdr(adrs, command.number());
        if (index < 0) {
            throw precondition(String.format("ADR-%03d not found", command.number()));
        }
        Adr adr = adrs.get(index);
        if (adr.status() == command.status()) {
            return current;
        }
        boolean allowed = switch (adr.status()) {
            case PROPOSED -> command.status() == AdrStatus.ACCEPTED || command.status() == AdrStatus.REJECTED;
            case ACCEPTED -> command.status() == AdrStatus.DEPRECATED;
            default -> false;
        };
        if (!allowed) {
            throw precondition(String.format("Cannot change %s from %s to %s",
                adr.label(), adr.status(), command.status()));
        }
        adrs.set(index, adr.withStatus(command.status()));
        return current.withAdrs(adrs);
    }

    private static int indexOfAdr(List<Adr> adrs, int number) {
        for (int i = 0; i < adrs.size(); i++) {
            if (adrs.get(i).number() == number) {
                return i;
            }
        }
        return -1;
    }

    private EngineeringTrackState addRisk(EngineeringTrackState current, AddRisk command) {
        List<Risk> risks = new ArrayList<>(current.risks());
        risks.add(new Risk(RISK_ID_PREFIX + (risks.size() + 1), command.description(), command.impact(),
            command.likelihood(), command.mitigation(), command.owner()));
        return current.withRisks(risks);
    }

    private EngineeringTrackState mitigateRisk(EngineeringTrackState current, MitigateRisk command) {
        List<Risk> risks = new ArrayList<>(current.risks());
        for (int i = 0; i < risks.size(); i++) {
            if (risks.get(i).id().equals(command.riskId())) {
                risks.set(i, risks.get(i).withMitigation(command.mitigation()));
                return current.withRisks(risks);
            }
        }
        throw precondition("Risk not found: " + command.riskId());
    }

    private EngineeringTrackState addDependency(EngineeringTrackState current, AddDependency command) {
        for (Dependency dependency : current.dependencies()) {
            if (dependency.name().equals(command.name())) {
                throw precondition("Dependency already exists: " + command.name());
            }
        }
        List<Dependency> dependencies = new ArrayList<>(current.dependencies());
        dependencies.add(new Dependency(command.name(), command.description(), DependencyStatus.PENDING, command.blocking()));
        return current.withDependencies(dependencies);
    }

    private EngineeringTrackState updateDependency(EngineeringTrackState current, UpdateDependency command) {
        List<Dependency> dependencies = new ArrayList<>(current.dependencies());
        for (int i = 0; i < dependencies.size(); i++) {
            Dependency existing = dependencies.get(i);
            if (existing.name().equals(command.name())) {
                boolean blocking;
                if (command.blocking() != null) {
                    blocking = command.blocking();
                } else if (command.status() == DependencyStatus.READY) {
                    blocking = false;
                } else if (command.status() == DependencyStatus.BLOCKED) {
                    blocking = true;
                } else {
                    blocking = existing.blocking();
                }
                dependencies.set(i, new Dependency(existing.name(), existing.description(), command.status(), blocking));
                return current.withDependencies(dependencies);
            }
        }
        throw precondition("Dependency not found: " + command.name());
    }

    /**
     * 완료 조건 충족 여부.
     *
     * @param state 상태
     * @return 완료 조건을 모두 만족하면 true
     */
    public static boolean isComplete(EngineeringTrackState state) {
        return !state.components().isEmpty()
            && state.proposedAdrs().isEmpty()
            && state.estimate() != null
            && state.unmitigatedHighImpactRisks().isEmpty();
    }

    @Override
    public EngineeringStatus deriveStatus(EngineeringTrackState state) {
        if (state.blockedReason() != null) {
            return BLOCKED;
        }
        if (isComplete(state)) {
            return COMPLETE;
        }
        if (state.estimateRequested() && state.estimate() == null) {
            return ESTIMATION_PENDING;
        }
        boolean hasFacts = !state.components().isEmpty()
            || !state.adrs().isEmpty()
            || state.estimate() != null
            || !state.risks().isEmpty()
            || !state.dependencies().isEmpty();
        return state.started() || hasFacts ? IN_PROGRESS : NOT_STARTED;
    }

    @Override
    protected EngineeringTrackState withLifecycle(EngineeringTrackState state, boolean started, String blockedReason,
                                                  Map<String, String> metadata) {
        return state.withLifecycle(started, blockedReason, metadata);
    }

    @Override
    protected EngineeringTrackState withStatus(EngineeringTrackState state, EngineeringStatus status) {
        return state.withStatus(status, state.version());
    }

    @Override
    protected EngineeringTrackState settle(EngineeringTrackState previous, EngineeringTrackState mutated,
                                           EngineeringStatus status) {
        return mutated.withStatus(status, previous.version() + 1);
    }
}
