package com.ryuqq.lifecycle.application.engine;

import com.ryuqq.lifecycle.application.action.TrackActionParser;
import com.ryuqq.lifecycle.core.alias.AliasIndex;
import com.ryuqq.lifecycle.core.alias.DuplicateCandidate;
import com.ryuqq.lifecycle.core.alias.TitleNormalizer;
import com.ryuqq.lifecycle.core.config.GateConfig;
import com.ryuqq.lifecycle.core.config.GateConfigProvider;
import com.ryuqq.lifecycle.core.exception.FeatureAlreadyExistsException;
import com.ryuqq.lifecycle.core.exception.GateNotReadyException;
import com.ryuqq.lifecycle.core.exception.InvalidPayloadException;
import com.ryuqq.lifecycle.core.exception.InvalidPhaseTransitionException;
import com.ryuqq.lifecycle.core.exception.TrackPreconditionException;
import com.ryuqq.lifecycle.core.gate.DecisionAction;
import com.ryuqq.lifecycle.core.gate.DecisionGateController;
import com.ryuqq.lifecycle.core.gate.DecisionResult;
import com.ryuqq.lifecycle.core.model.ArtifactType;
import com.ryuqq.lifecycle.core.model.Decision;
import com.ryuqq.lifecycle.core.model.FeatureRecord;
import com.ryuqq.lifecycle.core.model.FeatureSlug;
import com.ryuqq.lifecycle.core.model.ProductId;
import com.ryuqq.lifecycle.core.spi.BrainEntityCreator;
import com.ryuqq.lifecycle.core.spi.FeatureStore;
import com.ryuqq.lifecycle.core.spi.OutputGenerator;
import com.ryuqq.lifecycle.core.statemachine.Phase;
import com.ryuqq.lifecycle.core.statemachine.PhaseStateMachine;
import com.ryuqq.lifecycle.core.track.TrackCommand;
import com.ryuqq.lifecycle.core.track.TrackDispatcher;
import com.ryuqq.lifecycle.core.track.TrackState;
import com.ryuqq.lifecycle.core.track.TrackType;
import com.ryuqq.lifecycle.core.track.Tracks;
import com.ryuqq.lifecycle.core.track.businesscase.RecordApproval;
import com.ryuqq.lifecycle.core.track.design.AttachFigma;
import com.ryuqq.lifecycle.core.track.design.AttachWireframes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link FeatureEngine} 기본 구현.
 *
 * <p>상태 전이와 게이트 판단은 모두 core 컴포넌트에 위임하고, 이 클래스는 load → 위임 → save와
 * 로깅, 협력자(BrainEntityCreator, OutputGenerator) 호출만 담당합니다.
 * 게이트 설정은 연산마다 Feature의 제품 ID로 조회합니다.</p>
 *
 * <p><strong>로깅:</strong></p>
 * <ul>
 *   <li>INFO: Feature 생성, Phase 전이, 결정 기록</li>
 *   <li>WARN: 강제 승인, 협력자 실패</li>
 *   <li>DEBUG: 중복 후보, GateNotReady (정책 결과이므로 오류로 기록하지 않음)</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class DefaultFeatureEngine implements FeatureEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultFeatureEngine.class);

    static final String BUSINESS_CASE_DECISION_PHASE = "business_case";
    static final String BRAIN_ENTITY_KEY = "brain_entity";
    static final String BRAIN_ENTITY_ERROR_KEY = "brain_entity_error";
    static final String GENERATED_OUTPUTS_KEY = "generated_outputs";

    private final FeatureStore store;
    private final GateConfigProvider configProvider;
    private final BrainEntityCreator brainEntityCreator;
    private final OutputGenerator outputGenerator;
    private final Clock clock;
    private final TitleNormalizer normalizer = new TitleNormalizer();
    private final TrackActionParser actionParser = new TrackActionParser();

    public DefaultFeatureEngine(FeatureStore store,
                                GateConfigProvider configProvider,
                                BrainEntityCreator brainEntityCreator,
                                OutputGenerator outputGenerator,
                                Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (configProvider == null) {
            throw new IllegalArgumentException("configProvider cannot be null");
        }
        if (brainEntityCreator == null) {
            throw new IllegalArgumentException("brainEntityCreator cannot be null");
        }
        if (outputGenerator == null) {
            throw new IllegalArgumentException("outputGenerator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.configProvider = configProvider;
        this.brainEntityCreator = brainEntityCreator;
        this.outputGenerator = outputGenerator;
        this.clock = clock;
    }

    // ========== start_feature ==========

    @Override
    public StartOutcome startFeature(StartFeatureRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        ProductId productId;
        FeatureSlug slug;
        try {
            productId = ProductId.of(request.productId());
            slug = request.slugOverride() == null
                ? FeatureSlug.generate(request.productId(), request.title())
                : FeatureSlug.of(request.slugOverride());
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException(e.getMessage(), e);
        }

        if (store.exists(slug.getValue())) {
            throw new FeatureAlreadyExistsException(slug.getValue());
        }

        GateConfig config = configProvider.forProduct(productId.getValue());
        if (!request.confirmDuplicate()) {
            AliasIndex index = new AliasIndex(normalizer, config.duplicateThreshold());
            List<DuplicateCandidate> candidates = index.findDuplicates(
                productId.getValue(), request.title(), store.findByProduct(productId.getValue()));
            if (!candidates.isEmpty()) {
                log.debug("Feature '{}' in {} has {} duplicate candidate(s), best: {}",
                    request.title(), productId.getValue(), candidates.size(), candidates.get(0).slug());
                return new StartOutcome.DuplicateCandidates(candidates);
            }
        }

        Instant now = clock.instant();
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (request.priority() != null && !request.priority().isBlank()) {
            metadata.put("priority", request.priority().trim());
        }
        metadata.put("created_by", request.createdBy());

        FeatureRecord draft = FeatureRecord.create(slug, request.title(), productId, request.organization(), now, metadata);
        try {
            String entityRef = brainEntityCreator.create(draft);
            if (entityRef != null && !entityRef.isBlank()) {
                metadata.put(BRAIN_ENTITY_KEY, entityRef);
            }
        } catch (RuntimeException e) {
            log.warn("Brain entity creation failed for {}", slug.getValue(), e);
            metadata.put(BRAIN_ENTITY_ERROR_KEY, String.valueOf(e.getMessage()));
        }
        FeatureRecord record = FeatureRecord.create(slug, request.title(), productId, request.organization(), now, metadata);

        store.save(record);
        log.info("Feature started: {} ('{}', product={}, by={})",
            record.slug(), record.title(), record.productId(), request.createdBy());
        return new StartOutcome.Created(record);
    }

    // ========== check_feature / validate_feature ==========

    @Override
    public FeatureSnapshot checkFeature(String slug) {
        FeatureRecord record = store.load(slug);
        DecisionGateController controller = controllerFor(record);
        return new FeatureSnapshot(record, controller.getEvaluator().evaluateAll(record), controller.validate(record));
    }

    @Override
    public DecisionResult validateFeature(String slug) {
        FeatureRecord record = store.load(slug);
        return controllerFor(record).validate(record);
    }

    @Override
    public DecisionResult validateFeature(String slug, Phase phase) {
        if (phase == null) {
            return validateFeature(slug);
        }
        FeatureRecord record = store.load(slug);
        return controllerFor(record).validate(record, phase);
    }

    // ========== advance_track / attach_artifact ==========

    @Override
    public TrackState<?> advanceTrack(String slug, TrackType track, TrackCommand command) {
        if (track == null) {
            throw new IllegalArgumentException("track cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        FeatureRecord record = store.load(slug);
        requireTrackChangesAllowed(record, track);

        Instant now = clock.instant();
        Tracks tracks = dispatcherFor(record).apply(record.tracks(), track, command, now);
        if (tracks == record.tracks()) {
            return tracks.state(track);
        }

        FeatureRecord updated = record.withTracks(tracks);
        if (command instanceof RecordApproval approval) {
            updated = updated.appendDecision(approvalDecision(approval, tracks, now));
        }
        store.save(updated);
        log.info("Track {} of {} updated by {}: {} -> {}", track, slug, command.getClass().getSimpleName(),
            record.tracks().state(track).status(), tracks.state(track).status());
        return tracks.state(track);
    }

    @Override
    public TrackState<?> advanceTrack(String slug, String track, String action, Map<String, ?> payload, String actor) {
        TrackType type;
        try {
            type = TrackType.fromWireName(track);
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException(e.getMessage(), e);
        }
        return advanceTrack(slug, type, actionParser.parse(type, action, payload, actor));
    }

    @Override
    public Map<ArtifactType, String> attachArtifact(String slug, ArtifactType type, String ref, String actor) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (ref == null || ref.isBlank()) {
            throw new InvalidPayloadException("Artifact reference cannot be blank");
        }
        FeatureRecord record = store.load(slug);
        FeatureRecord updated = record.withArtifact(type, ref);

        TrackCommand designCommand = switch (type) {
            case FIGMA -> new AttachFigma(ref.trim(), actor);
            case WIREFRAMES -> new AttachWireframes(ref.trim(), actor);
            default -> null;
        };
        if (designCommand != null && trackChangesAllowed(record.currentPhase())) {
            updated = updated.withTracks(
                dispatcherFor(record).apply(updated.tracks(), TrackType.DESIGN, designCommand, clock.instant()));
        }

        if (!updated.equals(record)) {
            store.save(updated);
            log.info("Artifact {} attached to {}: {}", type, slug, ref.trim());
        }
        return updated.artifacts();
    }

    // ========== decision_gate ==========

    @Override
    public FeatureRecord decisionGate(String slug, DecisionAction action, String reason, String actor, boolean force) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        FeatureRecord record = store.load(slug);
        DecisionGateController controller = controllerFor(record);
        Instant now = clock.instant();

        FeatureRecord decided;
        if (action == DecisionAction.APPROVE) {
            try {
                decided = controller.approve(record, reason, actor, force, now);
            } catch (GateNotReadyException e) {
                log.debug("Decision gate for {} not ready: {}", slug, e.getBlockers());
                throw e;
            }
            Decision decision = decided.decisions().get(decided.decisions().size() - 1);
            if (decision.metadata().containsKey("bypassed_blockers")) {
                log.warn("Decision gate for {} force-approved by {} with open blockers: {}",
                    slug, actor, decision.metadata().get("bypassed_blockers"));
            }
        } else {
            decided = controller.reject(record, reason, actor, now);
        }

        store.save(decided);
        log.info("Decision gate {} for {} by {}: phase {} -> {}",
            action, slug, actor, record.currentPhase(), decided.currentPhase());
        return decided;
    }

    // ========== Phase operations ==========

    @Override
    public FeatureRecord advancePhase(String slug, Phase target, Map<String, Object> metadata) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        FeatureRecord record = store.load(slug);
        if ((target == Phase.DECISION_GATE || target == Phase.OUTPUT_GENERATION) && record.currentPhase() != target) {
            throw new InvalidPhaseTransitionException(record.currentPhase(), target,
                "Phase " + target + " is entered through the decision gate only");
        }
        FeatureRecord advanced = PhaseStateMachine.advance(record, target, metadata, clock.instant());
        if (advanced == record) {
            return record;
        }
        store.save(advanced);
        log.info("Feature {} phase advanced: {} -> {}", slug, record.currentPhase(), target);
        return advanced;
    }

    @Override
    public FeatureRecord archive(String slug, String reason, String actor) {
        return park(slug, Phase.ARCHIVED, reason, actor);
    }

    @Override
    public FeatureRecord defer(String slug, String reason, String actor) {
        return park(slug, Phase.DEFERRED, reason, actor);
    }

    private FeatureRecord park(String slug, Phase target, String reason, String actor) {
        if (reason == null || reason.isBlank()) {
            throw new InvalidPayloadException("reason cannot be blank");
        }
        if (actor == null || actor.isBlank()) {
            throw new InvalidPayloadException("actor cannot be blank");
        }
        FeatureRecord record = store.load(slug);
        Instant now = clock.instant();
        Phase from = record.currentPhase();

        FeatureRecord parked = PhaseStateMachine.advance(record, target, Map.of("reason", reason.trim()), now);
        parked = parked.appendDecision(new Decision(target.toString(), reason.trim(),
            "Moved from " + from, actor, now, Map.of("from_phase", from.toString())));

        store.save(parked);
        log.info("Feature {} {} by {}: {}", slug, target, actor, reason.trim());
        return parked;
    }

    @Override
    public FeatureRecord addAlias(String slug, String alias) {
        if (alias == null || alias.isBlank()) {
            throw new InvalidPayloadException("alias cannot be blank");
        }
        FeatureRecord record = store.load(slug);
        FeatureRecord updated = record.withAlias(alias);
        if (updated != record) {
            store.save(updated);
            log.info("Alias added to {}: {}", slug, alias.trim());
        }
        return updated;
    }

    @Override
    public List<FeatureRecord> listFeatures(String productId) {
        return store.findByProduct(productId);
    }

    @Override
    public List<String> generateOutputs(String slug, Map<String, String> documents) {
        FeatureRecord record = store.load(slug);
        if (record.currentPhase() != Phase.OUTPUT_GENERATION) {
            throw new InvalidPhaseTransitionException(record.currentPhase(), Phase.COMPLETE,
                "Outputs can only be generated in phase " + Phase.OUTPUT_GENERATION + " (current: " + record.currentPhase() + ")");
        }

        List<String> paths = List.copyOf(outputGenerator.generate(record, documents == null ? Map.of() : documents));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(GENERATED_OUTPUTS_KEY, new ArrayList<>(paths));
        FeatureRecord completed = PhaseStateMachine.advance(record, Phase.COMPLETE, metadata, clock.instant());

        store.save(completed);
        log.info("Feature {} complete with {} generated output(s)", slug, paths.size());
        return paths;
    }

    // ========== Helpers ==========

    private DecisionGateController controllerFor(FeatureRecord record) {
        return new DecisionGateController(configProvider.forProduct(record.productId()));
    }

    private TrackDispatcher dispatcherFor(FeatureRecord record) {
        return new TrackDispatcher(configProvider.forProduct(record.productId()));
    }

    private static boolean trackChangesAllowed(Phase phase) {
        return !phase.isTerminal() && phase != Phase.OUTPUT_GENERATION;
    }

    private static void requireTrackChangesAllowed(FeatureRecord record, TrackType track) {
        if (!trackChangesAllowed(record.currentPhase())) {
            throw new TrackPreconditionException(track,
                "Track changes are not allowed in phase " + record.currentPhase());
        }
    }

    private static Decision approvalDecision(RecordApproval approval, Tracks tracks, Instant at) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("approved", approval.approved());
        metadata.put("round", tracks.businessCase().round());
        metadata.put("track_status", tracks.businessCase().status().toString());
        String decision = (approval.approved() ? "Business case approved by " : "Business case rejected by ")
            + approval.approver();
        return new Decision(BUSINESS_CASE_DECISION_PHASE, decision, approval.comment(), approval.approver(), at, metadata);
    }
}
