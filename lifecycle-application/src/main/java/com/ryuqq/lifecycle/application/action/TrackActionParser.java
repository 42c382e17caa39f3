package com.ryuqq.lifecycle.application.action;

import com.ryuqq.lifecycle.core.exception.InvalidPayloadException;
import com.ryuqq.lifecycle.core.track.BlockTrack;
import com.ryuqq.lifecycle.core.track.StartTrack;
import com.ryuqq.lifecycle.core.track.TrackCommand;
import com.ryuqq.lifecycle.core.track.TrackType;
import com.ryuqq.lifecycle.core.track.UnblockTrack;
import com.ryuqq.lifecycle.core.track.businesscase.RecordApproval;
import com.ryuqq.lifecycle.core.track.businesscase.ReviseBusinessCase;
import com.ryuqq.lifecycle.core.track.businesscase.SetAssumptions;
import com.ryuqq.lifecycle.core.track.businesscase.SubmitForApproval;
import com.ryuqq.lifecycle.core.track.context.ContextSection;
import com.ryuqq.lifecycle.core.track.context.RecordChallengeScore;
import com.ryuqq.lifecycle.core.track.context.SubmitContextVersion;
import com.ryuqq.lifecycle.core.track.design.AttachDesignSpec;
import com.ryuqq.lifecycle.core.track.design.AttachFigma;
import com.ryuqq.lifecycle.core.track.design.AttachWireframes;
import com.ryuqq.lifecycle.core.track.engineering.AddComponent;
import com.ryuqq.lifecycle.core.track.engineering.AddDependency;
import com.ryuqq.lifecycle.core.track.engineering.AddRisk;
import com.ryuqq.lifecycle.core.track.engineering.AdrStatus;
import com.ryuqq.lifecycle.core.track.engineering.CreateAdr;
import com.ryuqq.lifecycle.core.track.engineering.DecideAdr;
import com.ryuqq.lifecycle.core.track.engineering.DependencyStatus;
import com.ryuqq.lifecycle.core.track.engineering.EstimateConfidence;
import com.ryuqq.lifecycle.core.track.engineering.EstimateSize;
import com.ryuqq.lifecycle.core.track.engineering.MitigateRisk;
import com.ryuqq.lifecycle.core.track.engineering.RecordEstimate;
import com.ryuqq.lifecycle.core.track.engineering.RequestEstimate;
import com.ryuqq.lifecycle.core.track.engineering.RiskLevel;
import com.ryuqq.lifecycle.core.track.engineering.UpdateDependency;

import java.math.BigInteger;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Track action 이름과 payload를 Track 명령으로 변환.
 *
 * <p>외부 명령 계층(CLI, 에이전트)은 {@code (track, action, payload)} 형태로 Track 변경을 요청합니다.
 * payload 키는 snake_case이며, 값의 형식 오류나 누락은 모두 {@link InvalidPayloadException}으로 보고됩니다.</p>
 *
 * <p><strong>공통 action:</strong> {@code start}, {@code block {reason}}, {@code unblock}</p>
 *
 * <p><strong>Track별 action:</strong></p>
 * <ul>
 *   <li>context: {@code submit_version {version, document_ref, challenge_score?, sections?}},
 *       {@code record_challenge_score {score}}</li>
 *   <li>design: {@code attach_spec {ref}}, {@code attach_figma {ref}}, {@code attach_wireframes {ref}}</li>
 *   <li>business_case: {@code set_assumptions {baseline_metrics, impact_assumptions, roi_analysis?}},
 *       {@code submit_for_approval}, {@code record_approval {approver?, approved?, comment?}},
 *       {@code revise {reason}}</li>
 *   <li>engineering: {@code add_component}, {@code create_adr}, {@code decide_adr}, {@code record_estimate},
 *       {@code request_estimate}, {@code add_risk}, {@code mitigate_risk}, {@code add_dependency},
 *       {@code update_dependency {name, status, blocking?}}</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class TrackActionParser {

    private static final Map<TrackType, List<String>> ACTIONS = Map.of(
        TrackType.CONTEXT, List.of("submit_version", "record_challenge_score"),
        TrackType.DESIGN, List.of("attach_spec", "attach_figma", "attach_wireframes"),
        TrackType.BUSINESS_CASE, List.of("set_assumptions", "submit_for_approval", "record_approval", "revise"),
        TrackType.ENGINEERING, List.of("add_component", "create_adr", "decide_adr", "record_estimate",
            "request_estimate", "add_risk", "mitigate_risk", "add_dependency", "update_dependency"));

    /**
     * 명령 변환.
     *
     * @param track 대상 Track
     * @param action action 이름 (대소문자 무시, 하이픈 허용)
     * @param payload action 인자 (null이면 빈 payload)
     * @param actor 실행자
     * @return Track 명령
     * @throws InvalidPayloadException 알 수 없는 action 또는 잘못된 payload
     */
    public TrackCommand parse(TrackType track, String action, Map<String, ?> payload, String actor) {
        if (track == null) {
            throw new IllegalArgumentException("track cannot be null");
        }
        if (action == null || action.isBlank()) {
            throw new InvalidPayloadException("action cannot be null or blank");
        }
        String name = action.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        Payload args = new Payload(track, name, payload == null ? Map.of() : payload);

        try {
            switch (name) {
                case "start":
                    return new StartTrack(actor);
                case "block":
                    return new BlockTrack(args.requiredString("reason"), actor);
                case "unblock":
                    return new UnblockTrack(actor);
                default:
                    break;
            }
            return switch (track) {
                case CONTEXT -> parseContext(name, args, actor);
                case DESIGN -> parseDesign(name, args, actor);
                case BUSINESS_CASE -> parseBusinessCase(name, args, actor);
                case ENGINEERING -> parseEngineering(name, args, actor);
            };
        } catch (InvalidPayloadException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException(args.describe() + ": " + e.getMessage(), e);
        }
    }

    /**
     * 지원되는 Track별 action 이름 (공통 action 제외).
     *
     * @param track Track
     * @return action 이름 목록
     */
    public List<String> supportedActions(TrackType track) {
        return ACTIONS.get(track);
    }

    private TrackCommand parseContext(String action, Payload args, String actor) {
        switch (action) {
            case "submit_version":
                return new SubmitContextVersion(
                    args.requiredInt("version"),
                    args.requiredString("document_ref"),
                    args.optionalInteger("challenge_score"),
                    args.sections("sections"),
                    actor);
            case "record_challenge_score":
                return new RecordChallengeScore(args.requiredInt("score"), actor);
            default:
                throw unknownAction(TrackType.CONTEXT, action);
        }
    }

    private TrackCommand parseDesign(String action, Payload args, String actor) {
        switch (action) {
            case "attach_spec":
                return new AttachDesignSpec(args.requiredString("ref"), actor);
            case "attach_figma":
                return new AttachFigma(args.requiredString("ref"), actor);
            case "attach_wireframes":
                return new AttachWireframes(args.requiredString("ref"), actor);
            default:
                throw unknownAction(TrackType.DESIGN, action);
        }
    }

    private TrackCommand parseBusinessCase(String action, Payload args, String actor) {
        switch (action) {
            case "set_assumptions":
                return new SetAssumptions(
                    args.requiredString("baseline_metrics"),
                    args.requiredString("impact_assumptions"),
                    args.optionalString("roi_analysis"),
                    actor);
            case "submit_for_approval":
                return new SubmitForApproval(actor);
            case "record_approval": {
                String approver = args.optionalString("approver");
                return new RecordApproval(
                    approver == null ? actor : approver,
                    args.optionalBoolean("approved", true),
                    args.optionalString("comment"));
            }
            case "revise":
                return new ReviseBusinessCase(args.requiredString("reason"), actor);
            default:
                throw unknownAction(TrackType.BUSINESS_CASE, action);
        }
    }

    private TrackCommand parseEngineering(String action, Payload args, String actor) {
        switch (action) {
            case "add_component":
                return new AddComponent(args.requiredString("name"), args.optionalString("description"), actor);
            case "create_adr":
                return new CreateAdr(
                    args.requiredString("title"),
                    args.optionalString("context"),
                    args.optionalString("decision"),
                    args.optionalInteger("supersedes"),
                    actor);
            case "decide_adr":
                return new DecideAdr(
                    args.requiredInt("number"),
                    AdrStatus.fromWireName(args.requiredString("status")),
                    actor);
            case "record_estimate":
                return new RecordEstimate(
                    EstimateSize.valueOf(args.requiredString("size").trim().toUpperCase(Locale.ROOT)),
                    EstimateConfidence.fromWireName(args.requiredString("confidence")),
                    args.stringMap("breakdown"),
                    actor);
            case "request_estimate":
                return new RequestEstimate(actor);
            case "add_risk":
                return new AddRisk(
                    args.requiredString("description"),
                    RiskLevel.fromWireName(args.requiredString("impact")),
                    RiskLevel.fromWireName(args.requiredString("likelihood")),
                    args.optionalString("mitigation"),
                    args.optionalString("owner"),
                    actor);
            case "mitigate_risk":
                return new MitigateRisk(args.requiredString("risk_id"), args.requiredString("mitigation"), actor);
            case "add_dependency":
                return new AddDependency(
                    args.requiredString("name"),
                    args.optionalString("description"),
                    args.optionalBoolean("blocking", false),
                    actor);
            case "update_dependency":
                return new UpdateDependency(
                    args.requiredString("name"),
                    DependencyStatus.fromWireName(args.requiredString("status")),
                    args.optionalBooleanObject("blocking"),
                    actor);
            default:
                throw unknownAction(TrackType.ENGINEERING, action);
        }
    }

    private InvalidPayloadException unknownAction(TrackType track, String action) {
        return new InvalidPayloadException(String.format("Unknown action '%s' for track %s. Supported: start, block, unblock, %s",
            action, track, String.join(", ", ACTIONS.get(track))));
    }

    /**
     * payload 값 접근 헬퍼.
     */
    private static final class Payload {

        private final TrackType track;
        private final String action;
        private final Map<String, ?> values;

        Payload(TrackType track, String action, Map<String, ?> values) {
            this.track = track;
            this.action = action;
            this.values = values;
        }

        String describe() {
            return track + "." + action;
        }

        String requiredString(String key) {
            String value = optionalString(key);
            if (value == null || value.isBlank()) {
                throw invalid(key, "is required");
            }
            return value;
        }

        String optionalString(String key) {
            Object value = values.get(key);
            if (value == null) {
                return null;
            }
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                return value.toString();
            }
            throw invalid(key, "must be a string");
        }

        int requiredInt(String key) {
            Integer value = optionalInteger(key);
            if (value == null) {
                throw invalid(key, "is required");
            }
            return value;
        }

        Integer optionalInteger(String key) {
            Object value = values.get(key);
            if (value == null) {
                return null;
            }
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).intValue();
            }
            if (value instanceof Long || value instanceof BigInteger) {
                BigInteger wide = value instanceof BigInteger big ? big : BigInteger.valueOf((Long) value);
                try {
                    return wide.intValueExact();
                } catch (ArithmeticException e) {
                    throw new InvalidPayloadException(describe() + ": '" + key + "' is out of integer range: " + value, e);
                }
            }
            if (value instanceof String text) {
                try {
                    return Integer.valueOf(text.trim());
                } catch (NumberFormatException e) {
                    throw new InvalidPayloadException(describe() + ": '" + key + "' must be an integer: " + text, e);
                }
            }
            throw invalid(key, "must be an integer");
        }

        boolean optionalBoolean(String key, boolean defaultValue) {
            Boolean value = optionalBooleanObject(key);
            return value == null ? defaultValue : value;
        }

        Boolean optionalBooleanObject(String key) {
            Object value = values.get(key);
            if (value == null) {
                return null;
            }
            if (value instanceof Boolean bool) {
                return bool;
            }
            if (value instanceof String text) {
                String normalized = text.trim().toLowerCase(Locale.ROOT);
                if (normalized.equals("true") || normalized.equals("yes")) {
                    return Boolean.TRUE;
                }
                if (normalized.equals("false") || normalized.equals("no")) {
                    return Boolean.FALSE;
                }
            }
            throw invalid(key, "must be a boolean");
        }

        Set<ContextSection> sections(String key) {
            Object value = values.get(key);
            if (value == null) {
                return null;
            }
            if (!(value instanceof List<?> list)) {
                throw invalid(key, "must be a list");
            }
            Set<ContextSection> sections = EnumSet.noneOf(ContextSection.class);
            for (Object item : list) {
                if (item == null) {
                    throw invalid(key, "cannot contain null");
                }
                sections.add(ContextSection.fromWireName(item.toString()));
            }
            return sections;
        }

        Map<String, String> stringMap(String key) {
            Object value = values.get(key);
            if (value == null) {
                return null;
            }
            if (!(value instanceof Map<?, ?> map)) {
                throw invalid(key, "must be a mapping");
            }
            Map<String, String> result = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                if (k == null || v == null) {
                    throw invalid(key, "cannot contain null keys or values");
                }
                result.put(k.toString(), v.toString());
            });
            return result;
        }

        private InvalidPayloadException invalid(String key, String problem) {
            return new InvalidPayloadException(describe() + ": '" + key + "' " + problem);
        }
    }
}
