package dev.issuehook.reconcile;

import dev.issuehook.domain.enums.IssueAction;
import dev.issuehook.domain.enums.IssueState;
import dev.issuehook.domain.valueobject.IssueEvent;
import dev.issuehook.domain.valueobject.IssueRecord;
import dev.issuehook.domain.valueobject.LabelDescriptor;
import dev.issuehook.domain.valueobject.UserDescriptor;
import dev.issuehook.exception.MalformedPayloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Maps a GitHub {@code issues} webhook payload to an {@link IssueEvent}.
 *
 * <p>Only {@code issue.id}, {@code issue.number}, the repository name and
 * {@code issue.state} are required. Labels and assignees are decoded leniently: they may be an array of
 * objects, an array of names, or either of those JSON-encoded in a string. A
 * list that cannot be decoded becomes empty and the event is still processed.
 */
@Component
public class IssueEventMapper {
    private static final Logger log = LoggerFactory.getLogger(IssueEventMapper.class);
    private static final String REPOS_SEGMENT = "/repos/";

    private final ObjectMapper objectMapper;

    public IssueEventMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public IssueEvent map(String rawPayload) {
        if (rawPayload == null || rawPayload.isBlank())
            throw new MalformedPayloadException("Empty payload");
        JsonNode payload;
        try {
            payload = objectMapper.readTree(rawPayload);
        } catch (JacksonException e) {
            throw new MalformedPayloadException("Payload is not valid JSON: " + e.getMessage(), e);
        }
        return map(payload);
    }

    public IssueEvent map(JsonNode payload) {
        if (payload == null || !payload.isObject())
            throw new MalformedPayloadException("Payload must be a JSON object");

        JsonNode issue = payload.path("issue");
        if (!issue.isObject())
            throw new MalformedPayloadException("Missing issue object");

        IssueRecord record = IssueRecord.builder()
                .issueId(requireId(issue.path("id")))
                .issueNumber(requireNumber(issue.path("number")))
                .repositoryName(requireRepositoryName(payload, issue))
                .title(optionalString(issue.path("title")))
                .body(optionalString(issue.path("body")))
                .authorLogin(optionalString(issue.path("user").path("login")))
                .state(requireState(issue.path("state")))
                .stateReason(optionalString(issue.path("state_reason")))
                .locked(issue.path("locked").isBoolean() && issue.path("locked").booleanValue())
                .labels(decodeList(issue.path("labels"), "labels", this::toLabel))
                .assignees(decodeList(issue.path("assignees"), "assignees", this::toUser))
                .htmlUrl(optionalString(issue.path("html_url")))
                .commentCount(optionalInt(issue.path("comments")))
                .createdAt(optionalInstant(issue.path("created_at")))
                .updatedAt(optionalInstant(issue.path("updated_at")))
                .closedAt(optionalInstant(issue.path("closed_at")))
                .build();

        IssueAction action = IssueAction.fromWire(optionalString(payload.path("action")));
        return new IssueEvent(action, record);
    }

    // ── Required fields ───────────────────────────────────────────

    private long requireId(JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToLong()) return node.longValue();
        if (node.isString()) {
            try {
                return Long.parseLong(node.asString().trim());
            } catch (NumberFormatException e) {
                throw new MalformedPayloadException("issue.id is not numeric: " + node.asString(), e);
            }
        }
        throw new MalformedPayloadException(node.isMissingNode() || node.isNull()
                ? "Missing issue.id" : "issue.id has wrong type: " + node.getNodeType());
    }

    private int requireNumber(JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToInt() && node.intValue() > 0) return node.intValue();
        throw new MalformedPayloadException(node.isMissingNode() || node.isNull()
                ? "Missing issue.number" : "issue.number is not a positive integer: " + node);
    }

    private String requireRepositoryName(JsonNode payload, JsonNode issue) {
        JsonNode fullName = payload.path("repository").path("full_name");
        if (fullName.isString() && !fullName.asString().isBlank()) return fullName.asString();

        // issue.repository_url is https://api.github.com/repos/{owner}/{name}
        String url = optionalString(issue.path("repository_url"));
        if (url != null) {
            int idx = url.indexOf(REPOS_SEGMENT);
            if (idx >= 0 && url.length() > idx + REPOS_SEGMENT.length())
                return url.substring(idx + REPOS_SEGMENT.length());
        }
        throw new MalformedPayloadException("Missing repository.full_name");
    }

    private IssueState requireState(JsonNode node) {
        if (!node.isString())
            throw new MalformedPayloadException(node.isMissingNode() || node.isNull()
                    ? "Missing issue.state" : "issue.state has wrong type: " + node.getNodeType());
        return IssueState.fromWire(node.asString())
                .orElseThrow(() -> new MalformedPayloadException("Unknown issue.state: " + node.asString()));
    }

    // ── Optional fields ───────────────────────────────────────────

    private static String optionalString(JsonNode node) {
        return node.isString() ? node.asString() : null;
    }

    private static int optionalInt(JsonNode node) {
        return node.isIntegralNumber() && node.canConvertToInt() ? node.intValue() : 0;
    }

    private static Instant optionalInstant(JsonNode node) {
        if (!node.isString()) return null;
        try {
            return Instant.parse(node.asString());
        } catch (DateTimeParseException e) {
            log.warn("Failed to parse timestamp: {}", node.asString());
            return null;
        }
    }

    // ── Label / assignee decoding ─────────────────────────────────

    /**
     * Decodes a list field. Missing or null is an empty list without a warning;
     * anything undecodable is an empty list with one.
     */
    private <T> List<T> decodeList(JsonNode node, String field, Function<JsonNode, T> element) {
        if (node.isMissingNode() || node.isNull()) return List.of();
        try {
            JsonNode array = node.isString() ? objectMapper.readTree(node.asString()) : node;
            if (array == null || array.isNull()) return List.of();
            if (!array.isArray())
                throw new IllegalArgumentException("expected an array but got " + array.getNodeType());
            List<T> result = new ArrayList<>(array.size());
            for (JsonNode item : array) {
                result.add(element.apply(item));
            }
            return result;
        } catch (JacksonException | IllegalArgumentException e) {
            log.warn("Could not decode issue {}, treating as empty: {}", field, e.getMessage());
            return List.of();
        }
    }

    private LabelDescriptor toLabel(JsonNode node) {
        if (node.isString()) return LabelDescriptor.named(node.asString());
        if (!node.isObject()) throw new IllegalArgumentException("label must be an object or a name");
        return new LabelDescriptor(
                node.path("id").isIntegralNumber() ? node.path("id").longValue() : null,
                optionalString(node.path("name")),
                optionalString(node.path("color")),
                optionalString(node.path("description")));
    }

    private UserDescriptor toUser(JsonNode node) {
        if (node.isString()) return UserDescriptor.login(node.asString());
        if (!node.isObject()) throw new IllegalArgumentException("assignee must be an object or a login");
        return new UserDescriptor(
                node.path("id").isIntegralNumber() ? node.path("id").longValue() : null,
                optionalString(node.path("login")));
    }
}
