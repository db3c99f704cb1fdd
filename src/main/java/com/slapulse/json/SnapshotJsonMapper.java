package com.slapulse.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.slapulse.model.AuditEntry;
import com.slapulse.model.Deal;
import com.slapulse.model.Note;
import com.slapulse.model.PipelineStatus;
import com.slapulse.model.Recommendation;
import com.slapulse.model.ReferralOrigin;
import com.slapulse.model.ReferralSnapshot;
import com.slapulse.model.RiskSummary;
import com.slapulse.model.SlaCarryForward;
import com.slapulse.model.SlaDuration;
import com.slapulse.model.SlaInsights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

/**
 * Maps referral documents as stored by the record system to snapshots, and
 * evaluation results back to JSON.
 *
 * Reading is lenient: unparseable timestamps become null and unknown statuses
 * become "no match". Writing is deterministic, so equal insights always render
 * to the same bytes.
 */
@Component
public class SnapshotJsonMapper {

    private static final Logger log = LoggerFactory.getLogger(SnapshotJsonMapper.class);

    // Timestamps outside [earliest, latest) are read as absent
    static final Instant EARLIEST_TIMESTAMP = Instant.parse("1970-01-01T00:00:00Z");
    static final Instant LATEST_TIMESTAMP = Instant.parse("2200-01-01T00:00:00Z");

    private final ObjectMapper objectMapper;

    @Autowired
    public SnapshotJsonMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ReferralSnapshot readSnapshot(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidSnapshotException("Referral document is not valid JSON", e);
        }
        return toSnapshot(root);
    }

    public ReferralSnapshot toSnapshot(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidSnapshotException("Referral document must be a JSON object");
        }
        String id = readId(root);
        if (id == null) {
            throw new InvalidSnapshotException("Referral document has no _id");
        }

        ReferralSnapshot.Builder builder = ReferralSnapshot.builder(id)
            .createdAt(readInstant(root, "createdAt", id))
            .status(readStatus(root, id))
            .statusLastUpdated(readInstant(root, "statusLastUpdated", id))
            .origin(ReferralOrigin.fromValue(text(root.get("origin"))))
            .agentAssigned(isAgentAssigned(root))
            .lenderAssigned(isPresent(root.get("lender")))
            .sla(readCarryForward(root.get("sla")));

        JsonNode daysInStatus = root.get("daysInStatus");
        if (daysInStatus != null && daysInStatus.isNumber()) {
            builder.daysInStatus(daysInStatus.asInt());
        }

        for (JsonNode note : elements(root.get("notes"))) {
            builder.note(new Note(readInstant(note, "createdAt", id)));
        }
        for (JsonNode payment : elements(root.get("payments"))) {
            builder.deal(new Deal(
                text(payment.get("status")),
                readInstant(payment, "createdAt", id),
                readInstant(payment, "updatedAt", id),
                readInstant(payment, "paidDate", id)));
        }
        for (JsonNode entry : elements(root.get("audit"))) {
            builder.audit(new AuditEntry(
                text(entry.get("field")),
                text(entry.get("newValue")),
                readInstant(entry, "timestamp", id)));
        }
        return builder.build();
    }

    public String writeInsights(SlaInsights insights) {
        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode durations = root.putArray("durations");
        for (SlaDuration duration : insights.durations()) {
            ObjectNode node = durations.addObject();
            node.put("key", duration.key().getKey());
            node.put("label", duration.label());
            node.put("minutes", duration.minutes());
            node.put("formatted", duration.formatted());
        }

        ArrayNode recommendations = root.putArray("recommendations");
        for (Recommendation recommendation : insights.recommendations()) {
            ObjectNode node = recommendations.addObject();
            node.put("id", recommendation.id());
            node.put("title", recommendation.title());
            node.put("message", recommendation.message());
            node.put("priority", wireValue(recommendation.priority()));
            node.put("category", wireValue(recommendation.category()));
            node.put("dueAt", recommendation.dueAt() != null ? recommendation.dueAt().toString() : null);
            node.put("supportingMetric", recommendation.supportingMetric());
        }

        RiskSummary risk = insights.riskSummary();
        ObjectNode riskNode = root.putObject("riskSummary");
        riskNode.put("level", wireValue(risk.level()));
        riskNode.put("headline", risk.headline());
        riskNode.put("detail", risk.detail());

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render SLA insights", e);
        }
    }

    /**
     * Parses a timestamp value: ISO-8601 text, epoch milliseconds, or a
     * {"$date": ...} wrapper. Returns null when absent, unparseable, or
     * outside [{@link #EARLIEST_TIMESTAMP}, {@link #LATEST_TIMESTAMP}).
     */
    Instant parseInstant(JsonNode value) {
        Instant parsed = parseRawInstant(value);
        if (parsed == null || parsed.isBefore(EARLIEST_TIMESTAMP) || !parsed.isBefore(LATEST_TIMESTAMP)) {
            return null;
        }
        return parsed;
    }

    private static Instant parseRawInstant(JsonNode value) {
        if (!isPresent(value)) {
            return null;
        }
        if (value.isObject() && value.has("$date")) {
            return parseRawInstant(value.get("$date"));
        }
        if (value.isIntegralNumber()) {
            return value.canConvertToLong() ? Instant.ofEpochMilli(value.asLong()) : null;
        }
        if (!value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        String text = value.asText().trim();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private Instant readInstant(JsonNode parent, String field, String referralId) {
        JsonNode value = parent.get(field);
        Instant parsed = parseInstant(value);
        if (parsed == null && isPresent(value)) {
            log.warn("Ignoring unparseable {} '{}' on referral {}", field, value, referralId);
        }
        return parsed;
    }

    private PipelineStatus readStatus(JsonNode root, String referralId) {
        String label = text(root.get("status"));
        PipelineStatus status = PipelineStatus.fromLabel(label);
        if (status == null && label != null) {
            log.warn("Unknown status '{}' on referral {}, treating as {}", label, referralId,
                PipelineStatus.NEW_LEAD.getLabel());
        }
        return status;
    }

    private SlaCarryForward readCarryForward(JsonNode sla) {
        if (sla == null || !sla.isObject()) {
            return SlaCarryForward.empty();
        }
        return new SlaCarryForward(
            longValue(sla.get("contractToCloseMinutes")),
            longValue(sla.get("closedToPaidMinutes")),
            longValue(sla.get("previousContractToCloseMinutes")),
            longValue(sla.get("previousClosedToPaidMinutes")));
    }

    private static String readId(JsonNode root) {
        JsonNode id = root.has("_id") ? root.get("_id") : root.get("id");
        if (id != null && id.isObject() && id.has("$oid")) {
            id = id.get("$oid");
        }
        String text = text(id);
        return text == null || text.isBlank() ? null : text;
    }

    private static boolean isAgentAssigned(JsonNode root) {
        JsonNode agent = root.get("assignedAgent");
        if (agent != null && agent.isTextual() && !agent.asText().isBlank()) {
            return true;
        }
        if (agent != null && agent.isObject()
            && (hasText(agent.get("name")) || hasText(agent.get("fullName")))) {
            return true;
        }
        return hasText(root.get("assignedAgentName"));
    }

    private static boolean isPresent(JsonNode value) {
        return value != null && !value.isNull() && !value.isMissingNode();
    }

    private static boolean hasText(JsonNode value) {
        String text = text(value);
        return text != null && !text.isBlank();
    }

    private static String text(JsonNode value) {
        return isPresent(value) && value.isValueNode() ? value.asText() : null;
    }

    private static Long longValue(JsonNode value) {
        return isPresent(value) && value.isNumber() && value.canConvertToLong() ? value.asLong() : null;
    }

    private static Iterable<JsonNode> elements(JsonNode array) {
        if (array == null || !array.isArray()) {
            return List.of();
        }
        return array;
    }

    private static String wireValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
