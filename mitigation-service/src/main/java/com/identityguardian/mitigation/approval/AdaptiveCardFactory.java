package com.identityguardian.mitigation.approval;

import com.identityguardian.common.model.MitigationAction;
import com.identityguardian.common.model.MitigationKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds Teams adaptive cards and the Bot Framework activity that carries them. Submit actions
 * put their payload under {@code data}, which Teams echoes back as {@code value.data}.
 */
@Component
public class AdaptiveCardFactory {

    static final String CARD_VERSION = "1.5";
    static final String CARD_CONTENT_TYPE = "application/vnd.microsoft.card.adaptive";

    public Map<String, Object> investigationCard(MitigationAction action) {
        List<Map<String, Object>> body = new ArrayList<>();
        body.add(heading("INVESTIGATE USER", "Warning"));
        body.add(text("User: " + action.principalId()));
        body.add(text("Risk: " + action.compositeScore() + "/100"));
        body.add(wrapped("Reason: " + action.reason()));
        body.add(wrapped("Action taken: " + describe(action.kind())
            + (action.directorySucceeded() ? "" : " (FAILED)") + ". " + action.directoryMessage()));
        body.add(small("Token: " + action.correlationToken()));

        return card(body, List.of(
            submit("Re-enable User", Map.of(
                "action", "re_enable", "user_id", action.principalId(), "token", action.correlationToken())),
            submit("Keep Blocked", Map.of(
                "action", "keep_blocked", "user_id", action.principalId(), "token", action.correlationToken()))));
    }

    public Map<String, Object> highRiskAlertCard(MitigationAction action) {
        return card(List.of(
            heading("HIGH RISK USER BLOCKED", "Attention"),
            text("User: " + action.principalId()),
            text("Risk Score: " + action.compositeScore() + "/100"),
            wrapped("Reason: " + action.reason())), List.of());
    }

    public Map<String, Object> restorationCard(String principalId, String outcome) {
        return card(List.of(
            heading("ACCESS RESTORED", "Good"),
            text("User: " + principalId),
            wrapped(outcome)), List.of());
    }

    public Map<String, Object> privilegedAccessCard(PrivilegedAccessRequest request) {
        return card(List.of(
            heading("PIM Access Request", "Default"),
            text("User: " + request.principalId()),
            text("Resource: " + request.resource()),
            wrapped("Justification: " + request.justification()),
            small("Request ID: " + request.requestId())),
            List.of(
                submit("Approve", Map.of("action", "approve", "request_id", request.requestId())),
                submit("Reject", Map.of("action", "reject", "request_id", request.requestId()))));
    }

    /** Bot Framework message activity with the card as its only attachment. */
    public Map<String, Object> activity(String botId, String conversationId, Map<String, Object> card) {
        Map<String, Object> activity = new LinkedHashMap<>();
        activity.put("type", "message");
        activity.put("from", Map.of("id", botId));
        activity.put("conversation", Map.of("id", conversationId));
        activity.put("recipient", Map.of("id", conversationId));
        activity.put("attachments", List.of(Map.of("contentType", CARD_CONTENT_TYPE, "content", card)));
        return activity;
    }

    // ── private ───────────────────────────────────────────────────────────────

    private static Map<String, Object> card(List<Map<String, Object>> body, List<Map<String, Object>> actions) {
        Map<String, Object> card = new LinkedHashMap<>();
        card.put("type", "AdaptiveCard");
        card.put("version", CARD_VERSION);
        card.put("body", body);
        if (!actions.isEmpty()) {
            card.put("actions", actions);
        }
        return card;
    }

    private static Map<String, Object> heading(String value, String color) {
        return Map.of("type", "TextBlock", "text", value, "weight", "Bolder", "size", "Large", "color", color);
    }

    private static Map<String, Object> text(String value) {
        return Map.of("type", "TextBlock", "text", value);
    }

    private static Map<String, Object> wrapped(String value) {
        return Map.of("type", "TextBlock", "text", value, "wrap", true);
    }

    private static Map<String, Object> small(String value) {
        return Map.of("type", "TextBlock", "text", value, "size", "Small");
    }

    private static Map<String, Object> submit(String title, Map<String, Object> data) {
        return Map.of("type", "Action.Submit", "title", title, "data", data);
    }

    private static String describe(MitigationKind kind) {
        return switch (kind) {
            case CONDITIONAL_ACCESS_BLOCK -> "Conditional access block";
            case DISABLE                  -> "Account disabled";
            case MONITOR                  -> "Monitoring only";
        };
    }
}
