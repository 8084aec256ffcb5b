package com.ryuqq.dealstore.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Pipeline stage of a {@link Deal}.
 *
 * <p>Each stage carries a display name (the form written to the durable file and shown
 * to users) and a default win probability used when a deal has no explicit probability.</p>
 *
 * <p><strong>Stage Flow:</strong></p>
 * <pre>
 * LEAD → QUALIFIED → DISCOVERY → PROPOSAL → NEGOTIATION → CLOSED_WON
 *                                                      ↘ CLOSED_LOST
 * (ON_HOLD / OTHER may be entered from any open stage)
 * </pre>
 *
 * <p><strong>Parsing Rules:</strong></p>
 * <ul>
 *   <li>Case, spaces, hyphens and underscores are ignored ("closed-won" = "Closed Won")</li>
 *   <li>"won", "lost" and "hold" are accepted as short forms</li>
 *   <li>{@link #parse(String)}: blank → LEAD, unrecognized → OTHER</li>
 *   <li>{@link #tryParse(String)}: unrecognized → empty</li>
 * </ul>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public enum DealStage {

    LEAD("Lead", 10),
    QUALIFIED("Qualified", 20),
    DISCOVERY("Discovery", 40),
    PROPOSAL("Proposal", 60),
    NEGOTIATION("Negotiation", 80),
    CLOSED_WON("Closed Won", 100),
    CLOSED_LOST("Closed Lost", 0),
    ON_HOLD("On Hold", 10),
    OTHER("Other", 10);

    private final String displayName;
    private final int defaultProbability;

    DealStage(String displayName, int defaultProbability) {
        this.displayName = displayName;
        this.defaultProbability = defaultProbability;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getDefaultProbability() {
        return defaultProbability;
    }

    /**
     * 종결 단계 여부.
     *
     * @return CLOSED_WON 또는 CLOSED_LOST이면 true
     */
    public boolean isClosed() {
        return this == CLOSED_WON || this == CLOSED_LOST;
    }

    /**
     * Parses free text leniently.
     *
     * @param text stage text, may be null
     * @return LEAD for blank input, OTHER for unrecognized input
     */
    public static DealStage parse(String text) {
        if (text == null || text.isBlank()) {
            return LEAD;
        }
        return tryParse(text).orElse(OTHER);
    }

    /**
     * Parses free text strictly.
     *
     * @param text stage text, may be null
     * @return the matching stage, or empty if the text names no stage
     */
    public static Optional<DealStage> tryParse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String key = text.replace(" ", "")
            .replace("-", "")
            .replace("_", "")
            .toLowerCase(Locale.ROOT);
        switch (key) {
            case "lead":
                return Optional.of(LEAD);
            case "qualified":
                return Optional.of(QUALIFIED);
            case "discovery":
                return Optional.of(DISCOVERY);
            case "proposal":
                return Optional.of(PROPOSAL);
            case "negotiation":
                return Optional.of(NEGOTIATION);
            case "closedwon":
            case "won":
                return Optional.of(CLOSED_WON);
            case "closedlost":
            case "lost":
                return Optional.of(CLOSED_LOST);
            case "onhold":
            case "hold":
                return Optional.of(ON_HOLD);
            case "other":
                return Optional.of(OTHER);
            default:
                return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return displayName;
    }
}
