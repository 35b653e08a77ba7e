package com.gillianbc.planner.dispatch;

/**
 * Message kinds exchanged with the compute context, with the names they travel under.
 */
public enum MessageType {
    RUN("run"),
    PROGRESS("progress"),
    COMPLETE("complete"),
    ERROR("error"),
    LEGACY("legacy"),
    LEGACY_COMPLETE("legacy-complete"),
    GUARDRAILS("guardrails"),
    GUARDRAILS_COMPLETE("guardrails-complete"),
    ROTH_OPTIMIZER("roth-optimizer"),
    ROTH_OPTIMIZER_COMPLETE("roth-optimizer-complete");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return the success response a request of this type is answered with
     * @throws IllegalStateException if this is not a request type
     */
    public MessageType completion() {
        switch (this) {
            case RUN:
                return COMPLETE;
            case LEGACY:
                return LEGACY_COMPLETE;
            case GUARDRAILS:
                return GUARDRAILS_COMPLETE;
            case ROTH_OPTIMIZER:
                return ROTH_OPTIMIZER_COMPLETE;
            default:
                throw new IllegalStateException(wireName + " is not a request type");
        }
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR || this == LEGACY_COMPLETE
                || this == GUARDRAILS_COMPLETE || this == ROTH_OPTIMIZER_COMPLETE;
    }
}
