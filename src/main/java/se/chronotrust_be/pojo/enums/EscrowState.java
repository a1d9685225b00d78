package se.chronotrust_be.pojo.enums;

import lombok.Getter;

@Getter
public enum EscrowState {
    FUNDED(false),
    AWAITING_EVALUATION(false),
    APPROVED(false),
    REJECTED(false),
    RELEASED(true),
    REFUNDED(true),
    EXPIRED(true);

    private final boolean terminal;

    EscrowState(boolean terminal) {
        this.terminal = terminal;
    }

    /**
     * States the expiry sweep may act on. Approved and rejected contracts already carry an
     * evaluation outcome, which wins over the deadline.
     */
    public boolean isExpirable() {
        return this == FUNDED || this == AWAITING_EVALUATION;
    }

    public boolean canTransitionTo(EscrowState next) {
        return switch (this) {
            case FUNDED -> next == AWAITING_EVALUATION || next == EXPIRED;
            case AWAITING_EVALUATION -> next == APPROVED || next == REJECTED || next == EXPIRED;
            case APPROVED -> next == RELEASED;
            case REJECTED -> next == REFUNDED;
            case RELEASED, REFUNDED, EXPIRED -> false;
        };
    }
}
