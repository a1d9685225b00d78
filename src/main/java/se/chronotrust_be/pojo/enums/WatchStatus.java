package se.chronotrust_be.pojo.enums;

public enum WatchStatus {
    LISTED,     // Available for a purchase intent
    IN_ESCROW,  // Buyer funds held, evaluation not finished
    EVALUATED,  // Certified, waiting for tokenization
    TOKENIZED,  // Chain record issued to the buyer, settlement pending
    SOLD,       // Settlement completed, owner reassigned
    DELISTED;

    public boolean isOpenForPurchase() {
        return this == LISTED;
    }

    public boolean isLocked() {
        return this == IN_ESCROW || this == EVALUATED || this == TOKENIZED;
    }
}
