package se.chronotrust_be.pojo.enums;

public enum HoldStatus {
    HELD,       // Funds reserved from the buyer
    RELEASED,   // Paid out to seller and commission beneficiaries
    REFUNDED    // Returned in full to the payer
}
