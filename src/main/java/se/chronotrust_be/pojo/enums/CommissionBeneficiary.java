package se.chronotrust_be.pojo.enums;

public enum CommissionBeneficiary {
    PLATFORM,
    EVALUATOR
}
