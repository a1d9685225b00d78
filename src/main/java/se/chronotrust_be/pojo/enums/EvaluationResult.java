package se.chronotrust_be.pojo.enums;

public enum EvaluationResult {
    PENDING,
    CERTIFIED,
    REJECTED;

    public boolean isFinal() {
        return this != PENDING;
    }
}
