package se.chronotrust_be.pojo.enums;

import lombok.Getter;

@Getter
public enum EvaluatorTier {
    STANDARD(0),
    SENIOR(1),
    MASTER(2);

    private final int level;

    EvaluatorTier(int level) {
        this.level = level;
    }

}
