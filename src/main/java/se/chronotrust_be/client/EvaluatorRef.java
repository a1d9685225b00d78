package se.chronotrust_be.client;

import lombok.Builder;
import lombok.Value;
import se.chronotrust_be.pojo.enums.EvaluatorTier;

@Value
@Builder
public class EvaluatorRef {
    Long evaluatorId;
    EvaluatorTier tier;
}
