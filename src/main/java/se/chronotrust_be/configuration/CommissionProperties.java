package se.chronotrust_be.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import se.chronotrust_be.pojo.enums.EvaluatorTier;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "chronotrust.commission")
public class CommissionProperties {

    /**
     * Commission rate applied to the held amount, keyed by the tier of the certifying evaluator.
     */
    private Map<EvaluatorTier, BigDecimal> rates = new EnumMap<>(EvaluatorTier.class);

    /**
     * Rate used when a tier has no configured entry.
     */
    private BigDecimal defaultRate = new BigDecimal("0.0300");

    /**
     * Fraction of the commission paid to the evaluator; the remainder goes to the platform.
     */
    private BigDecimal evaluatorShare = BigDecimal.ZERO;
}
