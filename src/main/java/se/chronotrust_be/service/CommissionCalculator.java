package se.chronotrust_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import se.chronotrust_be.configuration.CommissionProperties;
import se.chronotrust_be.exception.InvalidAmountException;
import se.chronotrust_be.pojo.Money;
import se.chronotrust_be.pojo.SettlementBreakdown;
import se.chronotrust_be.pojo.enums.EvaluatorTier;

import java.math.BigDecimal;

@Service
@RequiredArgsConstructor
@Slf4j
public class CommissionCalculator {

    private final CommissionProperties commissionProperties;

    public BigDecimal rateFor(EvaluatorTier tier) {
        BigDecimal rate = tier == null ? null : commissionProperties.getRates().get(tier);
        if (rate == null) {
            log.debug("No commission rate configured for tier {}, using default {}", tier, commissionProperties.getDefaultRate());
            return commissionProperties.getDefaultRate();
        }
        return rate;
    }

    /**
     * Splits {@code gross} into seller, platform and evaluator amounts. The commission is rounded
     * half up to the currency's minor unit; the evaluator share of it is rounded the same way and
     * the platform receives the remainder, so the three parts always add back to {@code gross}.
     */
    public SettlementBreakdown breakdown(Money gross, BigDecimal rate, boolean evaluatorParticipates) {
        if (rate == null || rate.signum() < 0 || rate.compareTo(BigDecimal.ONE) > 0) {
            throw new InvalidAmountException("Commission rate must be between 0 and 1, got " + rate);
        }

        Money commission = gross.multiply(rate);
        Money evaluatorShare = evaluatorParticipates
                ? commission.multiply(commissionProperties.getEvaluatorShare())
                : Money.zero(gross.getCurrency());
        Money platformShare = commission.subtract(evaluatorShare);

        return SettlementBreakdown.builder()
                .gross(gross)
                .rate(rate)
                .commission(commission)
                .platformShare(platformShare)
                .evaluatorShare(evaluatorShare)
                .sellerAmount(gross.subtract(commission))
                .build();
    }
}
