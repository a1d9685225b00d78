package se.chronotrust_be.pojo;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * How a held amount splits at payout: {@code sellerAmount + platformShare + evaluatorShare == gross}.
 */
@Value
@Builder
public class SettlementBreakdown {
    Money gross;
    BigDecimal rate;
    Money commission;
    Money platformShare;
    Money evaluatorShare;
    Money sellerAmount;
}
