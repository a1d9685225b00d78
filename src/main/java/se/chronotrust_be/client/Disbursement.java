package se.chronotrust_be.client;

import lombok.Builder;
import lombok.Value;
import se.chronotrust_be.pojo.Money;

/**
 * One leg of a payout. All legs of a payout post together or none do.
 */
@Value
@Builder
public class Disbursement {
    String account;
    Money amount;
    String purpose;
}
