package se.chronotrust_be.client;

import se.chronotrust_be.exception.InsufficientFundsException;
import se.chronotrust_be.exception.PaymentUnavailableException;
import se.chronotrust_be.pojo.Money;

import java.util.List;

/**
 * Payment processor primitives. Every call carries an idempotency key; repeating a call with the
 * same key has no further effect.
 */
public interface PaymentGateway {

    /**
     * Reserves {@code amount} from the payer under {@code holdReference}.
     *
     * @throws InsufficientFundsException  when the payer cannot cover the amount
     * @throws PaymentUnavailableException when the processor cannot be reached
     */
    void hold(String holdReference, String payerAccount, Money amount);

    /**
     * Splits the held amount across the given legs in a single atomic posting.
     */
    void release(String idempotencyKey, String holdReference, List<Disbursement> disbursements);

    /**
     * Returns the full held amount to the payer.
     */
    void refund(String idempotencyKey, String holdReference, String payerAccount);
}
