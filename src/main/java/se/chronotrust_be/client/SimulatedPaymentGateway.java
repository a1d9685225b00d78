package se.chronotrust_be.client;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import se.chronotrust_be.exception.InsufficientFundsException;
import se.chronotrust_be.exception.InvalidRequestException;
import se.chronotrust_be.exception.InvalidStateException;
import se.chronotrust_be.pojo.Money;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ledger-backed payment stand-in. Accounts are opened lazily with the configured opening balance.
 */
@Component
@ConditionalOnProperty(name = "chronotrust.payment.mode", havingValue = "simulated", matchIfMissing = true)
@Slf4j
public class SimulatedPaymentGateway implements PaymentGateway {

    private final Map<String, BigDecimal> balances = new HashMap<>();
    private final Map<String, HeldFunds> holds = new HashMap<>();
    private final Set<String> processedKeys = new HashSet<>();
    private final BigDecimal openingBalance;

    public SimulatedPaymentGateway(@Value("${chronotrust.payment.simulated.opening-balance:0}") BigDecimal openingBalance) {
        this.openingBalance = openingBalance;
    }

    @Override
    public synchronized void hold(String holdReference, String payerAccount, Money amount) {
        if (holds.containsKey(holdReference)) {
            log.info("Hold {} already placed", holdReference);
            return;
        }
        BigDecimal balance = balanceOf(payerAccount);
        if (balance.compareTo(amount.getAmount()) < 0) {
            throw new InsufficientFundsException("Account " + payerAccount + " cannot cover " + amount);
        }
        balances.put(payerAccount, balance.subtract(amount.getAmount()));
        holds.put(holdReference, new HeldFunds(payerAccount, amount));
        log.info("Held {} from {} under {}", amount, payerAccount, holdReference);
    }

    @Override
    public synchronized void release(String idempotencyKey, String holdReference, List<Disbursement> disbursements) {
        if (processedKeys.contains(idempotencyKey)) {
            log.info("Release {} already posted", idempotencyKey);
            return;
        }
        HeldFunds held = openHold(holdReference);

        Money total = Money.zero(held.getAmount().getCurrency());
        for (Disbursement leg : disbursements) {
            total = total.add(leg.getAmount());
        }
        if (!total.equals(held.getAmount())) {
            throw new InvalidRequestException("Disbursements " + total + " do not match held " + held.getAmount());
        }

        // all legs validated above, post them together
        for (Disbursement leg : disbursements) {
            credit(leg.getAccount(), leg.getAmount().getAmount());
        }
        holds.remove(holdReference);
        processedKeys.add(idempotencyKey);
        log.info("Released hold {} in {} legs", holdReference, disbursements.size());
    }

    @Override
    public synchronized void refund(String idempotencyKey, String holdReference, String payerAccount) {
        if (processedKeys.contains(idempotencyKey)) {
            log.info("Refund {} already posted", idempotencyKey);
            return;
        }
        HeldFunds held = openHold(holdReference);
        if (!held.getPayerAccount().equals(payerAccount)) {
            throw new InvalidRequestException("Hold " + holdReference + " was not placed by " + payerAccount);
        }
        credit(payerAccount, held.getAmount().getAmount());
        holds.remove(holdReference);
        processedKeys.add(idempotencyKey);
        log.info("Refunded {} to {} from hold {}", held.getAmount(), payerAccount, holdReference);
    }

    public synchronized BigDecimal balanceOf(String account) {
        return balances.computeIfAbsent(account, key -> openingBalance);
    }

    public synchronized void credit(String account, BigDecimal amount) {
        balances.put(account, balanceOf(account).add(amount));
    }

    private HeldFunds openHold(String holdReference) {
        HeldFunds held = holds.get(holdReference);
        if (held == null) {
            throw new InvalidStateException("No open hold " + holdReference);
        }
        return held;
    }

    @Getter
    @AllArgsConstructor
    private static class HeldFunds {
        private final String payerAccount;
        private final Money amount;
    }
}
