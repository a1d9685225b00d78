package se.chronotrust_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.chronotrust_be.client.Disbursement;
import se.chronotrust_be.client.PaymentGateway;
import se.chronotrust_be.exception.InvalidAmountException;
import se.chronotrust_be.exception.InvalidRequestException;
import se.chronotrust_be.exception.InvalidStateException;
import se.chronotrust_be.exception.ResourceNotFoundException;
import se.chronotrust_be.pojo.Commission;
import se.chronotrust_be.pojo.FundHold;
import se.chronotrust_be.pojo.Money;
import se.chronotrust_be.pojo.SettlementBreakdown;
import se.chronotrust_be.pojo.enums.CommissionBeneficiary;
import se.chronotrust_be.pojo.enums.HoldStatus;
import se.chronotrust_be.repository.CommissionRepository;
import se.chronotrust_be.repository.FundHoldRepository;
import se.chronotrust_be.util.OperationRefs;
import se.chronotrust_be.util.PaymentAccounts;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Money movement for escrow contracts: holds, payouts with commission, refunds.
 * Payout and refund are keyed by the hold reference, so repeating either is harmless.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    private final PaymentGateway paymentGateway;
    private final FundHoldRepository fundHoldRepository;
    private final CommissionRepository commissionRepository;
    private final CommissionCalculator commissionCalculator;
    private final Clock clock;

    @Transactional
    public String hold(Money amount, Long payerId) {
        if (amount == null || !amount.isPositive()) {
            throw new InvalidAmountException("Hold amount must be greater than zero");
        }

        String holdReference = OperationRefs.newHoldReference();
        paymentGateway.hold(holdReference, PaymentAccounts.user(payerId), amount);

        fundHoldRepository.save(FundHold.builder()
                .holdReference(holdReference)
                .payerId(payerId)
                .amount(amount)
                .status(HoldStatus.HELD)
                .build());

        log.info("Held {} for payer {} under {}", amount, payerId, holdReference);
        return holdReference;
    }

    @Transactional
    public SettlementBreakdown payout(String holdReference, Long sellerId, BigDecimal commissionRate,
                                      Long contractId, Long evaluatorId) {
        FundHold hold = loadHold(holdReference);

        switch (hold.getStatus()) {
            case RELEASED -> {
                log.info("Hold {} already paid out, returning recorded breakdown", holdReference);
                return commissionRepository.findByHoldReference(holdReference)
                        .map(this::toBreakdown)
                        .orElseThrow(() -> new InvalidStateException("Hold " + holdReference + " released without a commission record"));
            }
            case REFUNDED -> throw new InvalidStateException("Hold " + holdReference + " was refunded and cannot be paid out");
            case HELD -> log.info("Paying out hold {} to seller {} at rate {}", holdReference, sellerId, commissionRate);
        }

        SettlementBreakdown breakdown = commissionCalculator.breakdown(hold.getAmount(), commissionRate, evaluatorId != null);
        String settlementKey = OperationRefs.payout(holdReference);

        paymentGateway.release(settlementKey, holdReference, disbursements(breakdown, sellerId, evaluatorId));

        hold.setStatus(HoldStatus.RELEASED);
        hold.setSettlementKey(settlementKey);
        hold.setSettledAt(LocalDateTime.now(clock));
        fundHoldRepository.save(hold);

        commissionRepository.save(Commission.builder()
                .contractId(contractId)
                .holdReference(holdReference)
                .rate(commissionRate)
                .grossAmount(breakdown.getGross())
                .amount(breakdown.getCommission())
                .platformShare(breakdown.getPlatformShare())
                .evaluatorShare(breakdown.getEvaluatorShare())
                .sellerAmount(breakdown.getSellerAmount())
                .evaluatorId(evaluatorId)
                .beneficiary(breakdown.getEvaluatorShare().isGreaterThan(breakdown.getPlatformShare())
                        ? CommissionBeneficiary.EVALUATOR
                        : CommissionBeneficiary.PLATFORM)
                .build());

        log.info("Payout for hold {}: seller {} receives {}, commission {}",
                holdReference, sellerId, breakdown.getSellerAmount(), breakdown.getCommission());
        return breakdown;
    }

    @Transactional
    public Money refund(String holdReference, Long payerId) {
        FundHold hold = loadHold(holdReference);

        switch (hold.getStatus()) {
            case REFUNDED -> {
                log.info("Hold {} already refunded", holdReference);
                return hold.getAmount();
            }
            case RELEASED -> throw new InvalidStateException("Hold " + holdReference + " was paid out and cannot be refunded");
            case HELD -> {
                if (!hold.getPayerId().equals(payerId)) {
                    throw new InvalidRequestException("Hold " + holdReference + " does not belong to payer " + payerId);
                }
            }
        }

        String settlementKey = OperationRefs.refund(holdReference);
        paymentGateway.refund(settlementKey, holdReference, PaymentAccounts.user(payerId));

        hold.setStatus(HoldStatus.REFUNDED);
        hold.setSettlementKey(settlementKey);
        hold.setSettledAt(LocalDateTime.now(clock));
        fundHoldRepository.save(hold);

        log.info("Refunded {} to payer {} from hold {}", hold.getAmount(), payerId, holdReference);
        return hold.getAmount();
    }

    @Transactional(readOnly = true)
    public FundHold getHold(String holdReference) {
        return loadHold(holdReference);
    }

    @Transactional(readOnly = true)
    public Commission getCommission(Long contractId) {
        return commissionRepository.findByContractId(contractId)
                .orElseThrow(() -> new ResourceNotFoundException("No settlement recorded for contract " + contractId));
    }

    private FundHold loadHold(String holdReference) {
        return fundHoldRepository.findByHoldReference(holdReference)
                .orElseThrow(() -> new ResourceNotFoundException("Fund hold not found: " + holdReference));
    }

    private List<Disbursement> disbursements(SettlementBreakdown breakdown, Long sellerId, Long evaluatorId) {
        List<Disbursement> legs = new ArrayList<>();
        legs.add(Disbursement.builder()
                .account(PaymentAccounts.user(sellerId))
                .amount(breakdown.getSellerAmount())
                .purpose("seller-proceeds")
                .build());
        if (!breakdown.getPlatformShare().isZero()) {
            legs.add(Disbursement.builder()
                    .account(PaymentAccounts.PLATFORM)
                    .amount(breakdown.getPlatformShare())
                    .purpose("platform-commission")
                    .build());
        }
        if (evaluatorId != null && !breakdown.getEvaluatorShare().isZero()) {
            legs.add(Disbursement.builder()
                    .account(PaymentAccounts.evaluator(evaluatorId))
                    .amount(breakdown.getEvaluatorShare())
                    .purpose("evaluator-commission")
                    .build());
        }
        return legs;
    }

    private SettlementBreakdown toBreakdown(Commission commission) {
        return SettlementBreakdown.builder()
                .gross(commission.getGrossAmount())
                .rate(commission.getRate())
                .commission(commission.getAmount())
                .platformShare(commission.getPlatformShare())
                .evaluatorShare(commission.getEvaluatorShare())
                .sellerAmount(commission.getSellerAmount())
                .build();
    }
}
