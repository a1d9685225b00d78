package se.chronotrust_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.chronotrust_be.dto.request.OpenEscrowRequest;
import se.chronotrust_be.exception.ConflictException;
import se.chronotrust_be.exception.InvalidAmountException;
import se.chronotrust_be.exception.InvalidRequestException;
import se.chronotrust_be.exception.InvalidStateException;
import se.chronotrust_be.exception.LifecycleException;
import se.chronotrust_be.exception.ResourceNotFoundException;
import se.chronotrust_be.pojo.EscrowContract;
import se.chronotrust_be.pojo.Evaluation;
import se.chronotrust_be.pojo.FundHold;
import se.chronotrust_be.pojo.Money;
import se.chronotrust_be.pojo.SettlementBreakdown;
import se.chronotrust_be.pojo.TokenRecord;
import se.chronotrust_be.pojo.Watch;
import se.chronotrust_be.pojo.enums.DeliveryParty;
import se.chronotrust_be.pojo.enums.EscrowState;
import se.chronotrust_be.pojo.enums.EvaluationResult;
import se.chronotrust_be.pojo.enums.HoldStatus;
import se.chronotrust_be.repository.EscrowContractRepository;
import se.chronotrust_be.repository.EvaluationRepository;
import se.chronotrust_be.repository.WatchRepository;
import se.chronotrust_be.util.StellarKeys;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Orchestrates an escrow contract from funding to release, refund or expiry.
 * <p>
 * Every state change goes through {@link EscrowContractStore} with the version read at the start of
 * the operation. Calls to the chain and payment collaborators run between store transactions, after
 * the contract has been claimed, so a slow collaborator never holds a database lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowContractService {

    private final EscrowContractStore store;
    private final EscrowContractRepository contractRepository;
    private final WatchRepository watchRepository;
    private final EvaluationRepository evaluationRepository;
    private final TokenizationService tokenizationService;
    private final SettlementService settlementService;
    private final CommissionCalculator commissionCalculator;
    private final RetryTemplate retryTemplate;
    private final Clock clock;

    public EscrowContract openEscrow(OpenEscrowRequest request) {
        Money amount = toMoney(request);
        if (!amount.isPositive()) {
            throw new InvalidAmountException("Escrow amount must be greater than zero");
        }
        if (request.getDeadline() == null || !request.getDeadline().isAfter(LocalDateTime.now(clock))) {
            throw new InvalidRequestException("Escrow deadline must be in the future");
        }
        if (request.getBuyerId().equals(request.getSellerId())) {
            throw new InvalidRequestException("Buyer and seller must be different users");
        }
        if (request.getBuyerChainKey() == null || request.getBuyerChainKey().isBlank()) {
            throw new InvalidRequestException("Buyer chain key is required");
        }

        Watch watch = watchRepository.findById(request.getWatchId())
                .orElseThrow(() -> new ResourceNotFoundException("Watch not found with ID: " + request.getWatchId()));
        if (contractRepository.existsByActiveWatchKey(watch.getWatchId())) {
            throw new ConflictException("Watch " + watch.getWatchId() + " already has an active escrow contract");
        }
        if (!watch.getStatus().isOpenForPurchase()) {
            throw new InvalidStateException("Watch " + watch.getWatchId() + " is not open for purchase (status "
                    + watch.getStatus() + ")");
        }
        if (!watch.getOwnerId().equals(request.getSellerId())) {
            throw new InvalidStateException("Seller " + request.getSellerId() + " does not own watch " + watch.getWatchId());
        }

        String holdReference = settlementService.hold(amount, request.getBuyerId());

        EscrowContract draft = EscrowContract.builder()
                .watchId(watch.getWatchId())
                .activeWatchKey(watch.getWatchId())
                .buyerId(request.getBuyerId())
                .buyerChainKey(request.getBuyerChainKey().trim())
                .sellerId(request.getSellerId())
                .heldAmount(amount)
                .holdReference(holdReference)
                .state(EscrowState.FUNDED)
                .deadline(request.getDeadline())
                .build();

        try {
            EscrowContract opened = store.open(draft, watch.getVersion());
            log.info("Opened escrow contract {} for watch {}: buyer {} holds {}",
                    opened.getContractId(), watch.getWatchId(), opened.getBuyerId(), amount);
            return opened;
        } catch (RuntimeException e) {
            log.warn("Escrow for watch {} could not be persisted, releasing hold {}: {}",
                    watch.getWatchId(), holdReference, e.getMessage());
            try {
                settlementService.refund(holdReference, request.getBuyerId());
            } catch (RuntimeException refundFailure) {
                log.error("Refund of orphaned hold {} failed", holdReference, refundFailure);
                e.addSuppressed(refundFailure);
            }
            throw e;
        }
    }

    @Transactional
    public EscrowContract beginEvaluation(Long contractId, Long evaluationId) {
        EscrowContract contract = store.load(contractId);
        if (contract.getState() != EscrowState.FUNDED) {
            throw new InvalidStateException("Contract " + contractId + " cannot start evaluation from " + contract.getState());
        }
        EscrowContract updated = store.apply(contractId, contract.getStateVersion(), c -> {
            c.moveTo(EscrowState.AWAITING_EVALUATION);
            c.setEvaluationId(evaluationId);
        });
        log.info("Contract {} awaiting evaluation {}", contractId, evaluationId);
        return updated;
    }

    @Transactional
    public EscrowContract submitEvaluation(Long contractId, Long evaluationId, EvaluationResult result) {
        EscrowContract contract = store.load(contractId);
        if (contract.getState() != EscrowState.AWAITING_EVALUATION) {
            throw new InvalidStateException("Contract " + contractId + " is not awaiting evaluation (state "
                    + contract.getState() + ")");
        }
        if (!evaluationId.equals(contract.getEvaluationId())) {
            throw new InvalidRequestException("Evaluation " + evaluationId + " is not assigned to contract " + contractId);
        }

        EscrowState target = switch (result) {
            case CERTIFIED -> EscrowState.APPROVED;
            case REJECTED -> EscrowState.REJECTED;
            case PENDING -> throw new InvalidRequestException("A pending evaluation cannot be submitted");
        };

        EscrowContract updated = store.apply(contractId, contract.getStateVersion(), c -> c.moveTo(target));
        log.info("Contract {} moved to {} after evaluation {}", contractId, target, evaluationId);
        return updated;
    }

    /**
     * Records that the seller handed the watch over or the buyer received it. Allowed in any
     * non-terminal state; confirming twice returns the contract unchanged.
     */
    public EscrowContract confirmDelivery(Long contractId, DeliveryParty party, Long userId) {
        if (party == null || userId == null) {
            throw new InvalidRequestException("Confirming party and user are required");
        }
        EscrowContract contract = store.load(contractId);
        if (!contract.isActive()) {
            throw new InvalidStateException("Contract " + contractId + " is already " + contract.getState());
        }
        if (!userId.equals(contract.partyId(party))) {
            throw new InvalidRequestException("User " + userId + " is not the " + party + " of contract " + contractId);
        }
        if (contract.isConfirmedBy(party)) {
            log.info("Contract {} delivery already confirmed by {}", contractId, party);
            return contract;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        EscrowContract confirmed = store.apply(contractId, contract.getStateVersion(), c -> c.confirmDelivery(party, now));
        log.info("Contract {} delivery confirmed by {} {}", contractId, party, userId);
        return confirmed;
    }

    public EscrowContract resolve(Long contractId) {
        EscrowContract contract = store.load(contractId);
        return switch (contract.getState()) {
            case APPROVED -> release(contract);
            case REJECTED -> refund(contract, EscrowState.REFUNDED);
            case FUNDED, AWAITING_EVALUATION, RELEASED, REFUNDED, EXPIRED ->
                    throw new InvalidStateException("Contract " + contractId + " cannot be resolved from " + contract.getState());
        };
    }

    /**
     * Expires a contract whose deadline has passed before evaluation finished. Approved and
     * rejected contracts are left to {@link #resolve(Long)}.
     */
    public EscrowContract expire(Long contractId) {
        EscrowContract contract = store.load(contractId);
        if (!contract.getState().isExpirable()) {
            throw new InvalidStateException("Contract " + contractId + " cannot expire from " + contract.getState());
        }
        if (!contract.isPastDeadline(LocalDateTime.now(clock))) {
            throw new InvalidStateException("Contract " + contractId + " has not reached its deadline " + contract.getDeadline());
        }
        return refund(contract, EscrowState.EXPIRED);
    }

    public EscrowContract clearManualIntervention(Long contractId, String correctedBuyerChainKey) {
        EscrowContract contract = store.load(contractId);
        if (!contract.isManualInterventionRequired()) {
            throw new InvalidStateException("Contract " + contractId + " is not flagged for manual intervention");
        }
        if (correctedBuyerChainKey != null && !StellarKeys.isValidPublicKey(correctedBuyerChainKey.trim())) {
            throw new InvalidRequestException("Corrected buyer chain key is not a valid Stellar public key");
        }

        EscrowContract cleared = store.apply(contractId, contract.getStateVersion(), c -> {
            c.clearFailureFlags();
            if (correctedBuyerChainKey != null) {
                c.setBuyerChainKey(correctedBuyerChainKey.trim());
            }
        });
        log.info("Manual intervention cleared on contract {}", contractId);
        return cleared;
    }

    public EscrowContract getContract(Long contractId) {
        return store.load(contractId);
    }

    @Transactional(readOnly = true)
    public Optional<EscrowContract> findActiveForWatch(Long watchId) {
        return contractRepository.findByActiveWatchKey(watchId);
    }

    @Transactional(readOnly = true)
    public List<EscrowContract> findByWatch(Long watchId) {
        return contractRepository.findByWatchIdOrderByCreatedAtDesc(watchId);
    }

    @Transactional(readOnly = true)
    public List<EscrowContract> findFlaggedForIntervention() {
        return contractRepository.findByManualInterventionRequiredTrue();
    }

    @Transactional(readOnly = true)
    public List<Long> findExpiredContractIds() {
        return contractRepository.findIdsPastDeadline(
                EnumSet.of(EscrowState.FUNDED, EscrowState.AWAITING_EVALUATION), LocalDateTime.now(clock));
    }

    private EscrowContract release(EscrowContract contract) {
        Long contractId = contract.getContractId();
        if (contract.isManualInterventionRequired()) {
            throw new InvalidStateException("Contract " + contractId + " is waiting for manual intervention: "
                    + contract.getLastFailureReason());
        }
        if (!contract.isDeliveryConfirmed()) {
            throw new InvalidStateException("Contract " + contractId + " is waiting for delivery confirmation (seller "
                    + contract.isConfirmedBy(DeliveryParty.SELLER) + ", buyer " + contract.isConfirmedBy(DeliveryParty.BUYER) + ")");
        }
        Evaluation evaluation = certifiedEvaluationFor(contract);

        EscrowContract claimed = store.claim(contractId, contract.getStateVersion());

        FundHold hold = settlementService.getHold(claimed.getHoldReference());
        if (hold.getStatus() == HoldStatus.REFUNDED) {
            String reason = "hold " + hold.getHoldReference() + " was already refunded";
            log.error("Contract {} approved but {}; flagged for manual intervention", contractId, reason);
            store.releaseClaim(contractId, claimed.getStateVersion(), c -> c.flagForManualIntervention(reason));
            throw new InvalidStateException("Contract " + contractId + " cannot be released: " + reason);
        }

        TokenRecord token = callCollaborator(claimed, "tokenization",
                () -> tokenizationService.mintOrTransfer(claimed.getWatchId(), claimed.getBuyerChainKey(), contractId));

        BigDecimal rate = commissionCalculator.rateFor(evaluation.getEvaluatorTier());
        SettlementBreakdown breakdown = callCollaborator(claimed, "payout",
                () -> settlementService.payout(claimed.getHoldReference(), claimed.getSellerId(), rate,
                        contractId, evaluation.getEvaluatorId()));

        EscrowContract released = store.close(contractId, claimed.getStateVersion(), EscrowState.RELEASED);
        log.info("Contract {} released: token #{} ({}) to {}, seller receives {}, commission {}",
                contractId, token.getSequenceNumber(), token.getChainTxRef(), claimed.getBuyerChainKey(),
                breakdown.getSellerAmount(), breakdown.getCommission());
        return released;
    }

    private EscrowContract refund(EscrowContract contract, EscrowState terminal) {
        EscrowContract claimed = store.claim(contract.getContractId(), contract.getStateVersion());

        Money refunded = callCollaborator(claimed, "refund",
                () -> settlementService.refund(claimed.getHoldReference(), claimed.getBuyerId()));

        EscrowContract closed = store.close(claimed.getContractId(), claimed.getStateVersion(), terminal);
        log.info("Contract {} {}: {} returned to buyer {}", closed.getContractId(), terminal, refunded, closed.getBuyerId());
        return closed;
    }

    private Evaluation certifiedEvaluationFor(EscrowContract contract) {
        if (contract.getEvaluationId() == null) {
            throw new InvalidStateException("Contract " + contract.getContractId() + " has no evaluation");
        }
        Evaluation evaluation = evaluationRepository.findById(contract.getEvaluationId())
                .orElseThrow(() -> new ResourceNotFoundException("Evaluation not found with ID: " + contract.getEvaluationId()));
        if (!evaluation.isCertified()) {
            throw new InvalidStateException("Evaluation " + evaluation.getEvaluationId() + " is not certified");
        }
        if (evaluation.isDisputed()) {
            throw new InvalidStateException("Evaluation " + evaluation.getEvaluationId() + " is disputed: "
                    + evaluation.getDisputeReason());
        }
        return evaluation;
    }

    /**
     * Runs one outbound step with bounded retries. A retryable failure that survives the retries
     * marks the contract retry-eligible; any other business failure flags it for an operator.
     * Either way the contract keeps its state and the original exception is rethrown.
     */
    private <T> T callCollaborator(EscrowContract claimed, String step, Supplier<T> call) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("Retrying {} for contract {} (attempt {})", step, claimed.getContractId(), context.getRetryCount() + 1);
                }
                return call.get();
            });
        } catch (LifecycleException e) {
            String reason = step + " failed: " + e.getMessage();
            try {
                if (e.isRetryable()) {
                    log.warn("Contract {} {}; marked retry-eligible", claimed.getContractId(), reason);
                    store.releaseClaim(claimed.getContractId(), claimed.getStateVersion(), c -> c.markRetryEligible(reason));
                } else {
                    log.warn("Contract {} {}; flagged for manual intervention", claimed.getContractId(), reason);
                    store.releaseClaim(claimed.getContractId(), claimed.getStateVersion(), c -> c.flagForManualIntervention(reason));
                }
            } catch (ConflictException flagConflict) {
                e.addSuppressed(flagConflict);
            }
            throw e;
        }
    }

    private Money toMoney(OpenEscrowRequest request) {
        if (request.getAmount() == null) {
            throw new InvalidAmountException("Escrow amount is required");
        }
        try {
            return request.getCurrency() == null
                    ? Money.of(request.getAmount())
                    : Money.of(request.getAmount(), request.getCurrency());
        } catch (IllegalArgumentException e) {
            throw new InvalidAmountException("Unsupported currency: " + request.getCurrency(), e);
        }
    }
}
