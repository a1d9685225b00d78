package se.chronotrust_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.chronotrust_be.client.EvaluatorDirectory;
import se.chronotrust_be.client.EvaluatorRef;
import se.chronotrust_be.exception.AlreadyCompletedException;
import se.chronotrust_be.exception.InvalidRequestException;
import se.chronotrust_be.exception.InvalidStateException;
import se.chronotrust_be.exception.NoEvaluatorAvailableException;
import se.chronotrust_be.exception.ResourceNotFoundException;
import se.chronotrust_be.pojo.EscrowContract;
import se.chronotrust_be.pojo.Evaluation;
import se.chronotrust_be.pojo.Watch;
import se.chronotrust_be.pojo.enums.EscrowState;
import se.chronotrust_be.pojo.enums.EvaluationResult;
import se.chronotrust_be.pojo.enums.WatchStatus;
import se.chronotrust_be.repository.EvaluationRepository;
import se.chronotrust_be.repository.WatchRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class EvaluationService {

    private final EvaluationRepository evaluationRepository;
    private final WatchRepository watchRepository;
    private final EvaluatorDirectory evaluatorDirectory;
    private final EscrowContractService escrowContractService;
    private final Clock clock;

    /**
     * Assigns an evaluator to a funded contract and moves the contract to awaiting evaluation.
     */
    @Transactional
    public Evaluation requestEvaluation(Long watchId, Long contractId) {
        EscrowContract contract = escrowContractService.getContract(contractId);
        if (!contract.getWatchId().equals(watchId)) {
            throw new InvalidRequestException("Contract " + contractId + " does not belong to watch " + watchId);
        }
        if (contract.getState() != EscrowState.FUNDED) {
            throw new InvalidStateException("Contract " + contractId + " is not funded (state " + contract.getState() + ")");
        }

        Watch watch = watchRepository.findById(watchId)
                .orElseThrow(() -> new ResourceNotFoundException("Watch not found with ID: " + watchId));

        EvaluatorRef evaluator = evaluatorDirectory.findEligibleEvaluator(watch.getCategory())
                .orElseThrow(() -> new NoEvaluatorAvailableException(
                        "No evaluator available for category " + watch.getCategory()));

        Evaluation evaluation = evaluationRepository.saveAndFlush(Evaluation.builder()
                .watchId(watchId)
                .contractId(contractId)
                .evaluatorId(evaluator.getEvaluatorId())
                .evaluatorTier(evaluator.getTier())
                .result(EvaluationResult.PENDING)
                .requestedAt(LocalDateTime.now(clock))
                .build());

        escrowContractService.beginEvaluation(contractId, evaluation.getEvaluationId());

        log.info("Evaluation {} requested for watch {} on contract {}, assigned to evaluator {} ({})",
                evaluation.getEvaluationId(), watchId, contractId, evaluator.getEvaluatorId(), evaluator.getTier());
        return evaluation;
    }

    /**
     * Records the outcome of an evaluation exactly once. Repeating the same outcome returns the
     * stored evaluation; a different outcome is refused.
     */
    @Transactional
    public Evaluation completeEvaluation(Long evaluationId, EvaluationResult result, String certificateRef, String notes) {
        Evaluation evaluation = loadEvaluation(evaluationId);

        if (evaluation.isCompleted()) {
            if (evaluation.matches(result, certificateRef)) {
                log.info("Evaluation {} already completed with the same result, nothing to do", evaluationId);
                return evaluation;
            }
            throw new AlreadyCompletedException("Evaluation " + evaluationId + " was already completed as "
                    + evaluation.getResult());
        }

        if (result == null || !result.isFinal()) {
            throw new InvalidRequestException("Evaluation result must be CERTIFIED or REJECTED");
        }
        if (result == EvaluationResult.CERTIFIED && (certificateRef == null || certificateRef.isBlank())) {
            throw new InvalidRequestException("A certified evaluation requires a certificate reference");
        }

        evaluation.complete(result, certificateRef, notes, LocalDateTime.now(clock));
        Evaluation saved = evaluationRepository.saveAndFlush(evaluation);

        escrowContractService.submitEvaluation(saved.getContractId(), evaluationId, result);

        if (result == EvaluationResult.CERTIFIED) {
            watchRepository.findById(saved.getWatchId()).ifPresent(watch -> {
                watch.setStatus(WatchStatus.EVALUATED);
                watchRepository.save(watch);
            });
        }
        evaluatorDirectory.releaseAssignment(saved.getEvaluatorId());

        log.info("Evaluation {} completed: {} (certificate {})", evaluationId, result, certificateRef);
        return saved;
    }

    @Transactional
    public Evaluation flagDispute(Long evaluationId, String reason) {
        Evaluation evaluation = loadEvaluation(evaluationId);
        if (!evaluation.isCompleted()) {
            throw new InvalidStateException("Evaluation " + evaluationId + " has no result to dispute yet");
        }
        if (reason == null || reason.isBlank()) {
            throw new InvalidRequestException("A dispute reason is required");
        }

        evaluation.setDisputed(true);
        evaluation.setDisputeReason(reason);
        log.warn("Evaluation {} disputed: {}", evaluationId, reason);
        return evaluationRepository.save(evaluation);
    }

    @Transactional
    public Evaluation clearDispute(Long evaluationId) {
        Evaluation evaluation = loadEvaluation(evaluationId);
        if (!evaluation.isDisputed()) {
            throw new InvalidStateException("Evaluation " + evaluationId + " is not disputed");
        }

        evaluation.setDisputed(false);
        evaluation.setDisputeReason(null);
        log.info("Dispute cleared on evaluation {}", evaluationId);
        return evaluationRepository.save(evaluation);
    }

    public Evaluation getEvaluation(Long evaluationId) {
        return loadEvaluation(evaluationId);
    }

    public List<Evaluation> findByContract(Long contractId) {
        return evaluationRepository.findByContractIdOrderByRequestedAtDesc(contractId);
    }

    public List<Evaluation> findByWatch(Long watchId) {
        return evaluationRepository.findByWatchIdOrderByRequestedAtDesc(watchId);
    }

    private Evaluation loadEvaluation(Long evaluationId) {
        return evaluationRepository.findById(evaluationId)
                .orElseThrow(() -> new ResourceNotFoundException("Evaluation not found with ID: " + evaluationId));
    }
}
