package se.chronotrust_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import se.chronotrust_be.dto.request.CompleteEvaluationRequest;
import se.chronotrust_be.dto.request.OpenEscrowRequest;
import se.chronotrust_be.dto.response.EscrowContractResponse;
import se.chronotrust_be.dto.response.EvaluationResponse;
import se.chronotrust_be.dto.response.OperationResult;
import se.chronotrust_be.dto.response.TokenRecordResponse;
import se.chronotrust_be.exception.ErrorCode;
import se.chronotrust_be.exception.LifecycleException;
import se.chronotrust_be.mapper.LifecycleMapper;
import se.chronotrust_be.pojo.enums.DeliveryParty;
import se.chronotrust_be.pojo.enums.EvaluationResult;

import java.util.function.Supplier;

/**
 * Entry point for the outer layers. Business failures come back as {@link OperationResult}
 * failures; only unexpected system errors (database unreachable and the like) are thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LifecycleFacade {

    private final EscrowContractService escrowContractService;
    private final EvaluationService evaluationService;
    private final TokenizationService tokenizationService;
    private final LifecycleMapper mapper;

    public OperationResult<EscrowContractResponse> openEscrow(OpenEscrowRequest request) {
        return execute("openEscrow", () -> mapper.toContractResponse(escrowContractService.openEscrow(request)));
    }

    public OperationResult<EscrowContractResponse> submitEvaluation(Long contractId, Long evaluationId, EvaluationResult result) {
        return execute("submitEvaluation", () -> mapper.toContractResponse(
                escrowContractService.submitEvaluation(contractId, evaluationId, result)));
    }

    public OperationResult<EscrowContractResponse> confirmDelivery(Long contractId, DeliveryParty party, Long userId) {
        return execute("confirmDelivery", () -> mapper.toContractResponse(
                escrowContractService.confirmDelivery(contractId, party, userId)));
    }

    public OperationResult<EscrowContractResponse> resolve(Long contractId) {
        return execute("resolve", () -> mapper.toContractResponse(escrowContractService.resolve(contractId)));
    }

    public OperationResult<EscrowContractResponse> expire(Long contractId) {
        return execute("expire", () -> mapper.toContractResponse(escrowContractService.expire(contractId)));
    }

    public OperationResult<EscrowContractResponse> clearManualIntervention(Long contractId, String correctedBuyerChainKey) {
        return execute("clearManualIntervention", () -> mapper.toContractResponse(
                escrowContractService.clearManualIntervention(contractId, correctedBuyerChainKey)));
    }

    public OperationResult<EvaluationResponse> requestEvaluation(Long watchId, Long contractId) {
        return execute("requestEvaluation", () -> mapper.toEvaluationResponse(
                evaluationService.requestEvaluation(watchId, contractId)));
    }

    public OperationResult<EvaluationResponse> completeEvaluation(Long evaluationId, CompleteEvaluationRequest request) {
        return execute("completeEvaluation", () -> mapper.toEvaluationResponse(
                evaluationService.completeEvaluation(evaluationId, request.getResult(),
                        request.getCertificateRef(), request.getNotes())));
    }

    public OperationResult<EvaluationResponse> flagDispute(Long evaluationId, String reason) {
        return execute("flagDispute", () -> mapper.toEvaluationResponse(evaluationService.flagDispute(evaluationId, reason)));
    }

    public OperationResult<EvaluationResponse> clearDispute(Long evaluationId) {
        return execute("clearDispute", () -> mapper.toEvaluationResponse(evaluationService.clearDispute(evaluationId)));
    }

    public OperationResult<TokenRecordResponse> mintOrTransfer(Long watchId, String newOwnerKey, Long contractId) {
        return execute("mintOrTransfer", () -> mapper.toTokenResponse(
                tokenizationService.mintOrTransfer(watchId, newOwnerKey, contractId)));
    }

    private <T> OperationResult<T> execute(String operation, Supplier<T> action) {
        try {
            return OperationResult.success(action.get());
        } catch (LifecycleException e) {
            log.warn("{} failed with {}: {}", operation, e.getErrorCode(), e.getMessage());
            return OperationResult.failure(e.getErrorCode(), e.getMessage());
        } catch (OptimisticLockingFailureException e) {
            log.warn("{} lost a concurrent update: {}", operation, e.getMessage());
            return OperationResult.failure(ErrorCode.CONFLICT, "Concurrent modification; re-read and retry");
        }
    }
}
