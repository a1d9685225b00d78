package se.chronotrust_be.mapper;

import org.springframework.stereotype.Component;
import se.chronotrust_be.dto.response.EscrowContractResponse;
import se.chronotrust_be.dto.response.EvaluationResponse;
import se.chronotrust_be.dto.response.SettlementResponse;
import se.chronotrust_be.dto.response.TokenRecordResponse;
import se.chronotrust_be.dto.response.WatchResponse;
import se.chronotrust_be.pojo.Commission;
import se.chronotrust_be.pojo.EscrowContract;
import se.chronotrust_be.pojo.Evaluation;
import se.chronotrust_be.pojo.TokenRecord;
import se.chronotrust_be.pojo.Watch;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts lifecycle entities to response DTOs
 */
@Component
public class LifecycleMapper {

    public WatchResponse toWatchResponse(Watch watch) {
        if (watch == null) {
            return null;
        }
        return WatchResponse.builder()
                .watchId(watch.getWatchId())
                .serialNumber(watch.getSerialNumber())
                .brand(watch.getBrand())
                .model(watch.getModel())
                .category(watch.getCategory())
                .description(watch.getDescription())
                .listedPrice(watch.getListedPrice() != null ? watch.getListedPrice().getAmount() : null)
                .currency(watch.getListedPrice() != null ? watch.getListedPrice().getCurrency() : null)
                .ownerId(watch.getOwnerId())
                .status(watch.getStatus())
                .createdAt(watch.getCreatedAt())
                .updatedAt(watch.getUpdatedAt())
                .build();
    }

    public EscrowContractResponse toContractResponse(EscrowContract contract) {
        if (contract == null) {
            return null;
        }
        return EscrowContractResponse.builder()
                .contractId(contract.getContractId())
                .watchId(contract.getWatchId())
                .buyerId(contract.getBuyerId())
                .buyerChainKey(contract.getBuyerChainKey())
                .sellerId(contract.getSellerId())
                .amount(contract.getHeldAmount().getAmount())
                .currency(contract.getHeldAmount().getCurrency())
                .holdReference(contract.getHoldReference())
                .state(contract.getState())
                .stateVersion(contract.getStateVersion())
                .evaluationId(contract.getEvaluationId())
                .retryEligible(contract.isRetryEligible())
                .manualInterventionRequired(contract.isManualInterventionRequired())
                .lastFailureReason(contract.getLastFailureReason())
                .sellerConfirmedAt(contract.getSellerConfirmedAt())
                .buyerConfirmedAt(contract.getBuyerConfirmedAt())
                .deadline(contract.getDeadline())
                .createdAt(contract.getCreatedAt())
                .resolvedAt(contract.getResolvedAt())
                .build();
    }

    public List<EscrowContractResponse> toContractResponses(List<EscrowContract> contracts) {
        return contracts.stream().map(this::toContractResponse).collect(Collectors.toList());
    }

    public EvaluationResponse toEvaluationResponse(Evaluation evaluation) {
        if (evaluation == null) {
            return null;
        }
        return EvaluationResponse.builder()
                .evaluationId(evaluation.getEvaluationId())
                .watchId(evaluation.getWatchId())
                .contractId(evaluation.getContractId())
                .evaluatorId(evaluation.getEvaluatorId())
                .evaluatorTier(evaluation.getEvaluatorTier())
                .result(evaluation.getResult())
                .certificateRef(evaluation.getCertificateRef())
                .notes(evaluation.getNotes())
                .disputed(evaluation.isDisputed())
                .disputeReason(evaluation.getDisputeReason())
                .requestedAt(evaluation.getRequestedAt())
                .completedAt(evaluation.getCompletedAt())
                .build();
    }

    public List<EvaluationResponse> toEvaluationResponses(List<Evaluation> evaluations) {
        return evaluations.stream().map(this::toEvaluationResponse).collect(Collectors.toList());
    }

    public TokenRecordResponse toTokenResponse(TokenRecord record) {
        if (record == null) {
            return null;
        }
        return TokenRecordResponse.builder()
                .tokenRecordId(record.getTokenRecordId())
                .watchId(record.getWatchId())
                .sequenceNumber(record.getSequenceNumber())
                .kind(record.getKind())
                .assetCode(record.getAssetCode())
                .chainTxRef(record.getChainTxRef())
                .ownerKey(record.getOwnerKey())
                .previousOwnerKey(record.getPreviousOwnerKey())
                .contractId(record.getContractId())
                .mintedAt(record.getMintedAt())
                .build();
    }

    public List<TokenRecordResponse> toTokenResponses(List<TokenRecord> records) {
        return records.stream().map(this::toTokenResponse).collect(Collectors.toList());
    }

    public SettlementResponse toSettlementResponse(Commission commission) {
        if (commission == null) {
            return null;
        }
        return SettlementResponse.builder()
                .contractId(commission.getContractId())
                .holdReference(commission.getHoldReference())
                .currency(commission.getGrossAmount().getCurrency())
                .grossAmount(commission.getGrossAmount().getAmount())
                .rate(commission.getRate())
                .commission(commission.getAmount().getAmount())
                .platformShare(commission.getPlatformShare().getAmount())
                .evaluatorShare(commission.getEvaluatorShare().getAmount())
                .sellerAmount(commission.getSellerAmount().getAmount())
                .beneficiary(commission.getBeneficiary())
                .build();
    }
}
