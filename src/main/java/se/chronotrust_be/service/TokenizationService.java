package se.chronotrust_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.chronotrust_be.client.ChainAssetState;
import se.chronotrust_be.client.ChainClient;
import se.chronotrust_be.client.ChainPayload;
import se.chronotrust_be.client.ChainReceipt;
import se.chronotrust_be.dto.response.TokenVerificationResponse;
import se.chronotrust_be.exception.ChainRejectedException;
import se.chronotrust_be.exception.ConflictException;
import se.chronotrust_be.exception.InvalidRequestException;
import se.chronotrust_be.exception.InvalidStateException;
import se.chronotrust_be.exception.ResourceNotFoundException;
import se.chronotrust_be.pojo.EscrowContract;
import se.chronotrust_be.pojo.Evaluation;
import se.chronotrust_be.pojo.TokenRecord;
import se.chronotrust_be.pojo.Watch;
import se.chronotrust_be.pojo.enums.EscrowState;
import se.chronotrust_be.repository.EscrowContractRepository;
import se.chronotrust_be.repository.EvaluationRepository;
import se.chronotrust_be.repository.TokenRecordRepository;
import se.chronotrust_be.repository.WatchRepository;
import se.chronotrust_be.util.OperationRefs;
import se.chronotrust_be.util.StellarKeys;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Issues and transfers the provenance token of a watch.
 * <p>
 * Each call is keyed by an operation reference derived from the contract, the watch serial and the
 * new owner key. A repeated call with the same triple returns the record written the first time,
 * and the chain client treats a repeated reference as the same submission.
 * <p>
 * A new record is only written for an approved escrow contract of the watch whose evaluation is
 * certified and undisputed, and only to that contract's buyer key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenizationService {

    private final ChainClient chainClient;
    private final TokenRecordRepository tokenRecordRepository;
    private final WatchRepository watchRepository;
    private final EscrowContractRepository contractRepository;
    private final EvaluationRepository evaluationRepository;
    private final TokenLedger tokenLedger;
    private final Clock clock;

    public TokenRecord mintOrTransfer(Long watchId, String newOwnerKey, Long contractId) {
        if (contractId == null) {
            throw new InvalidRequestException("A token of watch " + watchId + " can only be issued for an escrow contract");
        }
        Watch watch = watchRepository.findById(watchId)
                .orElseThrow(() -> new ResourceNotFoundException("Watch not found with ID: " + watchId));

        String operationRef = OperationRefs.tokenization(contractId, watch.getSerialNumber(), newOwnerKey);
        Optional<TokenRecord> existing = tokenRecordRepository.findByOperationRef(operationRef);
        if (existing.isPresent()) {
            log.info("Tokenization {} for watch {} already recorded as #{}", operationRef, watchId,
                    existing.get().getSequenceNumber());
            return existing.get();
        }

        requireReleasable(contractId, watchId, newOwnerKey);

        if (!StellarKeys.isValidPublicKey(newOwnerKey)) {
            throw new ChainRejectedException("Owner key for watch " + watchId + " is not a valid Stellar public key");
        }

        Optional<TokenRecord> head = tokenRecordRepository.findTopByWatchIdOrderBySequenceNumberDesc(watchId);
        String assetCode = OperationRefs.assetCode(watchId);
        ChainPayload payload;
        if (head.isEmpty()) {
            payload = ChainPayload.mint(assetCode, newOwnerKey, memo(watch, contractId));
        } else {
            if (head.get().getOwnerKey().equals(newOwnerKey)) {
                throw new ChainRejectedException("Key already holds the token of watch " + watchId);
            }
            payload = ChainPayload.transfer(assetCode, head.get().getOwnerKey(), newOwnerKey, memo(watch, contractId));
        }

        ChainReceipt receipt = chainClient.submit(operationRef, payload);

        TokenRecord record = TokenRecord.builder()
                .watchId(watchId)
                .sequenceNumber(head.map(r -> r.getSequenceNumber() + 1).orElse(1))
                .kind(payload.getKind())
                .assetCode(assetCode)
                .chainTxRef(receipt.getTransactionHash())
                .operationRef(operationRef)
                .ownerKey(newOwnerKey)
                .previousOwnerKey(payload.getFromKey())
                .contractId(contractId)
                .mintedAt(LocalDateTime.now(clock))
                .build();

        try {
            TokenRecord appended = tokenLedger.append(record);
            log.info("Token {} #{} for watch {} recorded: {} to {}", assetCode, appended.getSequenceNumber(),
                    watchId, payload.getKind(), newOwnerKey);
            return appended;
        } catch (DataIntegrityViolationException e) {
            // Either a concurrent retry recorded the same operation, or another operation took the sequence number
            return tokenRecordRepository.findByOperationRef(operationRef)
                    .orElseThrow(() -> new ConflictException("Token history of watch " + watchId
                            + " changed concurrently; re-read and retry", e));
        }
    }

    @Transactional(readOnly = true)
    public List<TokenRecord> history(Long watchId) {
        requireWatch(watchId);
        return tokenRecordRepository.findByWatchIdOrderBySequenceNumberAsc(watchId);
    }

    @Transactional(readOnly = true)
    public Optional<TokenRecord> currentHolder(Long watchId) {
        requireWatch(watchId);
        return tokenRecordRepository.findTopByWatchIdOrderBySequenceNumberDesc(watchId);
    }

    /**
     * Compares the head of the local history with the asset state reported by the chain.
     */
    @Transactional(readOnly = true)
    public TokenVerificationResponse verify(Long watchId) {
        requireWatch(watchId);
        String assetCode = OperationRefs.assetCode(watchId);
        Optional<TokenRecord> head = tokenRecordRepository.findTopByWatchIdOrderBySequenceNumberDesc(watchId);
        Optional<ChainAssetState> onChain = chainClient.lookup(assetCode);

        boolean consistent;
        if (head.isEmpty()) {
            consistent = onChain.isEmpty();
        } else {
            consistent = onChain.isPresent()
                    && onChain.get().getHolderKey().equals(head.get().getOwnerKey())
                    && onChain.get().getLastTransactionHash().equals(head.get().getChainTxRef());
        }
        if (!consistent) {
            log.warn("Token {} of watch {} does not match the chain", assetCode, watchId);
        }

        return TokenVerificationResponse.builder()
                .watchId(watchId)
                .assetCode(assetCode)
                .sequenceNumber(head.map(TokenRecord::getSequenceNumber).orElse(null))
                .recordedOwnerKey(head.map(TokenRecord::getOwnerKey).orElse(null))
                .recordedTxRef(head.map(TokenRecord::getChainTxRef).orElse(null))
                .chainHolderKey(onChain.map(ChainAssetState::getHolderKey).orElse(null))
                .chainTxRef(onChain.map(ChainAssetState::getLastTransactionHash).orElse(null))
                .onChain(onChain.isPresent())
                .consistent(consistent)
                .build();
    }

    private void requireReleasable(Long contractId, Long watchId, String newOwnerKey) {
        EscrowContract contract = contractRepository.findById(contractId)
                .orElseThrow(() -> new ResourceNotFoundException("Escrow contract not found with ID: " + contractId));
        if (!contract.getWatchId().equals(watchId)) {
            throw new InvalidRequestException("Contract " + contractId + " does not belong to watch " + watchId);
        }
        if (contract.getState() != EscrowState.APPROVED) {
            throw new InvalidStateException("Contract " + contractId + " is not approved (state " + contract.getState() + ")");
        }
        if (!contract.getBuyerChainKey().equals(newOwnerKey)) {
            throw new InvalidStateException("Token of watch " + watchId + " can only go to the buyer of contract " + contractId);
        }

        Evaluation evaluation = Optional.ofNullable(contract.getEvaluationId())
                .flatMap(evaluationRepository::findById)
                .orElseThrow(() -> new InvalidStateException("Contract " + contractId + " has no evaluation"));
        if (!evaluation.isCertified() || evaluation.isDisputed()) {
            throw new InvalidStateException("Evaluation " + evaluation.getEvaluationId()
                    + " of contract " + contractId + " is not certified or is disputed");
        }
    }

    private void requireWatch(Long watchId) {
        if (!watchRepository.existsById(watchId)) {
            throw new ResourceNotFoundException("Watch not found with ID: " + watchId);
        }
    }

    private Map<String, String> memo(Watch watch, Long contractId) {
        Map<String, String> memo = new LinkedHashMap<>();
        memo.put("serial", watch.getSerialNumber());
        memo.put("brand", watch.getBrand());
        memo.put("model", watch.getModel());
        memo.put("contract", contractId.toString());
        return memo;
    }
}
