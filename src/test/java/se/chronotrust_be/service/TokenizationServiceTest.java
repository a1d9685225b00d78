package se.chronotrust_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import se.chronotrust_be.client.ChainAssetState;
import se.chronotrust_be.client.ChainClient;
import se.chronotrust_be.client.ChainPayload;
import se.chronotrust_be.client.ChainReceipt;
import se.chronotrust_be.dto.response.TokenVerificationResponse;
import se.chronotrust_be.exception.ChainRejectedException;
import se.chronotrust_be.exception.ChainUnavailableException;
import se.chronotrust_be.exception.ConflictException;
import se.chronotrust_be.exception.InvalidRequestException;
import se.chronotrust_be.exception.InvalidStateException;
import se.chronotrust_be.pojo.EscrowContract;
import se.chronotrust_be.pojo.Evaluation;
import se.chronotrust_be.pojo.Money;
import se.chronotrust_be.pojo.TokenRecord;
import se.chronotrust_be.pojo.Watch;
import se.chronotrust_be.pojo.enums.EscrowState;
import se.chronotrust_be.pojo.enums.EvaluationResult;
import se.chronotrust_be.pojo.enums.EvaluatorTier;
import se.chronotrust_be.pojo.enums.TokenKind;
import se.chronotrust_be.pojo.enums.WatchStatus;
import se.chronotrust_be.repository.EscrowContractRepository;
import se.chronotrust_be.repository.EvaluationRepository;
import se.chronotrust_be.repository.TokenRecordRepository;
import se.chronotrust_be.repository.WatchRepository;
import se.chronotrust_be.util.OperationRefs;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TokenizationService Unit Tests")
class TokenizationServiceTest {

    private static final Long WATCH_ID = 3L;
    private static final Long CONTRACT_ID = 7L;
    private static final Long EVALUATION_ID = 11L;
    private static final String SERIAL = "PP-5711-0042";
    private static final String ALICE = "G" + "A".repeat(55);
    private static final String BOB = "G" + "B".repeat(55);
    private static final String ASSET = "CTW000000003";

    @Mock
    private ChainClient chainClient;

    @Mock
    private TokenRecordRepository tokenRecordRepository;

    @Mock
    private WatchRepository watchRepository;

    @Mock
    private EscrowContractRepository contractRepository;

    @Mock
    private EvaluationRepository evaluationRepository;

    @Mock
    private TokenLedger tokenLedger;

    private TokenizationService tokenizationService;

    @BeforeEach
    void setUp() {
        tokenizationService = new TokenizationService(chainClient, tokenRecordRepository, watchRepository,
                contractRepository, evaluationRepository, tokenLedger,
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("First tokenization of a watch mints sequence 1")
    void shouldMintFirstToken() {
        stubApprovedContract(ALICE);
        String ref = OperationRefs.tokenization(CONTRACT_ID, SERIAL, ALICE);
        when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
        when(tokenRecordRepository.findByOperationRef(ref)).thenReturn(Optional.empty());
        when(tokenRecordRepository.findTopByWatchIdOrderBySequenceNumberDesc(WATCH_ID)).thenReturn(Optional.empty());
        when(chainClient.submit(eq(ref), any())).thenReturn(receipt("tx-mint", ref));
        when(tokenLedger.append(any())).thenAnswer(invocation -> invocation.getArgument(0));

        TokenRecord minted = tokenizationService.mintOrTransfer(WATCH_ID, ALICE, CONTRACT_ID);

        assertThat(minted.getSequenceNumber()).isEqualTo(1);
        assertThat(minted.getKind()).isEqualTo(TokenKind.MINT);
        assertThat(minted.getAssetCode()).isEqualTo(ASSET);
        assertThat(minted.getOwnerKey()).isEqualTo(ALICE);
        assertThat(minted.getPreviousOwnerKey()).isNull();
        assertThat(minted.getChainTxRef()).isEqualTo("tx-mint");

        ArgumentCaptor<ChainPayload> payload = ArgumentCaptor.forClass(ChainPayload.class);
        verify(chainClient).submit(eq(ref), payload.capture());
        assertThat(payload.getValue().getMemo()).containsEntry("serial", SERIAL).containsEntry("contract", "7");
    }

    @Test
    @DisplayName("Resale transfers from the current holder and appends the next sequence number")
    void shouldTransferFromCurrentHolder() {
        stubApprovedContract(BOB);
        String ref = OperationRefs.tokenization(CONTRACT_ID, SERIAL, BOB);
        when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
        when(tokenRecordRepository.findByOperationRef(ref)).thenReturn(Optional.empty());
        when(tokenRecordRepository.findTopByWatchIdOrderBySequenceNumberDesc(WATCH_ID))
                .thenReturn(Optional.of(record(1, ALICE, "tx-mint", "op-mint")));
        when(chainClient.submit(eq(ref), any())).thenReturn(receipt("tx-transfer", ref));
        when(tokenLedger.append(any())).thenAnswer(invocation -> invocation.getArgument(0));

        TokenRecord transferred = tokenizationService.mintOrTransfer(WATCH_ID, BOB, CONTRACT_ID);

        assertThat(transferred.getSequenceNumber()).isEqualTo(2);
        assertThat(transferred.getKind()).isEqualTo(TokenKind.TRANSFER);
        assertThat(transferred.getPreviousOwnerKey()).isEqualTo(ALICE);
        assertThat(transferred.getOwnerKey()).isEqualTo(BOB);
    }

    @Test
    @DisplayName("Repeated call with the same operation returns the recorded token without touching the chain")
    void shouldReturnRecordedOperation() {
        String ref = OperationRefs.tokenization(CONTRACT_ID, SERIAL, ALICE);
        TokenRecord recorded = record(1, ALICE, "tx-mint", ref);
        when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
        when(tokenRecordRepository.findByOperationRef(ref)).thenReturn(Optional.of(recorded));

        assertThat(tokenizationService.mintOrTransfer(WATCH_ID, ALICE, CONTRACT_ID)).isSameAs(recorded);
        verifyNoInteractions(chainClient, tokenLedger);
    }

    @Test
    @DisplayName("Malformed owner key is rejected before submission")
    void shouldRejectMalformedKey() {
        stubApprovedContract("GABC");
        when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
        when(tokenRecordRepository.findByOperationRef(any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> tokenizationService.mintOrTransfer(WATCH_ID, "GABC", CONTRACT_ID))
                .isInstanceOf(ChainRejectedException.class);
        verifyNoInteractions(chainClient, tokenLedger);
    }

    @Test
    @DisplayName("Transfer to the key that already holds the token is rejected")
    void shouldRejectTransferToCurrentHolder() {
        stubApprovedContract(ALICE);
        when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
        when(tokenRecordRepository.findByOperationRef(any())).thenReturn(Optional.empty());
        when(tokenRecordRepository.findTopByWatchIdOrderBySequenceNumberDesc(WATCH_ID))
                .thenReturn(Optional.of(record(1, ALICE, "tx-mint", "op-mint")));

        assertThatThrownBy(() -> tokenizationService.mintOrTransfer(WATCH_ID, ALICE, CONTRACT_ID))
                .isInstanceOf(ChainRejectedException.class);
        verifyNoInteractions(chainClient);
    }

    @Test
    @DisplayName("Chain outage writes no history")
    void shouldNotRecordWhenChainUnavailable() {
        stubApprovedContract(ALICE);
        when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
        when(tokenRecordRepository.findByOperationRef(any())).thenReturn(Optional.empty());
        when(tokenRecordRepository.findTopByWatchIdOrderBySequenceNumberDesc(WATCH_ID)).thenReturn(Optional.empty());
        when(chainClient.submit(any(), any())).thenThrow(new ChainUnavailableException("timeout"));

        assertThatThrownBy(() -> tokenizationService.mintOrTransfer(WATCH_ID, ALICE, CONTRACT_ID))
                .isInstanceOf(ChainUnavailableException.class);
        verify(tokenLedger, never()).append(any());
    }

    @Test
    @DisplayName("Losing the append race to the same operation returns the winner's record")
    void shouldReturnConcurrentlyRecordedOperation() {
        stubApprovedContract(ALICE);
        String ref = OperationRefs.tokenization(CONTRACT_ID, SERIAL, ALICE);
        TokenRecord winner = record(1, ALICE, "tx-mint", ref);
        when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
        when(tokenRecordRepository.findByOperationRef(ref))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(tokenRecordRepository.findTopByWatchIdOrderBySequenceNumberDesc(WATCH_ID)).thenReturn(Optional.empty());
        when(chainClient.submit(eq(ref), any())).thenReturn(receipt("tx-mint", ref));
        when(tokenLedger.append(any())).thenThrow(new DataIntegrityViolationException("uk_token_operation_ref"));

        assertThat(tokenizationService.mintOrTransfer(WATCH_ID, ALICE, CONTRACT_ID)).isSameAs(winner);
    }

    @Test
    @DisplayName("Sequence taken by a different operation surfaces as a conflict")
    void shouldConflictWhenSequenceTakenByOtherOperation() {
        stubApprovedContract(ALICE);
        when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
        when(tokenRecordRepository.findByOperationRef(any())).thenReturn(Optional.empty());
        when(tokenRecordRepository.findTopByWatchIdOrderBySequenceNumberDesc(WATCH_ID)).thenReturn(Optional.empty());
        when(chainClient.submit(any(), any())).thenReturn(receipt("tx-mint", "op"));
        when(tokenLedger.append(any())).thenThrow(new DataIntegrityViolationException("uk_token_watch_sequence"));

        assertThatThrownBy(() -> tokenizationService.mintOrTransfer(WATCH_ID, ALICE, CONTRACT_ID))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("A token is never issued without an escrow contract")
    void shouldRejectTokenWithoutContract() {
        assertThatThrownBy(() -> tokenizationService.mintOrTransfer(WATCH_ID, ALICE, null))
                .isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(chainClient, tokenLedger);
    }

    @Test
    @DisplayName("Contract still awaiting evaluation cannot tokenize")
    void shouldRejectContractNotApproved() {
        EscrowContract awaiting = approvedContract(ALICE);
        awaiting.setState(EscrowState.AWAITING_EVALUATION);
        when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
        when(tokenRecordRepository.findByOperationRef(any())).thenReturn(Optional.empty());
        when(contractRepository.findById(CONTRACT_ID)).thenReturn(Optional.of(awaiting));

        assertThatThrownBy(() -> tokenizationService.mintOrTransfer(WATCH_ID, ALICE, CONTRACT_ID))
                .isInstanceOf(InvalidStateException.class);
        verifyNoInteractions(chainClient, tokenLedger);
    }

    @Test
    @DisplayName("Token only goes to the buyer key of the contract")
    void shouldRejectKeyOtherThanBuyer() {
        when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
        when(tokenRecordRepository.findByOperationRef(any())).thenReturn(Optional.empty());
        when(contractRepository.findById(CONTRACT_ID)).thenReturn(Optional.of(approvedContract(ALICE)));

        assertThatThrownBy(() -> tokenizationService.mintOrTransfer(WATCH_ID, BOB, CONTRACT_ID))
                .isInstanceOf(InvalidStateException.class);
        verifyNoInteractions(chainClient, tokenLedger);
    }

    @Test
    @DisplayName("Disputed evaluation blocks tokenization")
    void shouldRejectDisputedEvaluation() {
        Evaluation disputed = certifiedEvaluation();
        disputed.setDisputed(true);
        when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
        when(tokenRecordRepository.findByOperationRef(any())).thenReturn(Optional.empty());
        when(contractRepository.findById(CONTRACT_ID)).thenReturn(Optional.of(approvedContract(ALICE)));
        when(evaluationRepository.findById(EVALUATION_ID)).thenReturn(Optional.of(disputed));

        assertThatThrownBy(() -> tokenizationService.mintOrTransfer(WATCH_ID, ALICE, CONTRACT_ID))
                .isInstanceOf(InvalidStateException.class);
        verifyNoInteractions(chainClient, tokenLedger);
    }

    @Test
    @DisplayName("Verification reports a holder mismatch with the chain")
    void shouldReportInconsistentHolder() {
        when(watchRepository.existsById(WATCH_ID)).thenReturn(true);
        when(tokenRecordRepository.findTopByWatchIdOrderBySequenceNumberDesc(WATCH_ID))
                .thenReturn(Optional.of(record(2, BOB, "tx-transfer", "op-transfer")));
        when(chainClient.lookup(ASSET)).thenReturn(Optional.of(ChainAssetState.builder()
                .assetCode(ASSET)
                .holderKey(ALICE)
                .lastTransactionHash("tx-mint")
                .build()));

        TokenVerificationResponse verification = tokenizationService.verify(WATCH_ID);

        assertThat(verification.isOnChain()).isTrue();
        assertThat(verification.isConsistent()).isFalse();
        assertThat(verification.getRecordedOwnerKey()).isEqualTo(BOB);
        assertThat(verification.getChainHolderKey()).isEqualTo(ALICE);
    }

    private void stubApprovedContract(String buyerKey) {
        when(contractRepository.findById(CONTRACT_ID)).thenReturn(Optional.of(approvedContract(buyerKey)));
        when(evaluationRepository.findById(EVALUATION_ID)).thenReturn(Optional.of(certifiedEvaluation()));
    }

    private static EscrowContract approvedContract(String buyerKey) {
        return EscrowContract.builder()
                .contractId(CONTRACT_ID)
                .watchId(WATCH_ID)
                .activeWatchKey(WATCH_ID)
                .buyerId(100L)
                .buyerChainKey(buyerKey)
                .sellerId(200L)
                .heldAmount(Money.of("500.00", "BRL"))
                .holdReference("hold-7")
                .state(EscrowState.APPROVED)
                .stateVersion(4L)
                .evaluationId(EVALUATION_ID)
                .build();
    }

    private static Evaluation certifiedEvaluation() {
        return Evaluation.builder()
                .evaluationId(EVALUATION_ID)
                .watchId(WATCH_ID)
                .contractId(CONTRACT_ID)
                .evaluatorId(5L)
                .evaluatorTier(EvaluatorTier.SENIOR)
                .result(EvaluationResult.CERTIFIED)
                .certificateRef("CERT-2026-0042")
                .completedAt(LocalDateTime.of(2026, 3, 1, 10, 0))
                .build();
    }

    private static Watch watch() {
        return Watch.builder()
                .watchId(WATCH_ID)
                .serialNumber(SERIAL)
                .brand("Patek Philippe")
                .model("Nautilus 5711")
                .category("complication")
                .ownerId(200L)
                .status(WatchStatus.IN_ESCROW)
                .build();
    }

    private static TokenRecord record(int sequence, String owner, String txRef, String operationRef) {
        return TokenRecord.builder()
                .tokenRecordId((long) sequence)
                .watchId(WATCH_ID)
                .sequenceNumber(sequence)
                .kind(sequence == 1 ? TokenKind.MINT : TokenKind.TRANSFER)
                .assetCode(ASSET)
                .chainTxRef(txRef)
                .operationRef(operationRef)
                .ownerKey(owner)
                .build();
    }

    private static ChainReceipt receipt(String hash, String ref) {
        return ChainReceipt.builder()
                .transactionHash(hash)
                .operationRef(ref)
                .submittedAt(Instant.parse("2026-03-01T12:00:00Z"))
                .build();
    }
}
