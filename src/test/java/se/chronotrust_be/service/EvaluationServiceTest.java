package se.chronotrust_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.chronotrust_be.client.EvaluatorDirectory;
import se.chronotrust_be.client.EvaluatorRef;
import se.chronotrust_be.exception.AlreadyCompletedException;
import se.chronotrust_be.exception.InvalidRequestException;
import se.chronotrust_be.exception.InvalidStateException;
import se.chronotrust_be.exception.NoEvaluatorAvailableException;
import se.chronotrust_be.pojo.EscrowContract;
import se.chronotrust_be.pojo.Evaluation;
import se.chronotrust_be.pojo.Watch;
import se.chronotrust_be.pojo.enums.EscrowState;
import se.chronotrust_be.pojo.enums.EvaluationResult;
import se.chronotrust_be.pojo.enums.EvaluatorTier;
import se.chronotrust_be.pojo.enums.WatchStatus;
import se.chronotrust_be.repository.EvaluationRepository;
import se.chronotrust_be.repository.WatchRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EvaluationService Unit Tests")
class EvaluationServiceTest {

    private static final Long WATCH_ID = 3L;
    private static final Long CONTRACT_ID = 7L;
    private static final Long EVALUATION_ID = 11L;
    private static final Long EVALUATOR_ID = 5L;

    @Mock
    private EvaluationRepository evaluationRepository;

    @Mock
    private WatchRepository watchRepository;

    @Mock
    private EvaluatorDirectory evaluatorDirectory;

    @Mock
    private EscrowContractService escrowContractService;

    private EvaluationService evaluationService;

    @BeforeEach
    void setUp() {
        evaluationService = new EvaluationService(evaluationRepository, watchRepository, evaluatorDirectory,
                escrowContractService, Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("requestEvaluation")
    class RequestEvaluation {

        @Test
        @DisplayName("Assigns an evaluator for the watch category and moves the contract forward")
        void shouldAssignEvaluator() {
            when(escrowContractService.getContract(CONTRACT_ID)).thenReturn(contract(EscrowState.FUNDED));
            when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
            when(evaluatorDirectory.findEligibleEvaluator("diver")).thenReturn(Optional.of(EvaluatorRef.builder()
                    .evaluatorId(EVALUATOR_ID)
                    .tier(EvaluatorTier.SENIOR)
                    .build()));
            when(evaluationRepository.saveAndFlush(any())).thenAnswer(invocation -> {
                Evaluation evaluation = invocation.getArgument(0);
                evaluation.setEvaluationId(EVALUATION_ID);
                return evaluation;
            });

            Evaluation requested = evaluationService.requestEvaluation(WATCH_ID, CONTRACT_ID);

            assertThat(requested.getResult()).isEqualTo(EvaluationResult.PENDING);
            assertThat(requested.getEvaluatorId()).isEqualTo(EVALUATOR_ID);
            assertThat(requested.getEvaluatorTier()).isEqualTo(EvaluatorTier.SENIOR);
            verify(escrowContractService).beginEvaluation(CONTRACT_ID, EVALUATION_ID);
        }

        @Test
        @DisplayName("Fails when no evaluator covers the category")
        void shouldFailWithoutEvaluator() {
            when(escrowContractService.getContract(CONTRACT_ID)).thenReturn(contract(EscrowState.FUNDED));
            when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch()));
            when(evaluatorDirectory.findEligibleEvaluator("diver")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> evaluationService.requestEvaluation(WATCH_ID, CONTRACT_ID))
                    .isInstanceOf(NoEvaluatorAvailableException.class);
            verify(evaluationRepository, never()).saveAndFlush(any());
            verify(escrowContractService, never()).beginEvaluation(anyLong(), anyLong());
        }

        @Test
        @DisplayName("Refuses a contract that already left the funded state")
        void shouldRefuseContractNotFunded() {
            when(escrowContractService.getContract(CONTRACT_ID)).thenReturn(contract(EscrowState.AWAITING_EVALUATION));

            assertThatThrownBy(() -> evaluationService.requestEvaluation(WATCH_ID, CONTRACT_ID))
                    .isInstanceOf(InvalidStateException.class);
            verifyNoInteractions(evaluatorDirectory, evaluationRepository);
        }

        @Test
        @DisplayName("Refuses a contract of another watch")
        void shouldRefuseForeignContract() {
            when(escrowContractService.getContract(CONTRACT_ID)).thenReturn(contract(EscrowState.FUNDED));

            assertThatThrownBy(() -> evaluationService.requestEvaluation(99L, CONTRACT_ID))
                    .isInstanceOf(InvalidRequestException.class);
        }
    }

    @Nested
    @DisplayName("completeEvaluation")
    class CompleteEvaluation {

        @Test
        @DisplayName("Certification approves the contract, marks the watch evaluated and frees the evaluator")
        void shouldCertify() {
            Watch watch = watch();
            when(evaluationRepository.findById(EVALUATION_ID)).thenReturn(Optional.of(pending()));
            when(evaluationRepository.saveAndFlush(any())).thenAnswer(invocation -> invocation.getArgument(0));
            when(watchRepository.findById(WATCH_ID)).thenReturn(Optional.of(watch));

            Evaluation completed = evaluationService.completeEvaluation(EVALUATION_ID, EvaluationResult.CERTIFIED,
                    "CERT-2026-0042", "movement serviced 2024");

            assertThat(completed.getResult()).isEqualTo(EvaluationResult.CERTIFIED);
            assertThat(completed.getCompletedAt()).isNotNull();
            assertThat(watch.getStatus()).isEqualTo(WatchStatus.EVALUATED);
            verify(escrowContractService).submitEvaluation(CONTRACT_ID, EVALUATION_ID, EvaluationResult.CERTIFIED);
            verify(evaluatorDirectory).releaseAssignment(EVALUATOR_ID);
        }

        @Test
        @DisplayName("Rejection leaves the watch status alone")
        void shouldReject() {
            when(evaluationRepository.findById(EVALUATION_ID)).thenReturn(Optional.of(pending()));
            when(evaluationRepository.saveAndFlush(any())).thenAnswer(invocation -> invocation.getArgument(0));

            evaluationService.completeEvaluation(EVALUATION_ID, EvaluationResult.REJECTED, null, "case not original");

            verify(escrowContractService).submitEvaluation(CONTRACT_ID, EVALUATION_ID, EvaluationResult.REJECTED);
            verify(watchRepository, never()).save(any());
        }

        @Test
        @DisplayName("Certification without a certificate reference is refused")
        void shouldRequireCertificateRef() {
            when(evaluationRepository.findById(EVALUATION_ID)).thenReturn(Optional.of(pending()));

            assertThatThrownBy(() -> evaluationService.completeEvaluation(EVALUATION_ID, EvaluationResult.CERTIFIED, " ", null))
                    .isInstanceOf(InvalidRequestException.class);
            verifyNoInteractions(escrowContractService);
        }

        @Test
        @DisplayName("Pending is not an outcome")
        void shouldRefusePendingOutcome() {
            when(evaluationRepository.findById(EVALUATION_ID)).thenReturn(Optional.of(pending()));

            assertThatThrownBy(() -> evaluationService.completeEvaluation(EVALUATION_ID, EvaluationResult.PENDING, null, null))
                    .isInstanceOf(InvalidRequestException.class);
        }

        @Test
        @DisplayName("Repeating the recorded outcome returns it unchanged")
        void shouldAcceptIdenticalRepeat() {
            Evaluation certified = pending();
            certified.setResult(EvaluationResult.CERTIFIED);
            certified.setCertificateRef("CERT-2026-0042");
            when(evaluationRepository.findById(EVALUATION_ID)).thenReturn(Optional.of(certified));

            assertThat(evaluationService.completeEvaluation(EVALUATION_ID, EvaluationResult.CERTIFIED, "CERT-2026-0042", null))
                    .isSameAs(certified);
            verifyNoInteractions(escrowContractService, evaluatorDirectory);
        }

        @Test
        @DisplayName("A different outcome for a completed evaluation is refused")
        void shouldRefuseDifferentOutcome() {
            Evaluation certified = pending();
            certified.setResult(EvaluationResult.CERTIFIED);
            certified.setCertificateRef("CERT-2026-0042");
            when(evaluationRepository.findById(EVALUATION_ID)).thenReturn(Optional.of(certified));

            assertThatThrownBy(() -> evaluationService.completeEvaluation(EVALUATION_ID, EvaluationResult.REJECTED, null, null))
                    .isInstanceOf(AlreadyCompletedException.class);
            verifyNoInteractions(escrowContractService);
        }
    }

    @Test
    @DisplayName("A pending evaluation cannot be disputed")
    void shouldNotDisputePendingEvaluation() {
        when(evaluationRepository.findById(EVALUATION_ID)).thenReturn(Optional.of(pending()));

        assertThatThrownBy(() -> evaluationService.flagDispute(EVALUATION_ID, "wrong calibre"))
                .isInstanceOf(InvalidStateException.class);
        verify(evaluationRepository, never()).save(any());
    }

    @Test
    @DisplayName("Dispute is recorded with its reason and can be cleared")
    void shouldFlagAndClearDispute() {
        Evaluation certified = pending();
        certified.setResult(EvaluationResult.CERTIFIED);
        when(evaluationRepository.findById(EVALUATION_ID)).thenReturn(Optional.of(certified));
        when(evaluationRepository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        Evaluation disputed = evaluationService.flagDispute(EVALUATION_ID, "wrong calibre");
        assertThat(disputed.isDisputed()).isTrue();
        assertThat(disputed.getDisputeReason()).isEqualTo("wrong calibre");

        Evaluation cleared = evaluationService.clearDispute(EVALUATION_ID);
        assertThat(cleared.isDisputed()).isFalse();
        assertThat(cleared.getDisputeReason()).isNull();
    }

    private static EscrowContract contract(EscrowState state) {
        return EscrowContract.builder()
                .contractId(CONTRACT_ID)
                .watchId(WATCH_ID)
                .state(state)
                .stateVersion(1L)
                .build();
    }

    private static Watch watch() {
        return Watch.builder()
                .watchId(WATCH_ID)
                .serialNumber("OMG-210.30-0001")
                .brand("Omega")
                .model("Seamaster 300M")
                .category("diver")
                .ownerId(200L)
                .status(WatchStatus.IN_ESCROW)
                .build();
    }

    private static Evaluation pending() {
        return Evaluation.builder()
                .evaluationId(EVALUATION_ID)
                .watchId(WATCH_ID)
                .contractId(CONTRACT_ID)
                .evaluatorId(EVALUATOR_ID)
                .evaluatorTier(EvaluatorTier.SENIOR)
                .result(EvaluationResult.PENDING)
                .build();
    }
}
