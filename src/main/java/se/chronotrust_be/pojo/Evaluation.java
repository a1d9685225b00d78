package se.chronotrust_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.chronotrust_be.pojo.enums.EvaluationResult;
import se.chronotrust_be.pojo.enums.EvaluatorTier;

import java.time.LocalDateTime;
import java.util.Objects;

@Entity
@Table(name = "evaluations", indexes = {
        @Index(name = "idx_evaluation_contract", columnList = "contract_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Evaluation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long evaluationId;

    @Column(nullable = false, updatable = false)
    private Long watchId;

    @Column(name = "contract_id", nullable = false, updatable = false)
    private Long contractId;

    @Column(nullable = false, updatable = false)
    private Long evaluatorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private EvaluatorTier evaluatorTier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EvaluationResult result = EvaluationResult.PENDING;

    @Column(length = 255)
    private String certificateRef;

    @Column(columnDefinition = "text")
    private String notes;

    @Builder.Default
    private boolean disputed = false;

    @Column(length = 500)
    private String disputeReason;

    @Version
    private Long version;

    @Column(nullable = false, updatable = false)
    private LocalDateTime requestedAt;

    private LocalDateTime completedAt;

    public boolean isCompleted() {
        return result.isFinal();
    }

    public boolean isCertified() {
        return result == EvaluationResult.CERTIFIED;
    }

    public void complete(EvaluationResult outcome, String certificateRef, String notes, LocalDateTime at) {
        if (isCompleted()) {
            throw new IllegalStateException("Evaluation " + evaluationId + " already completed");
        }
        this.result = outcome;
        this.certificateRef = certificateRef;
        this.notes = notes;
        this.completedAt = at;
    }

    public boolean matches(EvaluationResult outcome, String certificateRef) {
        return result == outcome && Objects.equals(this.certificateRef, certificateRef);
    }
}
