package se.chronotrust_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.chronotrust_be.pojo.enums.EvaluationResult;
import se.chronotrust_be.pojo.enums.EvaluatorTier;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationResponse {

    private Long evaluationId;
    private Long watchId;
    private Long contractId;
    private Long evaluatorId;
    private EvaluatorTier evaluatorTier;
    private EvaluationResult result;
    private String certificateRef;
    private String notes;
    private boolean disputed;
    private String disputeReason;
    private LocalDateTime requestedAt;
    private LocalDateTime completedAt;
}
