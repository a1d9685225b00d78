package se.chronotrust_be.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.chronotrust_be.pojo.enums.EvaluationResult;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteEvaluationRequest {

    @NotNull(message = "Result is required")
    private EvaluationResult result;

    @Size(max = 255, message = "Certificate reference must not exceed 255 characters")
    private String certificateRef;

    private String notes;
}
