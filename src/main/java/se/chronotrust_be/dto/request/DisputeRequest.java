package se.chronotrust_be.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DisputeRequest {

    @NotBlank(message = "Dispute reason is required")
    @Size(max = 500, message = "Dispute reason must not exceed 500 characters")
    private String reason;
}
