package se.chronotrust_be.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MintOrTransferRequest {

    @NotNull(message = "Watch ID is required")
    private Long watchId;

    @NotBlank(message = "New owner key is required")
    private String newOwnerKey;

    // Approved escrow contract the token is issued for; also keys idempotent retries
    @NotNull(message = "Contract ID is required")
    private Long contractId;
}
