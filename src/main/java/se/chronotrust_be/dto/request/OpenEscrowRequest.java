package se.chronotrust_be.dto.request;

import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenEscrowRequest {

    @NotNull(message = "Watch ID is required")
    private Long watchId;

    @NotNull(message = "Buyer ID is required")
    private Long buyerId;

    @NotBlank(message = "Buyer chain key is required")
    private String buyerChainKey;

    @NotNull(message = "Seller ID is required")
    private Long sellerId;

    // Sign is checked by the service so a non-positive amount maps to INVALID_AMOUNT
    @NotNull(message = "Amount is required")
    private BigDecimal amount;

    @Pattern(regexp = "^[A-Z]{3}$", message = "Currency must be an ISO-4217 code")
    private String currency;

    @NotNull(message = "Deadline is required")
    @Future(message = "Deadline must be in the future")
    private LocalDateTime deadline;
}
