package se.chronotrust_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.chronotrust_be.pojo.enums.EscrowState;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscrowContractResponse {

    private Long contractId;
    private Long watchId;
    private Long buyerId;
    private String buyerChainKey;
    private Long sellerId;
    private BigDecimal amount;
    private String currency;
    private String holdReference;
    private EscrowState state;
    // Clients pass this back when they want to detect concurrent changes
    private Long stateVersion;
    private Long evaluationId;
    private boolean retryEligible;
    private boolean manualInterventionRequired;
    private String lastFailureReason;
    private LocalDateTime sellerConfirmedAt;
    private LocalDateTime buyerConfirmedAt;
    private LocalDateTime deadline;
    private LocalDateTime createdAt;
    private LocalDateTime resolvedAt;
}
