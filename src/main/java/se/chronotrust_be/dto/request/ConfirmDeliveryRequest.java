package se.chronotrust_be.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.chronotrust_be.pojo.enums.DeliveryParty;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmDeliveryRequest {

    @NotNull(message = "Confirming party is required")
    private DeliveryParty party;

    // Must be the contract's seller or buyer, matching the party
    @NotNull(message = "User ID is required")
    private Long userId;
}
