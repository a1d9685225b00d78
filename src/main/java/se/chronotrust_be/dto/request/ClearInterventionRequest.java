package se.chronotrust_be.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClearInterventionRequest {

    // Replaces the buyer's chain key when the previous one was rejected
    private String correctedBuyerChainKey;
}
