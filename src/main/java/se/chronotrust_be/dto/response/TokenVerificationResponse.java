package se.chronotrust_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Comparison of the locally recorded provenance head with what the chain reports for the asset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenVerificationResponse {

    private Long watchId;
    private String assetCode;
    private Integer sequenceNumber;
    private String recordedOwnerKey;
    private String recordedTxRef;
    private String chainHolderKey;
    private String chainTxRef;
    private boolean onChain;
    private boolean consistent;
}
