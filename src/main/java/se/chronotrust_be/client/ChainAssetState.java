package se.chronotrust_be.client;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChainAssetState {
    String assetCode;
    String holderKey;
    String lastTransactionHash;
}
