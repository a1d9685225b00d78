package se.chronotrust_be.client;

import lombok.Builder;
import lombok.Value;
import se.chronotrust_be.pojo.enums.TokenKind;

import java.util.Map;

@Value
@Builder
public class ChainPayload {
    TokenKind kind;
    String assetCode;
    // null for a mint
    String fromKey;
    String toKey;
    Map<String, String> memo;

    public static ChainPayload mint(String assetCode, String toKey, Map<String, String> memo) {
        return ChainPayload.builder()
                .kind(TokenKind.MINT)
                .assetCode(assetCode)
                .toKey(toKey)
                .memo(memo)
                .build();
    }

    public static ChainPayload transfer(String assetCode, String fromKey, String toKey, Map<String, String> memo) {
        return ChainPayload.builder()
                .kind(TokenKind.TRANSFER)
                .assetCode(assetCode)
                .fromKey(fromKey)
                .toKey(toKey)
                .memo(memo)
                .build();
    }
}
