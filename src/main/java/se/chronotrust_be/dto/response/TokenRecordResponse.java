package se.chronotrust_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.chronotrust_be.pojo.enums.TokenKind;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenRecordResponse {

    private Long tokenRecordId;
    private Long watchId;
    private Integer sequenceNumber;
    private TokenKind kind;
    private String assetCode;
    private String chainTxRef;
    private String ownerKey;
    private String previousOwnerKey;
    private Long contractId;
    private LocalDateTime mintedAt;
}
