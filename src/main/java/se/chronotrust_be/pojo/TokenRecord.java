package se.chronotrust_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.chronotrust_be.pojo.enums.TokenKind;

import java.time.LocalDateTime;

/**
 * One entry of a watch's provenance chain. Rows are never updated; the record with the highest
 * sequence number for a watch is the active one.
 */
@Entity
@Table(name = "token_records", uniqueConstraints = {
        @UniqueConstraint(name = "uk_token_watch_sequence", columnNames = {"watch_id", "sequence_number"}),
        @UniqueConstraint(name = "uk_token_operation_ref", columnNames = {"operation_ref"})
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class TokenRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long tokenRecordId;

    @Column(name = "watch_id", nullable = false, updatable = false)
    private Long watchId;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private Integer sequenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10, updatable = false)
    private TokenKind kind;

    @Column(nullable = false, length = 12, updatable = false)
    private String assetCode;

    @Column(nullable = false, length = 128, updatable = false)
    private String chainTxRef;

    @Column(name = "operation_ref", nullable = false, length = 64, updatable = false)
    private String operationRef;

    @Column(nullable = false, length = 64, updatable = false)
    private String ownerKey;

    @Column(length = 64, updatable = false)
    private String previousOwnerKey;

    @Column(updatable = false)
    private Long contractId;

    @Column(nullable = false, updatable = false)
    private LocalDateTime mintedAt;
}
