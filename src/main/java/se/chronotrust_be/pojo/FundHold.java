package se.chronotrust_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import se.chronotrust_be.pojo.enums.HoldStatus;

import java.time.LocalDateTime;

@Entity
@Table(name = "fund_holds")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FundHold {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long fundHoldId;

    @Column(nullable = false, unique = true, updatable = false, length = 64)
    private String holdReference;

    @Column(nullable = false, updatable = false)
    private Long payerId;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "held_amount", nullable = false)),
            @AttributeOverride(name = "currency", column = @Column(name = "held_currency", nullable = false))
    })
    private Money amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private HoldStatus status = HoldStatus.HELD;

    @Column(length = 80)
    private String settlementKey;

    @Version
    private Long version;

    @CreationTimestamp
    private LocalDateTime createdAt;

    private LocalDateTime settledAt;
}
