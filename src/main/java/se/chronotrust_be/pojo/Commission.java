package se.chronotrust_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import se.chronotrust_be.pojo.enums.CommissionBeneficiary;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "commissions")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Commission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long commissionId;

    @Column(nullable = false, unique = true, updatable = false)
    private Long contractId;

    @Column(nullable = false, length = 64, updatable = false)
    private String holdReference;

    @Column(nullable = false, precision = 5, scale = 4)
    private BigDecimal rate;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "gross_amount")),
            @AttributeOverride(name = "currency", column = @Column(name = "gross_currency"))
    })
    private Money grossAmount;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "commission_amount")),
            @AttributeOverride(name = "currency", column = @Column(name = "commission_currency"))
    })
    private Money amount;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "platform_share")),
            @AttributeOverride(name = "currency", column = @Column(name = "platform_share_currency"))
    })
    private Money platformShare;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "evaluator_share")),
            @AttributeOverride(name = "currency", column = @Column(name = "evaluator_share_currency"))
    })
    private Money evaluatorShare;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "seller_amount")),
            @AttributeOverride(name = "currency", column = @Column(name = "seller_currency"))
    })
    private Money sellerAmount;

    private Long evaluatorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CommissionBeneficiary beneficiary;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
