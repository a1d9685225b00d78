package se.chronotrust_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import se.chronotrust_be.pojo.enums.DeliveryParty;
import se.chronotrust_be.pojo.enums.EscrowState;

import java.time.LocalDateTime;

/**
 * Funds held in trust for one purchase of one watch.
 * <p>
 * {@code activeWatchKey} mirrors {@code watchId} while the contract is non-terminal and is cleared
 * on the terminal transition; its unique constraint keeps a single active contract per watch.
 * {@code stateVersion} is the optimistic version every transition is checked against.
 * A release also needs both the seller's and the buyer's delivery confirmation.
 */
@Entity
@Table(name = "escrow_contracts", indexes = {
        @Index(name = "idx_escrow_watch", columnList = "watch_id"),
        @Index(name = "idx_escrow_state_deadline", columnList = "state, deadline")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EscrowContract {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long contractId;

    @Column(name = "watch_id", nullable = false, updatable = false)
    private Long watchId;

    @Column(name = "active_watch_key", unique = true)
    private Long activeWatchKey;

    @Column(nullable = false, updatable = false)
    private Long buyerId;

    @Column(nullable = false, length = 64)
    private String buyerChainKey;

    @Column(nullable = false, updatable = false)
    private Long sellerId;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "held_amount", nullable = false)),
            @AttributeOverride(name = "currency", column = @Column(name = "held_currency", nullable = false))
    })
    private Money heldAmount;

    @Column(nullable = false, unique = true, length = 64)
    private String holdReference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private EscrowState state = EscrowState.FUNDED;

    @Version
    @Column(nullable = false)
    private Long stateVersion;

    private Long evaluationId;

    @Builder.Default
    private boolean retryEligible = false;

    @Builder.Default
    private boolean manualInterventionRequired = false;

    @Column(length = 500)
    private String lastFailureReason;

    @Column(nullable = false)
    private LocalDateTime deadline;

    @CreationTimestamp
    private LocalDateTime createdAt;

    private LocalDateTime sellerConfirmedAt;

    private LocalDateTime buyerConfirmedAt;

    private LocalDateTime lastClaimedAt;

    private LocalDateTime resolvedAt;

    public boolean isActive() {
        return !state.isTerminal();
    }

    public boolean isPastDeadline(LocalDateTime now) {
        return deadline != null && now.isAfter(deadline);
    }

    public boolean isConfirmedBy(DeliveryParty party) {
        return switch (party) {
            case SELLER -> sellerConfirmedAt != null;
            case BUYER -> buyerConfirmedAt != null;
        };
    }

    public boolean isDeliveryConfirmed() {
        return sellerConfirmedAt != null && buyerConfirmedAt != null;
    }

    public Long partyId(DeliveryParty party) {
        return party == DeliveryParty.SELLER ? sellerId : buyerId;
    }

    public void confirmDelivery(DeliveryParty party, LocalDateTime at) {
        switch (party) {
            case SELLER -> this.sellerConfirmedAt = at;
            case BUYER -> this.buyerConfirmedAt = at;
        }
    }

    public void moveTo(EscrowState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal escrow transition " + state + " -> " + next);
        }
        this.state = next;
        if (next.isTerminal()) {
            this.activeWatchKey = null;
        }
    }

    public void markRetryEligible(String reason) {
        this.retryEligible = true;
        this.lastFailureReason = reason;
        this.lastClaimedAt = null;
    }

    public void flagForManualIntervention(String reason) {
        this.manualInterventionRequired = true;
        this.retryEligible = false;
        this.lastFailureReason = reason;
        this.lastClaimedAt = null;
    }

    public void clearFailureFlags() {
        this.retryEligible = false;
        this.manualInterventionRequired = false;
        this.lastFailureReason = null;
    }
}
