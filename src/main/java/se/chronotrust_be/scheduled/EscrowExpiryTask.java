package se.chronotrust_be.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import se.chronotrust_be.exception.ConflictException;
import se.chronotrust_be.exception.InvalidStateException;
import se.chronotrust_be.exception.LifecycleException;
import se.chronotrust_be.service.EscrowContractService;

import java.util.List;

/**
 * Expires funded or awaiting contracts whose deadline has passed and refunds their buyers.
 * A contract that moved on since the scan (resolved, evaluated, expired by a foreground call) is skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EscrowExpiryTask {

    private final EscrowContractService escrowContractService;

    @Scheduled(fixedDelayString = "${chronotrust.escrow.expiry-sweep-interval-ms:60000}",
            initialDelayString = "${chronotrust.escrow.expiry-sweep-initial-delay-ms:30000}")
    public void expireOverdueContracts() {
        runSweep();
    }

    public int runSweep() {
        List<Long> candidates = escrowContractService.findExpiredContractIds();
        if (candidates.isEmpty()) {
            log.debug("No overdue escrow contracts");
            return 0;
        }

        log.info("Found {} overdue escrow contracts", candidates.size());
        int expired = 0;
        int skipped = 0;
        int failed = 0;

        for (Long contractId : candidates) {
            try {
                escrowContractService.expire(contractId);
                expired++;
            } catch (ConflictException | InvalidStateException e) {
                skipped++;
                log.info("Skipped expiry of contract {}: {}", contractId, e.getMessage());
            } catch (LifecycleException e) {
                failed++;
                log.warn("Expiry of contract {} failed with {}: {}", contractId, e.getErrorCode(), e.getMessage());
            }
        }

        log.info("Expiry sweep finished: {} expired, {} skipped, {} failed", expired, skipped, failed);
        return expired;
    }
}
