package se.chronotrust_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.chronotrust_be.exception.ConflictException;
import se.chronotrust_be.exception.ResourceNotFoundException;
import se.chronotrust_be.pojo.EscrowContract;
import se.chronotrust_be.pojo.Watch;
import se.chronotrust_be.pojo.enums.EscrowState;
import se.chronotrust_be.pojo.enums.WatchStatus;
import se.chronotrust_be.repository.EscrowContractRepository;
import se.chronotrust_be.repository.WatchRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Short transactions that apply one change to a contract, each guarded by the contract's
 * {@code stateVersion}. A caller passes the version it last read; if the row moved on in the
 * meantime the change is refused with {@link ConflictException} and nothing is written.
 * Outbound calls happen between these transactions, never inside them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EscrowContractStore {

    private final EscrowContractRepository contractRepository;
    private final WatchRepository watchRepository;
    private final Clock clock;

    @Value("${chronotrust.escrow.claim-lease-ms:120000}")
    private long claimLeaseMs;

    @Transactional(readOnly = true)
    public EscrowContract load(Long contractId) {
        return contractRepository.findById(contractId)
                .orElseThrow(() -> new ResourceNotFoundException("Escrow contract not found with ID: " + contractId));
    }

    /**
     * Persists a new contract and locks its watch. Fails if the watch changed since
     * {@code expectedWatchVersion} or another active contract holds it.
     */
    @Transactional
    public EscrowContract open(EscrowContract draft, Long expectedWatchVersion) {
        Watch watch = watchRepository.findById(draft.getWatchId())
                .orElseThrow(() -> new ResourceNotFoundException("Watch not found with ID: " + draft.getWatchId()));

        if (!Objects.equals(watch.getVersion(), expectedWatchVersion)) {
            throw new ConflictException("Watch " + watch.getWatchId() + " changed while the escrow was being opened");
        }
        if (contractRepository.existsByActiveWatchKey(watch.getWatchId())) {
            throw new ConflictException("Watch " + watch.getWatchId() + " already has an active escrow contract");
        }

        watch.setStatus(WatchStatus.IN_ESCROW);
        try {
            watchRepository.saveAndFlush(watch);
            return contractRepository.saveAndFlush(draft);
        } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
            throw new ConflictException("Watch " + watch.getWatchId() + " already has an active escrow contract", e);
        }
    }

    /**
     * Takes ownership of the contract for one outbound step by bumping its version. Any other
     * writer holding the old version will now fail its own check, and a new claim is refused
     * until the lease runs out or the holder records a failure.
     */
    @Transactional
    public EscrowContract claim(Long contractId, Long expectedVersion) {
        EscrowContract contract = load(contractId);
        requireVersion(contract, expectedVersion);
        requireUnclaimed(contract);
        contract.setLastClaimedAt(LocalDateTime.now(clock));
        return flush(contract);
    }

    /**
     * Applies a change outside any outbound step. Refused while another caller holds the claim,
     * even when the caller read the version written by that claim.
     */
    @Transactional
    public EscrowContract apply(Long contractId, Long expectedVersion, Consumer<EscrowContract> mutation) {
        EscrowContract contract = load(contractId);
        requireVersion(contract, expectedVersion);
        requireUnclaimed(contract);
        mutation.accept(contract);
        return flush(contract);
    }

    /**
     * Records the outcome of a failed outbound step on behalf of the claim holder and frees the claim.
     */
    @Transactional
    public EscrowContract releaseClaim(Long contractId, Long claimedVersion, Consumer<EscrowContract> mutation) {
        EscrowContract contract = load(contractId);
        requireVersion(contract, claimedVersion);
        mutation.accept(contract);
        contract.setLastClaimedAt(null);
        return flush(contract);
    }

    /**
     * Moves the contract to a terminal state and updates its watch in the same transaction.
     * Only a release hands the watch to the buyer; refunds and expiry return it to the seller's listing.
     */
    @Transactional
    public EscrowContract close(Long contractId, Long expectedVersion, EscrowState terminal) {
        EscrowContract contract = load(contractId);
        requireVersion(contract, expectedVersion);

        contract.moveTo(terminal);
        contract.clearFailureFlags();
        contract.setResolvedAt(LocalDateTime.now(clock));

        Watch watch = watchRepository.findById(contract.getWatchId())
                .orElseThrow(() -> new ResourceNotFoundException("Watch not found with ID: " + contract.getWatchId()));
        switch (terminal) {
            case RELEASED -> {
                watch.setOwnerId(contract.getBuyerId());
                watch.setStatus(WatchStatus.SOLD);
            }
            case REFUNDED, EXPIRED -> watch.setStatus(WatchStatus.LISTED);
            default -> throw new IllegalArgumentException("Not a terminal escrow state: " + terminal);
        }

        try {
            watchRepository.saveAndFlush(watch);
        } catch (OptimisticLockingFailureException e) {
            throw new ConflictException("Watch " + watch.getWatchId() + " changed while contract " + contractId + " was closing", e);
        }
        return flush(contract);
    }

    private void requireUnclaimed(EscrowContract contract) {
        LocalDateTime claimedAt = contract.getLastClaimedAt();
        if (claimedAt != null && claimedAt.plus(Duration.ofMillis(claimLeaseMs)).isAfter(LocalDateTime.now(clock))) {
            throw new ConflictException("Escrow contract " + contract.getContractId()
                    + " is being processed since " + claimedAt);
        }
    }

    private void requireVersion(EscrowContract contract, Long expectedVersion) {
        if (!Objects.equals(contract.getStateVersion(), expectedVersion)) {
            log.warn("Contract {} version mismatch: expected {}, found {}",
                    contract.getContractId(), expectedVersion, contract.getStateVersion());
            throw new ConflictException("Escrow contract " + contract.getContractId()
                    + " was modified concurrently; re-read and retry");
        }
    }

    private EscrowContract flush(EscrowContract contract) {
        try {
            return contractRepository.saveAndFlush(contract);
        } catch (OptimisticLockingFailureException e) {
            throw new ConflictException("Escrow contract " + contract.getContractId()
                    + " was modified concurrently; re-read and retry", e);
        }
    }
}
