package se.chronotrust_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.chronotrust_be.dto.request.ListingRequest;
import se.chronotrust_be.dto.request.RegisterWatchRequest;
import se.chronotrust_be.exception.ConflictException;
import se.chronotrust_be.exception.InvalidAmountException;
import se.chronotrust_be.exception.InvalidStateException;
import se.chronotrust_be.exception.ResourceNotFoundException;
import se.chronotrust_be.pojo.Money;
import se.chronotrust_be.pojo.TokenRecord;
import se.chronotrust_be.pojo.Watch;
import se.chronotrust_be.pojo.enums.WatchStatus;
import se.chronotrust_be.repository.EscrowContractRepository;
import se.chronotrust_be.repository.WatchRepository;

import java.math.BigDecimal;
import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class WatchService {

    private final WatchRepository watchRepository;
    private final EscrowContractRepository contractRepository;
    private final TokenizationService tokenizationService;

    /**
     * Registers a watch under its serial number. With a price it is listed straight away,
     * otherwise it is kept off the market until {@link #listForSale} is called.
     */
    @Transactional
    public Watch registerWatch(RegisterWatchRequest request) {
        String serial = request.getSerialNumber().trim();
        if (watchRepository.existsBySerialNumber(serial)) {
            throw new ConflictException("A watch with serial number " + serial + " is already registered");
        }

        Money price = request.getPrice() != null ? price(request.getPrice(), request.getCurrency()) : null;
        Watch watch = Watch.builder()
                .serialNumber(serial)
                .brand(request.getBrand())
                .model(request.getModel())
                .category(request.getCategory())
                .description(request.getDescription())
                .listedPrice(price)
                .ownerId(request.getOwnerId())
                .status(price != null ? WatchStatus.LISTED : WatchStatus.DELISTED)
                .build();

        try {
            Watch saved = watchRepository.saveAndFlush(watch);
            log.info("Registered watch {} ({} {}) serial {} for owner {}", saved.getWatchId(), saved.getBrand(),
                    saved.getModel(), serial, saved.getOwnerId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("A watch with serial number " + serial + " is already registered", e);
        }
    }

    @Transactional
    public Watch listForSale(Long watchId, ListingRequest request) {
        Watch watch = ownedWatch(watchId, request.getOwnerId());
        if (watch.getStatus().isLocked()) {
            throw new InvalidStateException("Watch " + watchId + " is in escrow and cannot be relisted");
        }
        if (request.getPrice() == null) {
            throw new InvalidAmountException("A listing price is required");
        }

        watch.setListedPrice(price(request.getPrice(), request.getCurrency()));
        watch.setStatus(WatchStatus.LISTED);
        log.info("Watch {} listed by owner {} at {}", watchId, watch.getOwnerId(), watch.getListedPrice());
        return save(watch);
    }

    @Transactional
    public Watch delist(Long watchId, Long ownerId) {
        Watch watch = ownedWatch(watchId, ownerId);
        if (watch.getStatus().isLocked() || contractRepository.existsByActiveWatchKey(watchId)) {
            throw new InvalidStateException("Watch " + watchId + " is in escrow and cannot be delisted");
        }

        watch.setStatus(WatchStatus.DELISTED);
        log.info("Watch {} delisted by owner {}", watchId, ownerId);
        return save(watch);
    }

    public Watch getWatch(Long watchId) {
        return watchRepository.findById(watchId)
                .orElseThrow(() -> new ResourceNotFoundException("Watch not found with ID: " + watchId));
    }

    public List<Watch> findListed() {
        return watchRepository.findByStatus(WatchStatus.LISTED);
    }

    public List<Watch> findByOwner(Long ownerId) {
        return watchRepository.findByOwnerId(ownerId);
    }

    public List<TokenRecord> ownershipHistory(Long watchId) {
        return tokenizationService.history(watchId);
    }

    private Watch ownedWatch(Long watchId, Long ownerId) {
        Watch watch = getWatch(watchId);
        if (!watch.getOwnerId().equals(ownerId)) {
            throw new InvalidStateException("User " + ownerId + " does not own watch " + watchId);
        }
        return watch;
    }

    private Watch save(Watch watch) {
        try {
            return watchRepository.saveAndFlush(watch);
        } catch (OptimisticLockingFailureException e) {
            throw new ConflictException("Watch " + watch.getWatchId() + " was modified concurrently", e);
        }
    }

    private Money price(BigDecimal amount, String currency) {
        if (amount.signum() <= 0) {
            throw new InvalidAmountException("Price must be greater than zero");
        }
        try {
            return currency == null ? Money.of(amount) : Money.of(amount, currency);
        } catch (IllegalArgumentException e) {
            throw new InvalidAmountException("Unsupported currency: " + currency, e);
        }
    }
}
