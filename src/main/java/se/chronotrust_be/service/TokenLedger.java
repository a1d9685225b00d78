package se.chronotrust_be.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.chronotrust_be.pojo.TokenRecord;
import se.chronotrust_be.pojo.enums.WatchStatus;
import se.chronotrust_be.repository.TokenRecordRepository;
import se.chronotrust_be.repository.WatchRepository;

/**
 * Append-only writes to the provenance chain. Kept apart from {@link TokenizationService} so the
 * chain call happens outside the transaction that records its outcome.
 */
@Service
@RequiredArgsConstructor
public class TokenLedger {

    private final TokenRecordRepository tokenRecordRepository;
    private final WatchRepository watchRepository;

    @Transactional
    public TokenRecord append(TokenRecord record) {
        TokenRecord saved = tokenRecordRepository.saveAndFlush(record);
        watchRepository.findById(record.getWatchId())
                .filter(watch -> watch.getStatus() == WatchStatus.EVALUATED)
                .ifPresent(watch -> {
                    watch.setStatus(WatchStatus.TOKENIZED);
                    watchRepository.save(watch);
                });
        return saved;
    }
}
