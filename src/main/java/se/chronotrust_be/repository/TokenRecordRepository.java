package se.chronotrust_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.chronotrust_be.pojo.TokenRecord;

import java.util.List;
import java.util.Optional;

public interface TokenRecordRepository extends JpaRepository<TokenRecord, Long> {

    Optional<TokenRecord> findByOperationRef(String operationRef);

    // Active record = highest sequence number
    Optional<TokenRecord> findTopByWatchIdOrderBySequenceNumberDesc(Long watchId);

    List<TokenRecord> findByWatchIdOrderBySequenceNumberAsc(Long watchId);

    long countByWatchId(Long watchId);
}
