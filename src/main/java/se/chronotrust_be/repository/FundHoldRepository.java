package se.chronotrust_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.chronotrust_be.pojo.FundHold;
import se.chronotrust_be.pojo.enums.HoldStatus;

import java.util.List;
import java.util.Optional;

public interface FundHoldRepository extends JpaRepository<FundHold, Long> {

    Optional<FundHold> findByHoldReference(String holdReference);

    List<FundHold> findByPayerIdAndStatus(Long payerId, HoldStatus status);
}
