package se.chronotrust_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.chronotrust_be.pojo.EscrowContract;
import se.chronotrust_be.pojo.enums.EscrowState;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface EscrowContractRepository extends JpaRepository<EscrowContract, Long> {

    boolean existsByActiveWatchKey(Long watchId);

    Optional<EscrowContract> findByActiveWatchKey(Long watchId);

    List<EscrowContract> findByWatchIdOrderByCreatedAtDesc(Long watchId);

    List<EscrowContract> findByManualInterventionRequiredTrue();

    // Candidates for the expiry sweep
    @Query("SELECT c.contractId FROM EscrowContract c WHERE c.state IN :states AND c.deadline < :now ORDER BY c.deadline ASC")
    List<Long> findIdsPastDeadline(@Param("states") Collection<EscrowState> states, @Param("now") LocalDateTime now);

    long countByWatchIdAndStateIn(Long watchId, Collection<EscrowState> states);
}
