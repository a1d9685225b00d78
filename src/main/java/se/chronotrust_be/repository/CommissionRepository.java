package se.chronotrust_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.chronotrust_be.pojo.Commission;

import java.util.List;
import java.util.Optional;

public interface CommissionRepository extends JpaRepository<Commission, Long> {

    Optional<Commission> findByContractId(Long contractId);

    Optional<Commission> findByHoldReference(String holdReference);

    List<Commission> findByEvaluatorId(Long evaluatorId);
}
