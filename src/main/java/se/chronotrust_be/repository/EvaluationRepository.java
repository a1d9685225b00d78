package se.chronotrust_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.chronotrust_be.pojo.Evaluation;
import se.chronotrust_be.pojo.enums.EvaluationResult;

import java.util.List;

public interface EvaluationRepository extends JpaRepository<Evaluation, Long> {

    List<Evaluation> findByContractIdOrderByRequestedAtDesc(Long contractId);

    boolean existsByContractIdAndResult(Long contractId, EvaluationResult result);

    List<Evaluation> findByWatchIdOrderByRequestedAtDesc(Long watchId);
}
