package se.chronotrust_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.chronotrust_be.pojo.Evaluator;

import java.util.List;

public interface EvaluatorRepository extends JpaRepository<Evaluator, Long> {

    List<Evaluator> findByActiveTrue();
}
