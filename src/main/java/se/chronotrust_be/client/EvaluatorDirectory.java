package se.chronotrust_be.client;

import java.util.Optional;

public interface EvaluatorDirectory {

    Optional<EvaluatorRef> findEligibleEvaluator(String watchCategory);

    void releaseAssignment(Long evaluatorId);
}
