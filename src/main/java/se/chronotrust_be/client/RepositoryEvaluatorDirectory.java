package se.chronotrust_be.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import se.chronotrust_be.pojo.Evaluator;
import se.chronotrust_be.repository.EvaluatorRepository;

import java.util.Comparator;
import java.util.Optional;

/**
 * Picks the least loaded active evaluator covering the category; ties go to the higher tier.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RepositoryEvaluatorDirectory implements EvaluatorDirectory {

    private final EvaluatorRepository evaluatorRepository;

    @Override
    @Transactional
    public Optional<EvaluatorRef> findEligibleEvaluator(String watchCategory) {
        Optional<Evaluator> chosen = evaluatorRepository.findByActiveTrue().stream()
                .filter(evaluator -> evaluator.covers(watchCategory))
                .min(Comparator.comparingInt(Evaluator::getOpenAssignments)
                        .thenComparing(evaluator -> -evaluator.getTier().getLevel()));

        if (chosen.isEmpty()) {
            log.warn("No active evaluator covers category {}", watchCategory);
            return Optional.empty();
        }

        Evaluator evaluator = chosen.get();
        evaluator.setOpenAssignments(evaluator.getOpenAssignments() + 1);
        evaluatorRepository.save(evaluator);

        return Optional.of(EvaluatorRef.builder()
                .evaluatorId(evaluator.getEvaluatorId())
                .tier(evaluator.getTier())
                .build());
    }

    @Override
    @Transactional
    public void releaseAssignment(Long evaluatorId) {
        evaluatorRepository.findById(evaluatorId).ifPresent(evaluator -> {
            evaluator.setOpenAssignments(Math.max(0, evaluator.getOpenAssignments() - 1));
            evaluatorRepository.save(evaluator);
        });
    }
}
