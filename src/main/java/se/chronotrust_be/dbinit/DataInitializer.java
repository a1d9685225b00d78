package se.chronotrust_be.dbinit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import se.chronotrust_be.pojo.Evaluator;
import se.chronotrust_be.pojo.enums.EvaluatorTier;
import se.chronotrust_be.repository.EvaluatorRepository;

import java.util.ArrayList;
import java.util.List;

@Component
@ConditionalOnProperty(name = "chronotrust.seed.evaluators", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private final EvaluatorRepository evaluatorRepository;

    @Override
    public void run(String... args) {
        initEvaluators();
    }

    private void initEvaluators() {
        if (evaluatorRepository.count() > 0) {
            return;
        }

        List<Evaluator> evaluators = new ArrayList<>();
        evaluators.add(Evaluator.builder().name("Ana Ribeiro").tier(EvaluatorTier.STANDARD).build());
        evaluators.add(Evaluator.builder().name("Bruno Costa").tier(EvaluatorTier.SENIOR).specialty("dress").build());
        evaluators.add(Evaluator.builder().name("Carla Mendes").tier(EvaluatorTier.SENIOR).specialty("diver").build());
        evaluators.add(Evaluator.builder().name("Diego Almeida").tier(EvaluatorTier.MASTER).specialty("complication").build());
        evaluatorRepository.saveAll(evaluators);

        log.info("Seeded {} evaluators", evaluators.size());
    }
}
