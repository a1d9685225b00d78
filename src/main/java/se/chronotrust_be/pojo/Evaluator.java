package se.chronotrust_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import se.chronotrust_be.pojo.enums.EvaluatorTier;

@Entity
@Table(name = "evaluators")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Evaluator {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long evaluatorId;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private EvaluatorTier tier = EvaluatorTier.STANDARD;

    // null means the evaluator accepts any category
    @Column(length = 50)
    private String specialty;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private int openAssignments = 0;

    public boolean covers(String category) {
        return specialty == null || (category != null && specialty.equalsIgnoreCase(category));
    }
}
