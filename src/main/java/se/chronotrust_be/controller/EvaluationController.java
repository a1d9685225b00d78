package se.chronotrust_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.chronotrust_be.dto.request.CompleteEvaluationRequest;
import se.chronotrust_be.dto.request.DisputeRequest;
import se.chronotrust_be.dto.request.EvaluationRequest;
import se.chronotrust_be.dto.response.ApiResponse;
import se.chronotrust_be.dto.response.EvaluationResponse;
import se.chronotrust_be.mapper.LifecycleMapper;
import se.chronotrust_be.service.EvaluationService;
import se.chronotrust_be.service.LifecycleFacade;
import se.chronotrust_be.util.ResultResponses;

import java.util.List;

@RestController
@RequestMapping("/api/v1/evaluations")
@RequiredArgsConstructor
@Tag(name = "Evaluations", description = "Evaluator assignment, certification and disputes")
public class EvaluationController {

    private final LifecycleFacade lifecycleFacade;
    private final EvaluationService evaluationService;
    private final LifecycleMapper mapper;

    @PostMapping
    @Operation(summary = "Request evaluation", description = "Assign an evaluator to a funded escrow contract")
    public ResponseEntity<ApiResponse<EvaluationResponse>> requestEvaluation(@Valid @RequestBody EvaluationRequest request) {
        return ResultResponses.toResponse(
                lifecycleFacade.requestEvaluation(request.getWatchId(), request.getContractId()),
                HttpStatus.CREATED, "Evaluation requested");
    }

    @PostMapping("/{evaluationId}/complete")
    @Operation(summary = "Complete evaluation",
            description = "Record CERTIFIED or REJECTED once. Repeating the same result is accepted without effect.")
    public ResponseEntity<ApiResponse<EvaluationResponse>> completeEvaluation(
            @PathVariable Long evaluationId,
            @Valid @RequestBody CompleteEvaluationRequest request) {
        return ResultResponses.toResponse(lifecycleFacade.completeEvaluation(evaluationId, request), "Evaluation completed");
    }

    @PostMapping("/{evaluationId}/dispute")
    @Operation(summary = "Dispute evaluation", description = "Blocks release of the escrow until the dispute is cleared")
    public ResponseEntity<ApiResponse<EvaluationResponse>> flagDispute(
            @PathVariable Long evaluationId,
            @Valid @RequestBody DisputeRequest request) {
        return ResultResponses.toResponse(lifecycleFacade.flagDispute(evaluationId, request.getReason()), "Dispute recorded");
    }

    @DeleteMapping("/{evaluationId}/dispute")
    @Operation(summary = "Clear dispute")
    public ResponseEntity<ApiResponse<EvaluationResponse>> clearDispute(@PathVariable Long evaluationId) {
        return ResultResponses.toResponse(lifecycleFacade.clearDispute(evaluationId), "Dispute cleared");
    }

    @GetMapping("/{evaluationId}")
    @Operation(summary = "Get evaluation")
    public ResponseEntity<ApiResponse<EvaluationResponse>> getEvaluation(@PathVariable Long evaluationId) {
        return ResponseEntity.ok(ApiResponse.success(mapper.toEvaluationResponse(evaluationService.getEvaluation(evaluationId))));
    }

    @GetMapping
    @Operation(summary = "List evaluations of a contract")
    public ResponseEntity<ApiResponse<List<EvaluationResponse>>> getEvaluationsForContract(@RequestParam Long contractId) {
        return ResponseEntity.ok(ApiResponse.success(mapper.toEvaluationResponses(evaluationService.findByContract(contractId))));
    }
}
