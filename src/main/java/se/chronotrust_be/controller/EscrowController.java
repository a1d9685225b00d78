package se.chronotrust_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.chronotrust_be.dto.request.ClearInterventionRequest;
import se.chronotrust_be.dto.request.CompleteEvaluationRequest;
import se.chronotrust_be.dto.request.ConfirmDeliveryRequest;
import se.chronotrust_be.dto.request.OpenEscrowRequest;
import se.chronotrust_be.dto.response.ApiResponse;
import se.chronotrust_be.dto.response.EscrowContractResponse;
import se.chronotrust_be.dto.response.SettlementResponse;
import se.chronotrust_be.exception.ResourceNotFoundException;
import se.chronotrust_be.mapper.LifecycleMapper;
import se.chronotrust_be.service.EscrowContractService;
import se.chronotrust_be.service.LifecycleFacade;
import se.chronotrust_be.service.SettlementService;
import se.chronotrust_be.util.ResultResponses;

import java.util.List;

@RestController
@RequestMapping("/api/v1/escrows")
@RequiredArgsConstructor
@Tag(name = "Escrow Contracts", description = "Open, resolve and expire escrow contracts for watch purchases")
public class EscrowController {

    private final LifecycleFacade lifecycleFacade;
    private final EscrowContractService escrowContractService;
    private final SettlementService settlementService;
    private final LifecycleMapper mapper;

    @PostMapping
    @Operation(summary = "Open escrow", description = "Hold the buyer's funds and lock the watch for evaluation")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Escrow opened"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid amount or request"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "402", description = "Insufficient funds"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Watch already in escrow")
    })
    public ResponseEntity<ApiResponse<EscrowContractResponse>> openEscrow(@Valid @RequestBody OpenEscrowRequest request) {
        return ResultResponses.toResponse(lifecycleFacade.openEscrow(request), HttpStatus.CREATED, "Escrow opened");
    }

    @GetMapping("/{contractId}")
    @Operation(summary = "Get escrow contract")
    public ResponseEntity<ApiResponse<EscrowContractResponse>> getContract(@PathVariable Long contractId) {
        return ResponseEntity.ok(ApiResponse.success(mapper.toContractResponse(escrowContractService.getContract(contractId))));
    }

    @GetMapping
    @Operation(summary = "List escrow contracts of a watch", description = "Newest first")
    public ResponseEntity<ApiResponse<List<EscrowContractResponse>>> getContractsForWatch(
            @Parameter(description = "Watch ID") @RequestParam Long watchId) {
        return ResponseEntity.ok(ApiResponse.success(mapper.toContractResponses(escrowContractService.findByWatch(watchId))));
    }

    @GetMapping("/active")
    @Operation(summary = "Get the active escrow contract of a watch")
    public ResponseEntity<ApiResponse<EscrowContractResponse>> getActiveContract(
            @Parameter(description = "Watch ID") @RequestParam Long watchId) {
        return escrowContractService.findActiveForWatch(watchId)
                .map(contract -> ResponseEntity.ok(ApiResponse.success(mapper.toContractResponse(contract))))
                .orElseThrow(() -> new ResourceNotFoundException("Watch " + watchId + " has no active escrow contract"));
    }

    @GetMapping("/flagged")
    @Operation(summary = "Contracts waiting for manual intervention")
    public ResponseEntity<ApiResponse<List<EscrowContractResponse>>> getFlaggedContracts() {
        return ResponseEntity.ok(ApiResponse.success(mapper.toContractResponses(escrowContractService.findFlaggedForIntervention())));
    }

    @PostMapping("/{contractId}/evaluations/{evaluationId}/result")
    @Operation(summary = "Submit evaluation result",
            description = "Move an awaiting contract to APPROVED or REJECTED. Normally triggered by completing the evaluation.")
    public ResponseEntity<ApiResponse<EscrowContractResponse>> submitEvaluation(
            @PathVariable Long contractId,
            @PathVariable Long evaluationId,
            @Valid @RequestBody CompleteEvaluationRequest request) {
        return ResultResponses.toResponse(
                lifecycleFacade.submitEvaluation(contractId, evaluationId, request.getResult()), "Evaluation result submitted");
    }

    @PostMapping("/{contractId}/confirm-delivery")
    @Operation(summary = "Confirm delivery",
            description = "Seller confirms handover or buyer confirms receipt. Both are needed before an approved contract is released.")
    public ResponseEntity<ApiResponse<EscrowContractResponse>> confirmDelivery(
            @PathVariable Long contractId,
            @Valid @RequestBody ConfirmDeliveryRequest request) {
        return ResultResponses.toResponse(
                lifecycleFacade.confirmDelivery(contractId, request.getParty(), request.getUserId()), "Delivery confirmed");
    }

    @PostMapping("/{contractId}/resolve")
    @Operation(summary = "Resolve escrow",
            description = "APPROVED: tokenize to the buyer and pay the seller. REJECTED: refund the buyer.")
    public ResponseEntity<ApiResponse<EscrowContractResponse>> resolve(@PathVariable Long contractId) {
        return ResultResponses.toResponse(lifecycleFacade.resolve(contractId), "Escrow resolved");
    }

    @PostMapping("/{contractId}/expire")
    @Operation(summary = "Expire escrow", description = "Refund a contract whose deadline passed before evaluation finished")
    public ResponseEntity<ApiResponse<EscrowContractResponse>> expire(@PathVariable Long contractId) {
        return ResultResponses.toResponse(lifecycleFacade.expire(contractId), "Escrow expired");
    }

    @PostMapping("/{contractId}/clear-intervention")
    @Operation(summary = "Clear manual intervention flag", description = "Optionally corrects the buyer's chain key")
    public ResponseEntity<ApiResponse<EscrowContractResponse>> clearManualIntervention(
            @PathVariable Long contractId,
            @Valid @RequestBody(required = false) ClearInterventionRequest request) {
        String correctedKey = request != null ? request.getCorrectedBuyerChainKey() : null;
        return ResultResponses.toResponse(
                lifecycleFacade.clearManualIntervention(contractId, correctedKey), "Manual intervention cleared");
    }

    @GetMapping("/{contractId}/settlement")
    @Operation(summary = "Get settlement breakdown", description = "Commission and seller proceeds of a released contract")
    public ResponseEntity<ApiResponse<SettlementResponse>> getSettlement(@PathVariable Long contractId) {
        return ResponseEntity.ok(ApiResponse.success(mapper.toSettlementResponse(settlementService.getCommission(contractId))));
    }
}
