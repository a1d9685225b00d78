package se.chronotrust_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.chronotrust_be.dto.request.MintOrTransferRequest;
import se.chronotrust_be.dto.response.ApiResponse;
import se.chronotrust_be.dto.response.TokenRecordResponse;
import se.chronotrust_be.dto.response.TokenVerificationResponse;
import se.chronotrust_be.exception.ResourceNotFoundException;
import se.chronotrust_be.mapper.LifecycleMapper;
import se.chronotrust_be.service.LifecycleFacade;
import se.chronotrust_be.service.TokenizationService;
import se.chronotrust_be.util.ResultResponses;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tokens")
@RequiredArgsConstructor
@Tag(name = "Provenance Tokens", description = "On-chain ownership records of watches")
public class TokenController {

    private final LifecycleFacade lifecycleFacade;
    private final TokenizationService tokenizationService;
    private final LifecycleMapper mapper;

    @PostMapping
    @Operation(summary = "Mint or transfer token",
            description = "Mints the watch token on first use, transfers it from the current holder afterwards. Safe to retry.")
    public ResponseEntity<ApiResponse<TokenRecordResponse>> mintOrTransfer(@Valid @RequestBody MintOrTransferRequest request) {
        return ResultResponses.toResponse(
                lifecycleFacade.mintOrTransfer(request.getWatchId(), request.getNewOwnerKey(), request.getContractId()),
                HttpStatus.CREATED, "Token recorded");
    }

    @GetMapping("/watches/{watchId}/history")
    @Operation(summary = "Token history", description = "All records of the watch, oldest first")
    public ResponseEntity<ApiResponse<List<TokenRecordResponse>>> getHistory(@PathVariable Long watchId) {
        return ResponseEntity.ok(ApiResponse.success(mapper.toTokenResponses(tokenizationService.history(watchId))));
    }

    @GetMapping("/watches/{watchId}/current")
    @Operation(summary = "Current token holder")
    public ResponseEntity<ApiResponse<TokenRecordResponse>> getCurrentHolder(@PathVariable Long watchId) {
        return tokenizationService.currentHolder(watchId)
                .map(record -> ResponseEntity.ok(ApiResponse.success(mapper.toTokenResponse(record))))
                .orElseThrow(() -> new ResourceNotFoundException("Watch " + watchId + " has not been tokenized"));
    }

    @GetMapping("/watches/{watchId}/verify")
    @Operation(summary = "Verify token", description = "Compare the recorded holder with the chain")
    public ResponseEntity<ApiResponse<TokenVerificationResponse>> verify(@PathVariable Long watchId) {
        return ResponseEntity.ok(ApiResponse.success(tokenizationService.verify(watchId)));
    }
}
