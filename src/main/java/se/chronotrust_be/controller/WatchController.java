package se.chronotrust_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import se.chronotrust_be.dto.request.ListingRequest;
import se.chronotrust_be.dto.request.RegisterWatchRequest;
import se.chronotrust_be.dto.response.ApiResponse;
import se.chronotrust_be.dto.response.TokenRecordResponse;
import se.chronotrust_be.dto.response.WatchResponse;
import se.chronotrust_be.mapper.LifecycleMapper;
import se.chronotrust_be.pojo.Watch;
import se.chronotrust_be.service.WatchService;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/watches")
@RequiredArgsConstructor
@Tag(name = "Watches", description = "Watch registry and listings")
public class WatchController {

    private final WatchService watchService;
    private final LifecycleMapper mapper;

    @PostMapping
    @Operation(summary = "Register watch", description = "Serial numbers are unique. A price lists the watch immediately.")
    public ResponseEntity<ApiResponse<WatchResponse>> registerWatch(@Valid @RequestBody RegisterWatchRequest request) {
        Watch watch = watchService.registerWatch(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Watch registered", mapper.toWatchResponse(watch)));
    }

    @GetMapping
    @Operation(summary = "List watches", description = "Watches for sale, or all watches of an owner")
    public ResponseEntity<ApiResponse<List<WatchResponse>>> getWatches(
            @Parameter(description = "Only watches of this owner") @RequestParam(required = false) Long ownerId) {
        List<Watch> watches = ownerId != null ? watchService.findByOwner(ownerId) : watchService.findListed();
        return ResponseEntity.ok(ApiResponse.success(watches.stream()
                .map(mapper::toWatchResponse)
                .collect(Collectors.toList())));
    }

    @GetMapping("/{watchId}")
    @Operation(summary = "Get watch")
    public ResponseEntity<ApiResponse<WatchResponse>> getWatch(@PathVariable Long watchId) {
        return ResponseEntity.ok(ApiResponse.success(mapper.toWatchResponse(watchService.getWatch(watchId))));
    }

    @PutMapping("/{watchId}/listing")
    @Operation(summary = "List watch for sale")
    public ResponseEntity<ApiResponse<WatchResponse>> listForSale(
            @PathVariable Long watchId,
            @Valid @RequestBody ListingRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Watch listed",
                mapper.toWatchResponse(watchService.listForSale(watchId, request))));
    }

    @DeleteMapping("/{watchId}/listing")
    @Operation(summary = "Delist watch")
    public ResponseEntity<ApiResponse<WatchResponse>> delist(@PathVariable Long watchId, @RequestParam Long ownerId) {
        return ResponseEntity.ok(ApiResponse.success("Watch delisted",
                mapper.toWatchResponse(watchService.delist(watchId, ownerId))));
    }

    @GetMapping("/{watchId}/ownership-history")
    @Operation(summary = "Ownership history", description = "Provenance token records of the watch, oldest first")
    public ResponseEntity<ApiResponse<List<TokenRecordResponse>>> getOwnershipHistory(@PathVariable Long watchId) {
        return ResponseEntity.ok(ApiResponse.success(mapper.toTokenResponses(watchService.ownershipHistory(watchId))));
    }
}
