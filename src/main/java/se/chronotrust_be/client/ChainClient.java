package se.chronotrust_be.client;

import se.chronotrust_be.exception.ChainRejectedException;
import se.chronotrust_be.exception.ChainUnavailableException;

import java.util.Optional;

/**
 * Narrow capability over the ledger network holding provenance tokens.
 * <p>
 * Submissions are keyed by {@code operationRef}: resubmitting the same reference must return the
 * receipt of the first accepted submission instead of applying the operation twice.
 */
public interface ChainClient {

    /**
     * @throws ChainUnavailableException when the network cannot be reached or times out (retryable)
     * @throws ChainRejectedException    when the network refuses the operation (not retryable)
     */
    ChainReceipt submit(String operationRef, ChainPayload payload);

    Optional<ChainAssetState> lookup(String assetCode);
}
