package se.chronotrust_be.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import se.chronotrust_be.exception.ChainRejectedException;
import se.chronotrust_be.util.StellarKeys;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process stand-in for the Stellar network. Keeps asset holders and accepted operations in
 * memory and applies the same acceptance rules the network would for the operations used here.
 */
@Component
@ConditionalOnProperty(name = "chronotrust.chain.mode", havingValue = "simulated", matchIfMissing = true)
@Slf4j
public class SimulatedStellarChainClient implements ChainClient {

    private final Map<String, ChainReceipt> receiptsByOperation = new ConcurrentHashMap<>();
    private final Map<String, ChainAssetState> assets = new ConcurrentHashMap<>();
    private final Clock clock;

    public SimulatedStellarChainClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ChainReceipt submit(String operationRef, ChainPayload payload) {
        ChainReceipt previous = receiptsByOperation.get(operationRef);
        if (previous != null) {
            log.info("Chain operation {} already accepted as {}", operationRef, previous.getTransactionHash());
            return previous;
        }

        if (!StellarKeys.isValidPublicKey(payload.getToKey())) {
            throw new ChainRejectedException("Malformed destination key for asset " + payload.getAssetCode());
        }

        ChainAssetState current = assets.get(payload.getAssetCode());
        switch (payload.getKind()) {
            case MINT -> {
                if (current != null) {
                    throw new ChainRejectedException("Asset " + payload.getAssetCode() + " already issued");
                }
            }
            case TRANSFER -> {
                if (current == null) {
                    throw new ChainRejectedException("Asset " + payload.getAssetCode() + " does not exist");
                }
                if (!current.getHolderKey().equals(payload.getFromKey())) {
                    throw new ChainRejectedException("Source account does not hold " + payload.getAssetCode());
                }
            }
        }

        String txHash = transactionHash(operationRef, payload);
        ChainReceipt receipt = ChainReceipt.builder()
                .transactionHash(txHash)
                .operationRef(operationRef)
                .submittedAt(clock.instant())
                .build();

        assets.put(payload.getAssetCode(), ChainAssetState.builder()
                .assetCode(payload.getAssetCode())
                .holderKey(payload.getToKey())
                .lastTransactionHash(txHash)
                .build());
        receiptsByOperation.put(operationRef, receipt);

        log.info("Simulated chain {} of {} to {} accepted: {}", payload.getKind(), payload.getAssetCode(),
                payload.getToKey(), txHash);
        return receipt;
    }

    @Override
    public Optional<ChainAssetState> lookup(String assetCode) {
        return Optional.ofNullable(assets.get(assetCode));
    }

    private static String transactionHash(String operationRef, ChainPayload payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String material = operationRef + "|" + payload.getKind() + "|" + payload.getAssetCode()
                    + "|" + payload.getFromKey() + "|" + payload.getToKey();
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
