package se.chronotrust_be.client;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ChainReceipt {
    String transactionHash;
    String operationRef;
    Instant submittedAt;
}
