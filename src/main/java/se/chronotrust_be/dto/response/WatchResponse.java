package se.chronotrust_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.chronotrust_be.pojo.enums.WatchStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WatchResponse {

    private Long watchId;
    private String serialNumber;
    private String brand;
    private String model;
    private String category;
    private String description;
    private BigDecimal listedPrice;
    private String currency;
    private Long ownerId;
    private WatchStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
