package se.chronotrust_be.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.chronotrust_be.pojo.enums.CommissionBeneficiary;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementResponse {

    private Long contractId;
    private String holdReference;
    private String currency;
    private BigDecimal grossAmount;
    private BigDecimal rate;
    private BigDecimal commission;
    private BigDecimal platformShare;
    private BigDecimal evaluatorShare;
    private BigDecimal sellerAmount;
    private CommissionBeneficiary beneficiary;
}
