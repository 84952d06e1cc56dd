package ru.perminov.ledger.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
public class HoldingValuation {

    public enum Status {
        VALUED,
        NO_PRICE,
        NO_RATE
    }

    private Long holdingId;
    private Long investmentId;
    private String publicId;
    private String description;
    private String currencyCode;
    private BigDecimal quantity;
    private BigDecimal averageCost;
    private BigDecimal bookValue;      // quantity x average cost, local currency
    private BigDecimal price;          // null without a price
    private LocalDate priceDate;
    private BigDecimal rate;           // null for the base currency or without a rate
    private LocalDate rateDate;
    private BigDecimal valueLocal;     // null without a price
    private BigDecimal valueBase;      // zero when not computable
    private Status status;
}
