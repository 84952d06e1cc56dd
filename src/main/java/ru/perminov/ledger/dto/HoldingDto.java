package ru.perminov.ledger.dto;

import lombok.Data;
import ru.perminov.ledger.model.Holding;
import ru.perminov.ledger.model.Investment;

import java.math.BigDecimal;

import static ru.perminov.ledger.util.FixedPoint.unscale;

@Data
public class HoldingDto {
    private Long id;
    private Long accountId;
    private Long investmentId;
    private String investmentDescription;
    private String investmentPublicId;
    private String currencyCode;
    private BigDecimal quantity;
    private BigDecimal averageCost;
    private long quantityScaled;
    private long averageCostScaled;

    public static HoldingDto from(Holding holding) {
        Investment investment = holding.getInvestment();
        HoldingDto dto = new HoldingDto();
        dto.setId(holding.getId());
        dto.setAccountId(holding.getAccount().getId());
        dto.setInvestmentId(investment.getId());
        dto.setInvestmentDescription(investment.getDescription());
        dto.setInvestmentPublicId(investment.getPublicId());
        dto.setCurrencyCode(investment.getCurrency().getCode());
        dto.setQuantity(unscale(holding.getQuantity()));
        dto.setAverageCost(unscale(holding.getAverageCost()));
        dto.setQuantityScaled(holding.getQuantity());
        dto.setAverageCostScaled(holding.getAverageCost());
        return dto;
    }
}
