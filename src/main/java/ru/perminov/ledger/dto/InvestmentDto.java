package ru.perminov.ledger.dto;

import lombok.Data;
import ru.perminov.ledger.model.Investment;

@Data
public class InvestmentDto {
    private Long id;
    private Long currencyId;
    private String currencyCode;
    private Long investmentTypeId;
    private String investmentType;
    private String description;
    private String publicId;
    private String investmentUrl;
    private String selector;

    public static InvestmentDto from(Investment investment) {
        InvestmentDto dto = new InvestmentDto();
        dto.setId(investment.getId());
        dto.setCurrencyId(investment.getCurrency().getId());
        dto.setCurrencyCode(investment.getCurrency().getCode());
        dto.setInvestmentTypeId(investment.getInvestmentType().getId());
        dto.setInvestmentType(investment.getInvestmentType().getShortDescription());
        dto.setDescription(investment.getDescription());
        dto.setPublicId(investment.getPublicId());
        dto.setInvestmentUrl(investment.getInvestmentUrl());
        dto.setSelector(investment.getSelector());
        return dto;
    }
}
