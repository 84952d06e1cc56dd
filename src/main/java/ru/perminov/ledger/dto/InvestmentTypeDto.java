package ru.perminov.ledger.dto;

import ru.perminov.ledger.model.InvestmentType;

public record InvestmentTypeDto(Long id, String shortDescription, String description, String usageNotes) {

    public static InvestmentTypeDto from(InvestmentType type) {
        return new InvestmentTypeDto(type.getId(), type.getShortDescription(), type.getDescription(), type.getUsageNotes());
    }
}
