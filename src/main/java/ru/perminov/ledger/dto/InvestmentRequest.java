package ru.perminov.ledger.dto;

public record InvestmentRequest(Long currencyId, Long investmentTypeId, String description, String publicId,
                                String investmentUrl, String selector) {
}
