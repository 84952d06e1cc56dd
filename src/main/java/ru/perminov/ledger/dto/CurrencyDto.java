package ru.perminov.ledger.dto;

import lombok.Data;
import ru.perminov.ledger.model.Currency;

@Data
public class CurrencyDto {
    private Long id;
    private String code;
    private String description;
    private boolean base;

    public static CurrencyDto from(Currency currency) {
        CurrencyDto dto = new CurrencyDto();
        dto.setId(currency.getId());
        dto.setCode(currency.getCode());
        dto.setDescription(currency.getDescription());
        dto.setBase(currency.isBase());
        return dto;
    }
}
