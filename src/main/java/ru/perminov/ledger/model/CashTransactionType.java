package ru.perminov.ledger.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum CashTransactionType {
    DEPOSIT("deposit", true),
    WITHDRAWAL("withdrawal", true),
    DRAWDOWN("drawdown", true),
    ADJUSTMENT("adjustment", true),
    // written only alongside a holding movement
    BUY("buy", false),
    SELL("sell", false);

    private final String code;
    private final boolean manual;

    CashTransactionType(String code, boolean manual) {
        this.code = code;
        this.manual = manual;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isManual() {
        return manual;
    }

    public static Optional<CashTransactionType> fromCode(String code) {
        return Arrays.stream(values()).filter(t -> t.code.equals(code)).findFirst();
    }
}
