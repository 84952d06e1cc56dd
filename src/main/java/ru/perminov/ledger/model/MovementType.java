package ru.perminov.ledger.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum MovementType {
    BUY("buy"),
    SELL("sell"),
    ADJUSTMENT("adjustment");

    private final String code;

    MovementType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Optional<MovementType> fromCode(String code) {
        return Arrays.stream(values()).filter(t -> t.code.equals(code)).findFirst();
    }
}
