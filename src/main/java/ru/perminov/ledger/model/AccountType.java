package ru.perminov.ledger.model;

public enum AccountType {
    TRADING,
    ISA,
    SIPP
}
