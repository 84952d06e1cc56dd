package ru.perminov.ledger.dto;

public record UserRequest(String initials, String firstName, String lastName, String provider) {
}
