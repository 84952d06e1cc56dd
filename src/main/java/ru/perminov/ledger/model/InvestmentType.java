package ru.perminov.ledger.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Entity
@Table(name = "investment_types")
@NoArgsConstructor
@AllArgsConstructor
public class InvestmentType {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "short_description", nullable = false, unique = true, length = 8)
    private String shortDescription;

    @Column(nullable = false, length = 30)
    private String description;

    @Column(name = "usage_notes", length = 240)
    private String usageNotes;
}
