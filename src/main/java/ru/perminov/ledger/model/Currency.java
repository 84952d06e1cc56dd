package ru.perminov.ledger.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Entity
@Table(name = "currencies")
@NoArgsConstructor
@AllArgsConstructor
public class Currency {

    /** Reporting currency of every valuation; seeded at startup and never removed. */
    public static final String BASE_CODE = "GBP";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 3)
    private String code;

    @Column(nullable = false, length = 30)
    private String description;

    public boolean isBase() {
        return BASE_CODE.equals(code);
    }
}
