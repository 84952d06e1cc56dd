package ru.perminov.ledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Getter
@Setter
@Entity
@Table(name = "prices",
       uniqueConstraints = @UniqueConstraint(name = "uk_prices_investment_date", columnNames = {"investment_id", "price_date"}),
       indexes = @Index(name = "idx_prices_lookup", columnList = "investment_id,price_date"))
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "investment")
public class Price {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "investment_id", nullable = false)
    private Investment investment;

    @Column(name = "price_date", nullable = false)
    private LocalDate priceDate;

    // x10000, in the investment's currency
    @Column(nullable = false)
    private long price;
}
