package ru.perminov.ledger.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * Units of {@link #currency} per one unit of the base currency, scaled by 10000.
 */
@Getter
@Setter
@Entity
@Table(name = "exchange_rates",
       uniqueConstraints = @UniqueConstraint(name = "uk_exchange_rates_currency_date", columnNames = {"currency_id", "rate_date"}),
       indexes = @Index(name = "idx_exchange_rates_lookup", columnList = "currency_id,rate_date"))
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "currency")
public class ExchangeRate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "currency_id", nullable = false)
    private Currency currency;

    @Column(name = "rate_date", nullable = false)
    private LocalDate rateDate;

    @Column(nullable = false)
    private long rate;
}
