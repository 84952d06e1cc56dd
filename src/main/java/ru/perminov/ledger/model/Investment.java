package ru.perminov.ledger.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * A tracked instrument. URL and selector are only read by the external price collector.
 */
@Getter
@Setter
@Entity
@Table(name = "investments",
       indexes = {
           @Index(name = "idx_investments_currency", columnList = "currency_id"),
           @Index(name = "idx_investments_type", columnList = "investment_type_id")
       })
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"currency", "investmentType"})
public class Investment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "currency_id", nullable = false)
    private Currency currency;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "investment_type_id", nullable = false)
    private InvestmentType investmentType;

    @Column(nullable = false, length = 60)
    private String description;

    @Column(name = "public_id", length = 20)
    private String publicId;

    @Column(name = "investment_url", length = 255)
    private String investmentUrl;

    @Column(name = "selector", length = 255)
    private String selector;
}
