package ru.perminov.ledger.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;

@Getter
@Setter
@Entity
@Table(name = "holdings",
       uniqueConstraints = @UniqueConstraint(name = "uk_holdings_account_investment", columnNames = {"account_id", "investment_id"}))
@Check(constraints = "quantity >= 0")
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"account", "investment"})
public class Holding {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "account_id", nullable = false)
    private Account account;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "investment_id", nullable = false)
    private Investment investment;

    // x10000
    @Column(nullable = false)
    private long quantity;

    // Cost basis per unit in the investment's currency, x10000
    @Column(name = "average_cost", nullable = false)
    private long averageCost;
}
