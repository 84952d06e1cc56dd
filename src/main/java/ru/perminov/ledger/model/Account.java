package ru.perminov.ledger.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

@Getter
@Setter
@Entity
@DynamicUpdate
@Table(name = "accounts",
       uniqueConstraints = @UniqueConstraint(name = "uk_accounts_user_type", columnNames = {"user_id", "account_type"}))
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "user")
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, length = 10)
    private AccountType accountType;

    @Column(name = "account_ref", nullable = false, length = 15)
    private String accountRef;

    // Base currency, x10000. Written only by the movement processor and the cash ledger.
    @Column(name = "cash_balance", nullable = false)
    private long cashBalance;

    // x10000, 0 disables the warning
    @Column(name = "warn_cash", nullable = false)
    private long warnCash;
}
