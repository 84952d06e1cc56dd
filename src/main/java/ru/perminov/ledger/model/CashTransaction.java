package ru.perminov.ledger.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Append-only cash ledger row. {@link #amount} is the signed effect on the account balance and
 * {@link #balanceAfter} the balance right after this row was written, both x10000.
 */
@Getter
@Setter
@Entity
@Immutable
@Table(name = "cash_transactions",
       indexes = {
           @Index(name = "idx_cash_transactions_account_date", columnList = "account_id,transaction_date"),
           @Index(name = "idx_cash_transactions_reverses", columnList = "reverses_transaction_id")
       })
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"account", "holdingMovement"})
public class CashTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "account_id", nullable = false)
    private Account account;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "holding_movement_id")
    private HoldingMovement holdingMovement;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 12)
    private CashTransactionType transactionType;

    @Column(name = "transaction_date", nullable = false)
    private LocalDate transactionDate;

    @Column(nullable = false)
    private long amount;

    @Column(name = "balance_after", nullable = false)
    private long balanceAfter;

    @Column(name = "reverses_transaction_id")
    private Long reversesTransactionId;

    @Column(length = 255)
    private String notes;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
