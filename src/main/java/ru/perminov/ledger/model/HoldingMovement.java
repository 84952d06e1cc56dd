package ru.perminov.ledger.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Append-only audit record of a buy, sell or quantity adjustment. All amounts x10000.
 */
@Getter
@Setter
@Entity
@Immutable
@Table(name = "holding_movements",
       indexes = @Index(name = "idx_holding_movements_holding_date", columnList = "holding_id,movement_date"))
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "holding")
public class HoldingMovement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "holding_id", nullable = false)
    private Holding holding;

    @Enumerated(EnumType.STRING)
    @Column(name = "movement_type", nullable = false, length = 12)
    private MovementType movementType;

    @Column(name = "movement_date", nullable = false)
    private LocalDate movementDate;

    // signed delta for adjustments, positive otherwise
    @Column(nullable = false)
    private long quantity;

    // gross consideration
    @Column(name = "movement_value", nullable = false)
    private long movementValue;

    @Column(name = "deductible_costs", nullable = false)
    private long deductibleCosts;

    @Column(name = "book_cost", nullable = false)
    private long bookCost;

    @Column(name = "revised_avg_cost")
    private Long revisedAvgCost;

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
