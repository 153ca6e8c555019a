package com.finboard.ledger.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "budgets")
public class BudgetEntity {
    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "category", nullable = false, unique = true)
    private String category;

    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "period", nullable = false, length = 32)
    private String period;

    // snapshot as of the last read, see BudgetTracker#refreshSpent
    @Column(name = "spent", nullable = false, precision = 19, scale = 4)
    private BigDecimal spent;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    // Default constructor for JPA
    public BudgetEntity() {}

    public BudgetEntity(UUID id, String category, BigDecimal amount, String period, Instant createdAt) {
        this.id = id;
        this.category = category;
        this.amount = amount;
        this.period = period;
        this.spent = BigDecimal.ZERO;
        this.createdAt = createdAt;
    }

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public BigDecimal getAmount() { return amount; }
    public void setAmount(BigDecimal amount) { this.amount = amount; }

    public String getPeriod() { return period; }
    public void setPeriod(String period) { this.period = period; }

    public BigDecimal getSpent() { return spent; }
    public void setSpent(BigDecimal spent) { this.spent = spent; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
