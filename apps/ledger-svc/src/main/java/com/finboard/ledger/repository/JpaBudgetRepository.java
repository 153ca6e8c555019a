package com.finboard.ledger.repository;

import com.finboard.ledger.entity.BudgetEntity;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface JpaBudgetRepository extends JpaRepository<BudgetEntity, UUID> {

    Optional<BudgetEntity> findByCategory(String category);

    boolean existsByCategory(String category);

    /**
     * Writes the cached spend without loading the row; returns 0 when the budget no longer exists.
     */
    @Transactional
    @Modifying
    @Query("UPDATE BudgetEntity b SET b.spent = :spent WHERE b.id = :id")
    int updateSpent(@Param("id") UUID id, @Param("spent") BigDecimal spent);
}
