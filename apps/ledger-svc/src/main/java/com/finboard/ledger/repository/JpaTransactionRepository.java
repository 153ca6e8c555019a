package com.finboard.ledger.repository;

import com.finboard.ledger.entity.TransactionEntity;
import com.finboard.ledger.model.TransactionType;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaTransactionRepository extends JpaRepository<TransactionEntity, UUID>,
        JpaSpecificationExecutor<TransactionEntity> {

    /**
     * Transactions dated inside {@code [from, to]}, both ends inclusive, oldest first.
     */
    List<TransactionEntity> findByTransactionDateBetweenOrderByTransactionDateAsc(Instant from, Instant to);

    List<TransactionEntity> findByCategoryAndTransactionTypeAndTransactionDateGreaterThanEqual(
            String category, TransactionType transactionType, Instant from);

    long countByTransactionDateGreaterThanEqual(Instant from);

    long countByAccountId(UUID accountId);

    @Modifying
    @Query("DELETE FROM TransactionEntity t WHERE t.accountId = :accountId")
    int deleteByAccountId(@Param("accountId") UUID accountId);

    @Query("SELECT DISTINCT t.category FROM TransactionEntity t WHERE t.category IS NOT NULL ORDER BY t.category")
    List<String> findDistinctCategories();
}
