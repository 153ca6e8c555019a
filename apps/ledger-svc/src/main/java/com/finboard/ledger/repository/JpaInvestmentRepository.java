package com.finboard.ledger.repository;

import com.finboard.ledger.entity.InvestmentEntity;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface JpaInvestmentRepository extends JpaRepository<InvestmentEntity, UUID> {

    List<InvestmentEntity> findByAccountId(UUID accountId);

    @Modifying
    @Query("DELETE FROM InvestmentEntity i WHERE i.accountId = :accountId")
    int deleteByAccountId(@Param("accountId") UUID accountId);

    /**
     * Writes the last observed price without loading the row; returns 0 when the holding no longer exists.
     */
    @Transactional
    @Modifying
    @Query("UPDATE InvestmentEntity i SET i.currentPrice = :price WHERE i.id = :id")
    int updateCurrentPrice(@Param("id") UUID id, @Param("price") BigDecimal price);
}
