package com.finboard.ledger.repository;

import com.finboard.ledger.entity.AccountEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaAccountRepository extends JpaRepository<AccountEntity, UUID> {

    List<AccountEntity> findByActiveTrue();

    long countByActiveTrue();
}
