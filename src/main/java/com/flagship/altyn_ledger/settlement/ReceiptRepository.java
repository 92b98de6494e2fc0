package com.flagship.altyn_ledger.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReceiptRepository extends JpaRepository<ReceiptEntity, UUID> {

    Optional<ReceiptEntity> findByTransactionId(UUID transactionId);
}
