package com.pushit.repository;

import com.pushit.entity.PaymentTransaction;
import com.pushit.entity.TransactionStatus;
import com.pushit.entity.TransactionType;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, Long> {

    Optional<PaymentTransaction> findByReference(String reference);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM PaymentTransaction t WHERE t.reference = :reference")
    Optional<PaymentTransaction> findByReferenceWithLock(@Param("reference") String reference);

    boolean existsByCampaignIdAndTypeAndStatus(
            Long campaignId, TransactionType type, TransactionStatus status);

    List<PaymentTransaction> findByBrandIdOrderByCreatedAtDesc(Long brandId);
}
