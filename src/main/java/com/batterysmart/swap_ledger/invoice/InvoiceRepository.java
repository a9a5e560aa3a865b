package com.batterysmart.swap_ledger.invoice;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvoiceRepository extends JpaRepository<InvoiceEntity, UUID> {

    Optional<InvoiceEntity> findByInvoiceNumber(String invoiceNumber);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM InvoiceEntity i WHERE i.invoiceNumber = :number")
    Optional<InvoiceEntity> findByInvoiceNumberForUpdate(@Param("number") String invoiceNumber);

    Optional<InvoiceEntity> findFirstByDriverIdOrderByGeneratedAtDescInvoiceNumberDesc(UUID driverId);

    List<InvoiceEntity> findByDriverIdOrderByGeneratedAtDescInvoiceNumberDesc(UUID driverId, Pageable pageable);

    List<InvoiceEntity> findBySwapIdIn(List<UUID> swapIds);

    Optional<InvoiceEntity> findFirstBySwapId(UUID swapId);
}
