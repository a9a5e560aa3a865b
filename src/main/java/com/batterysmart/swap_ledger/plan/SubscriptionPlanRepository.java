package com.batterysmart.swap_ledger.plan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubscriptionPlanRepository extends JpaRepository<SubscriptionPlanEntity, UUID> {

    Optional<SubscriptionPlanEntity> findByCode(String code);

    List<SubscriptionPlanEntity> findByActiveTrueOrderByPriceAsc();
}
