package com.pushit.repository;

import com.pushit.entity.PaymentMethod;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface PaymentMethodRepository extends JpaRepository<PaymentMethod, Long> {

    @Query(
            "SELECT pm FROM PaymentMethod pm WHERE pm.influencer.id = :influencerId"
                    + " ORDER BY pm.isDefault DESC, pm.createdAt DESC")
    List<PaymentMethod> findByInfluencer(@Param("influencerId") Long influencerId);

    @Query(
            "SELECT pm FROM PaymentMethod pm WHERE pm.influencer.id = :influencerId"
                    + " AND pm.isDefault = true")
    List<PaymentMethod> findDefaults(@Param("influencerId") Long influencerId);

    long countByInfluencerId(Long influencerId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "UPDATE PaymentMethod pm SET pm.isDefault = false"
                    + " WHERE pm.influencer.id = :influencerId AND pm.isDefault = true"
                    + " AND pm.id <> :keepId")
    int clearDefaultExcept(
            @Param("influencerId") Long influencerId, @Param("keepId") Long keepId);

    default Optional<PaymentMethod> findDefault(Long influencerId) {
        return findDefaults(influencerId).stream().findFirst();
    }
}
