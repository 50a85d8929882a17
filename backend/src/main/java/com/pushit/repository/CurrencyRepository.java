package com.pushit.repository;

import com.pushit.entity.Currency;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface CurrencyRepository extends JpaRepository<Currency, Long> {

    Optional<Currency> findByCode(String code);

    @Query("SELECT c FROM Currency c WHERE c.isDefault = true")
    List<Currency> findDefaults();

    @Query("SELECT c FROM Currency c WHERE c.isActive = true ORDER BY c.code")
    List<Currency> findActive();

    @Query("SELECT COUNT(c) FROM Currency c WHERE c.isDefault = true")
    long countDefaults();

    /** Clears the default flag on every row except the given one. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "UPDATE Currency c SET c.isDefault = false"
                    + " WHERE c.isDefault = true AND c.id <> :keepId")
    int clearDefaultExcept(@Param("keepId") Long keepId);
}
