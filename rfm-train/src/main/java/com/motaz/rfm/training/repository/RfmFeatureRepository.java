package com.motaz.rfm.training.repository;

import com.motaz.rfm.training.model.RfmFeatureEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface RfmFeatureRepository extends JpaRepository<RfmFeatureEntity, Long> {

    /** Bulk delete, executed immediately so that re-inserted rows never collide on (customer_id, calc_date). */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RfmFeatureEntity e WHERE e.calcDate = :calcDate")
    int deleteAllByCalcDate(@Param("calcDate") LocalDateTime calcDate);

    Optional<RfmFeatureEntity> findByCustomerIdAndCalcDate(String customerId, LocalDateTime calcDate);

    List<RfmFeatureEntity> findByCalcDateAndCustomerIdIn(LocalDateTime calcDate, Collection<String> customerIds);

    List<RfmFeatureEntity> findByCalcDate(LocalDateTime calcDate);

    @Query("SELECT MAX(e.calcDate) FROM RfmFeatureEntity e WHERE e.customerId = :customerId")
    Optional<LocalDateTime> findLatestCalcDateByCustomerId(@Param("customerId") String customerId);
}
