package com.motaz.rfm.training.repository;

import com.motaz.rfm.training.model.CustomerClusterEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface CustomerClusterRepository extends JpaRepository<CustomerClusterEntity, Long> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CustomerClusterEntity e WHERE e.calcDate = :calcDate")
    int deleteAllByCalcDate(@Param("calcDate") LocalDateTime calcDate);

    @Query("SELECT MAX(e.calcDate) FROM CustomerClusterEntity e")
    Optional<LocalDateTime> findLatestCalcDate();

    Optional<CustomerClusterEntity> findByCustomerIdAndCalcDate(String customerId, LocalDateTime calcDate);

    List<CustomerClusterEntity> findByCalcDateOrderByCustomerIdAsc(LocalDateTime calcDate);

    List<CustomerClusterEntity> findByCalcDateAndSegmentNameOrderByCustomerIdAsc(LocalDateTime calcDate, String segmentName);

    Page<CustomerClusterEntity> findByCalcDateAndSegmentName(LocalDateTime calcDate, String segmentName, Pageable pageable);

    @Query("SELECT c.segmentName AS segmentName, c.clusterId AS clusterId, COUNT(c) AS customerCount, "
            + "AVG(f.recencyDays) AS avgRecencyDays, AVG(f.frequency) AS avgFrequency, AVG(f.monetary) AS avgMonetary "
            + "FROM CustomerClusterEntity c, RfmFeatureEntity f "
            + "WHERE c.customerId = f.customerId AND c.calcDate = f.calcDate AND c.calcDate = :calcDate "
            + "GROUP BY c.segmentName, c.clusterId ORDER BY c.clusterId")
    List<SegmentStatsView> findSegmentStats(@Param("calcDate") LocalDateTime calcDate);
}
