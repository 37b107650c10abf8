package com.motaz.rfm.training.service;

import com.motaz.rfm.training.dto.ClusterAssignment;
import com.motaz.rfm.training.dto.RfmVector;
import com.motaz.rfm.training.model.CustomerClusterEntity;
import com.motaz.rfm.training.model.RfmFeatureEntity;
import com.motaz.rfm.training.repository.CustomerClusterRepository;
import com.motaz.rfm.training.repository.RfmFeatureRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Commits for the same calc date are serialized.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SegmentationCommitService {

    private final RfmFeatureRepository rfmFeatureRepository;
    private final CustomerClusterRepository customerClusterRepository;
    private final TransactionTemplate transactionTemplate;

    // entries live only while a commit for the date holds or waits for the lock
    private final ConcurrentMap<LocalDateTime, CalcDateLock> calcDateLocks = new ConcurrentHashMap<>();

    public void commit(LocalDateTime calcDate, int windowDays, List<RfmVector> vectors, List<ClusterAssignment> assignments) {
        CalcDateLock lock = acquire(calcDate);
        try {
            transactionTemplate.executeWithoutResult(status -> {
                int removedFeatures = rfmFeatureRepository.deleteAllByCalcDate(calcDate);
                int removedClusters = customerClusterRepository.deleteAllByCalcDate(calcDate);
                log.info("Replacing calcDate: {}, removed {} feature rows and {} cluster rows",
                        calcDate, removedFeatures, removedClusters);

                rfmFeatureRepository.saveAll(vectors.stream()
                        .map(vector -> toEntity(vector, calcDate, windowDays))
                        .toList());
                customerClusterRepository.saveAll(assignments.stream()
                        .map(SegmentationCommitService::toEntity)
                        .toList());
            });
        } finally {
            release(calcDate, lock);
        }
        log.info("Committed {} feature rows and {} cluster rows for calcDate: {}", vectors.size(), assignments.size(), calcDate);
    }

    int activeCalcDates() {
        return calcDateLocks.size();
    }

    private CalcDateLock acquire(LocalDateTime calcDate) {
        CalcDateLock lock = calcDateLocks.compute(calcDate, (date, existing) -> {
            CalcDateLock held = existing == null ? new CalcDateLock() : existing;
            held.users++;
            return held;
        });
        lock.mutex.lock();
        return lock;
    }

    private void release(LocalDateTime calcDate, CalcDateLock lock) {
        lock.mutex.unlock();
        calcDateLocks.computeIfPresent(calcDate, (date, held) -> --held.users == 0 ? null : held);
    }

    private static RfmFeatureEntity toEntity(RfmVector vector, LocalDateTime calcDate, int windowDays) {
        RfmFeatureEntity rfmFeatureEntity = new RfmFeatureEntity();
        rfmFeatureEntity.setCustomerId(vector.getCustomerId());
        rfmFeatureEntity.setCalcDate(calcDate);
        rfmFeatureEntity.setWindowDays(windowDays);
        rfmFeatureEntity.setRecencyDays(vector.getRecencyDays());
        rfmFeatureEntity.setFrequency(vector.getFrequency());
        rfmFeatureEntity.setMonetary(vector.getMonetary());
        return rfmFeatureEntity;
    }

    private static CustomerClusterEntity toEntity(ClusterAssignment assignment) {
        CustomerClusterEntity customerClusterEntity = new CustomerClusterEntity();
        customerClusterEntity.setCustomerId(assignment.getCustomerId());
        customerClusterEntity.setCalcDate(assignment.getCalcDate());
        customerClusterEntity.setClusterId(assignment.getClusterId());
        customerClusterEntity.setSegmentName(assignment.getSegment().getDisplayName());
        customerClusterEntity.setClusterScore(assignment.getClusterScore());
        return customerClusterEntity;
    }

    private static final class CalcDateLock {
        private final ReentrantLock mutex = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
