package com.motaz.rfm.training.service;

import com.motaz.rfm.training.dto.ClusterAssignment;
import com.motaz.rfm.training.dto.RfmVector;
import com.motaz.rfm.training.dto.Segment;
import com.motaz.rfm.training.model.CustomerClusterEntity;
import com.motaz.rfm.training.model.RfmFeatureEntity;
import com.motaz.rfm.training.repository.CustomerClusterRepository;
import com.motaz.rfm.training.repository.RfmFeatureRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SegmentationCommitService.
 *
 * Tests verify:
 * - Existing rows for the calc date are deleted before the new rows are saved
 * - Entities carry the run's values
 * - A failing save propagates out of the transaction
 * - Commits for one calc date run one after another, other dates run alongside
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SegmentationCommitServiceTest {

    private static final LocalDateTime CALC_DATE = LocalDateTime.of(2024, 6, 30, 0, 0);
    private static final LocalDateTime OTHER_DATE = LocalDateTime.of(2024, 7, 31, 0, 0);

    @Mock private RfmFeatureRepository rfmFeatureRepository;
    @Mock private CustomerClusterRepository customerClusterRepository;
    @Mock private TransactionTemplate transactionTemplate;

    private SegmentationCommitService commitService;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        doAnswer(invocation -> {
            Consumer<TransactionStatus> action = invocation.getArgument(0);
            action.accept(mock(TransactionStatus.class));
            return null;
        }).when(transactionTemplate).executeWithoutResult(any(Consumer.class));

        commitService = new SegmentationCommitService(rfmFeatureRepository, customerClusterRepository, transactionTemplate);
    }

    @Test
    @DisplayName("Should delete rows of the calc date before saving the new ones")
    void shouldReplaceRowsOfCalcDate() {
        // Given
        when(rfmFeatureRepository.deleteAllByCalcDate(CALC_DATE)).thenReturn(2);
        when(customerClusterRepository.deleteAllByCalcDate(CALC_DATE)).thenReturn(2);

        // When
        commitService.commit(CALC_DATE, 365, List.of(vector()), List.of(assignment()));

        // Then
        InOrder inOrder = inOrder(rfmFeatureRepository, customerClusterRepository);
        inOrder.verify(rfmFeatureRepository).deleteAllByCalcDate(CALC_DATE);
        inOrder.verify(customerClusterRepository).deleteAllByCalcDate(CALC_DATE);
        inOrder.verify(rfmFeatureRepository).saveAll(anyList());
        inOrder.verify(customerClusterRepository).saveAll(anyList());
        verify(transactionTemplate, times(1)).executeWithoutResult(any());
    }

    @Test
    @DisplayName("Should map vectors and assignments to entities")
    @SuppressWarnings("unchecked")
    void shouldMapEntities() {
        commitService.commit(CALC_DATE, 180, List.of(vector()), List.of(assignment()));

        ArgumentCaptor<List<RfmFeatureEntity>> features = ArgumentCaptor.forClass(List.class);
        verify(rfmFeatureRepository).saveAll(features.capture());
        RfmFeatureEntity feature = features.getValue().get(0);
        assertThat(feature.getCustomerId()).isEqualTo("C001");
        assertThat(feature.getCalcDate()).isEqualTo(CALC_DATE);
        assertThat(feature.getWindowDays()).isEqualTo(180);
        assertThat(feature.getRecencyDays()).isEqualTo(5);
        assertThat(feature.getFrequency()).isEqualTo(2);
        assertThat(feature.getMonetary()).isEqualByComparingTo("250.00");

        ArgumentCaptor<List<CustomerClusterEntity>> clusters = ArgumentCaptor.forClass(List.class);
        verify(customerClusterRepository).saveAll(clusters.capture());
        CustomerClusterEntity cluster = clusters.getValue().get(0);
        assertThat(cluster.getCustomerId()).isEqualTo("C001");
        assertThat(cluster.getClusterId()).isEqualTo(1);
        assertThat(cluster.getSegmentName()).isEqualTo("Champions");
        assertThat(cluster.getClusterScore()).containsEntry("distance_to_centroid", 0.25);
    }

    @Test
    @DisplayName("Should propagate a failing save")
    void shouldPropagateFailure() {
        when(customerClusterRepository.saveAll(anyList())).thenThrow(new IllegalStateException("constraint violation"));

        assertThatThrownBy(() -> commitService.commit(CALC_DATE, 365, List.of(vector()), List.of(assignment())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("constraint violation");
    }

    @Test
    @DisplayName("Should hold a second commit for the same calc date until the first one has saved")
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldSerializeCommitsForSameCalcDate() throws Exception {
        // Given: the first delete blocks until released
        List<String> events = new CopyOnWriteArrayList<>();
        CountDownLatch firstInDelete = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicInteger deletes = new AtomicInteger();
        when(rfmFeatureRepository.deleteAllByCalcDate(CALC_DATE)).thenAnswer(invocation -> {
            int call = deletes.incrementAndGet();
            events.add("delete-" + call);
            if (call == 1) {
                firstInDelete.countDown();
                releaseFirst.await();
            }
            return 0;
        });
        when(customerClusterRepository.saveAll(anyList())).thenAnswer(invocation -> {
            events.add("save-" + deletes.get());
            return invocation.getArgument(0);
        });

        FutureTask<Void> first = commitTask(CALC_DATE);
        FutureTask<Void> second = commitTask(CALC_DATE);
        new Thread(first).start();
        firstInDelete.await();

        // When: the second commit starts while the first is inside its transaction
        Thread secondThread = new Thread(second);
        secondThread.start();
        while (secondThread.getState() != Thread.State.WAITING) {
            Thread.onSpinWait();
        }

        // Then
        assertThat(events).containsExactly("delete-1");
        releaseFirst.countDown();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
        assertThat(events).containsExactly("delete-1", "save-1", "delete-2", "save-2");
        assertThat(commitService.activeCalcDates()).isZero();
    }

    @Test
    @DisplayName("Should let a commit for another calc date finish while one is in progress")
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void shouldNotBlockOtherCalcDates() throws Exception {
        // Given
        CountDownLatch firstInDelete = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        when(rfmFeatureRepository.deleteAllByCalcDate(CALC_DATE)).thenAnswer(invocation -> {
            firstInDelete.countDown();
            releaseFirst.await();
            return 0;
        });
        FutureTask<Void> first = commitTask(CALC_DATE);
        new Thread(first).start();
        firstInDelete.await();

        // When
        FutureTask<Void> other = commitTask(OTHER_DATE);
        new Thread(other).start();

        // Then
        other.get(5, TimeUnit.SECONDS);
        assertThat(first.isDone()).isFalse();
        verify(rfmFeatureRepository).deleteAllByCalcDate(OTHER_DATE);
        assertThat(commitService.activeCalcDates()).isEqualTo(1);

        releaseFirst.countDown();
        first.get(5, TimeUnit.SECONDS);
        assertThat(commitService.activeCalcDates()).isZero();
    }

    @Test
    @DisplayName("Should drop the calc date lock after a failed commit")
    void shouldReleaseLockAfterFailure() {
        when(rfmFeatureRepository.saveAll(anyList())).thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> commitService.commit(CALC_DATE, 365, List.of(vector()), List.of(assignment())))
                .isInstanceOf(IllegalStateException.class);

        assertThat(commitService.activeCalcDates()).isZero();
    }

    private FutureTask<Void> commitTask(LocalDateTime calcDate) {
        return new FutureTask<>(() -> {
            commitService.commit(calcDate, 365, List.of(vector()), List.of(assignment()));
            return null;
        });
    }

    private static RfmVector vector() {
        return RfmVector.builder()
                .customerId("C001")
                .recencyDays(5)
                .frequency(2)
                .monetary(new BigDecimal("250.00"))
                .build();
    }

    private static ClusterAssignment assignment() {
        return ClusterAssignment.builder()
                .customerId("C001")
                .calcDate(CALC_DATE)
                .clusterId(1)
                .segment(Segment.CHAMPIONS)
                .clusterScore(Map.of("recency_days", 5, "frequency", 2,
                        "monetary", new BigDecimal("250.00"), "distance_to_centroid", 0.25))
                .build();
    }
}
