package com.motaz.rfm.api.services;

import com.motaz.rfm.api.dto.CustomerDetailDto;
import com.motaz.rfm.api.exception.ResourceNotFoundException;
import com.motaz.rfm.training.model.CustomerClusterEntity;
import com.motaz.rfm.training.model.CustomerEntity;
import com.motaz.rfm.training.model.RfmFeatureEntity;
import com.motaz.rfm.training.repository.CustomerClusterRepository;
import com.motaz.rfm.training.repository.CustomerRepository;
import com.motaz.rfm.training.repository.RfmFeatureRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CustomerQueryServiceTest {

    private static final LocalDateTime CALC_DATE = LocalDateTime.of(2024, 6, 30, 0, 0);

    @Mock private CustomerRepository customerRepository;
    @Mock private RfmFeatureRepository rfmFeatureRepository;
    @Mock private CustomerClusterRepository customerClusterRepository;
    private CustomerQueryService queryService;

    @BeforeEach
    void setUp() {
        queryService = new CustomerQueryService(customerRepository, rfmFeatureRepository, customerClusterRepository);
        CustomerEntity customer = new CustomerEntity();
        customer.setCustomerId("C001");
        customer.setEmail("c001@example.com");
        customer.setCountry("NL");
        when(customerRepository.findByCustomerId("C001")).thenReturn(Optional.of(customer));
    }

    @Test
    @DisplayName("Should fail for an unknown customer")
    void shouldFailForUnknownCustomer() {
        when(customerRepository.findByCustomerId("X1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> queryService.getCustomer("X1", null))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Customer with identifier 'X1' not found");
    }

    @Test
    @DisplayName("Should return nulls when the customer was never part of a run")
    void shouldReturnEmptyDetailWithoutRuns() {
        when(rfmFeatureRepository.findLatestCalcDateByCustomerId("C001")).thenReturn(Optional.empty());

        CustomerDetailDto detail = queryService.getCustomer("C001", null);

        assertThat(detail.getEmail()).isEqualTo("c001@example.com");
        assertThat(detail.getRfm()).isNull();
        assertThat(detail.getSegment()).isNull();
        verifyNoInteractions(customerClusterRepository);
    }

    @Test
    @DisplayName("Should resolve the customer's latest calc date")
    void shouldUseLatestCalcDate() {
        // Given
        when(rfmFeatureRepository.findLatestCalcDateByCustomerId("C001")).thenReturn(Optional.of(CALC_DATE));
        RfmFeatureEntity feature = new RfmFeatureEntity();
        feature.setCustomerId("C001");
        feature.setCalcDate(CALC_DATE);
        feature.setWindowDays(365);
        feature.setRecencyDays(5);
        feature.setFrequency(2);
        feature.setMonetary(new BigDecimal("250.00"));
        when(rfmFeatureRepository.findByCustomerIdAndCalcDate("C001", CALC_DATE)).thenReturn(Optional.of(feature));
        CustomerClusterEntity cluster = new CustomerClusterEntity();
        cluster.setCustomerId("C001");
        cluster.setCalcDate(CALC_DATE);
        cluster.setClusterId(0);
        cluster.setSegmentName("Champions");
        cluster.setClusterScore(Map.of("distance_to_centroid", 0.0));
        when(customerClusterRepository.findByCustomerIdAndCalcDate("C001", CALC_DATE)).thenReturn(Optional.of(cluster));

        // When
        CustomerDetailDto detail = queryService.getCustomer("C001", null);

        // Then
        assertThat(detail.getRfm().getRecencyDays()).isEqualTo(5);
        assertThat(detail.getRfm().getMonetary()).isEqualByComparingTo("250.00");
        assertThat(detail.getSegment().getSegmentName()).isEqualTo("Champions");
        assertThat(detail.getSegment().getClusterScore()).containsEntry("distance_to_centroid", 0.0);
    }

    @Test
    @DisplayName("Should leave RFM and segment null for a calc date without rows")
    void shouldHandleExplicitCalcDateWithoutRows() {
        LocalDateTime other = CALC_DATE.minusDays(30);
        when(rfmFeatureRepository.findByCustomerIdAndCalcDate("C001", other)).thenReturn(Optional.empty());
        when(customerClusterRepository.findByCustomerIdAndCalcDate("C001", other)).thenReturn(Optional.empty());

        CustomerDetailDto detail = queryService.getCustomer("C001", other);

        assertThat(detail.getRfm()).isNull();
        assertThat(detail.getSegment()).isNull();
        verify(rfmFeatureRepository, never()).findLatestCalcDateByCustomerId(anyString());
    }
}
