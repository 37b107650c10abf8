package com.motaz.rfm.api.services;

import com.motaz.rfm.api.dto.HealthResponseDto;
import com.motaz.rfm.training.repository.CustomerClusterRepository;
import com.motaz.rfm.training.repository.CustomerRepository;
import com.motaz.rfm.training.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class HealthService {

    static final String STATUS_OK = "ok";
    static final String STATUS_ERROR = "error";

    private final CustomerRepository customerRepository;
    private final OrderRepository orderRepository;
    private final CustomerClusterRepository customerClusterRepository;

    public HealthResponseDto health() {
        try {
            return HealthResponseDto.builder()
                    .status(STATUS_OK)
                    .database("connected")
                    .latestCalcDate(customerClusterRepository.findLatestCalcDate().orElse(null))
                    .totalCustomers(customerRepository.count())
                    .totalOrders(orderRepository.count())
                    .totalClusterAssignments(customerClusterRepository.count())
                    .build();
        } catch (DataAccessException e) {
            log.warn("Database check failed", e);
            return HealthResponseDto.builder()
                    .status(STATUS_ERROR)
                    .database("error: " + e.getMessage())
                    .build();
        }
    }
}
