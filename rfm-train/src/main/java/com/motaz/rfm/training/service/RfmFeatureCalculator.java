package com.motaz.rfm.training.service;

import com.motaz.rfm.training.dto.MonetaryFloorPolicy;
import com.motaz.rfm.training.dto.OrderRecord;
import com.motaz.rfm.training.dto.RfmVector;
import com.motaz.rfm.training.exception.InvalidParameterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Only completed orders in {@code (calcDate - windowDays, calcDate]} count.
 */
@Slf4j
@Component
public class RfmFeatureCalculator {

    private final MonetaryFloorPolicy monetaryFloorPolicy;

    public RfmFeatureCalculator(@Value("${rfm.features.monetary-floor-policy:FLOOR_AT_ZERO}") MonetaryFloorPolicy monetaryFloorPolicy) {
        this.monetaryFloorPolicy = monetaryFloorPolicy;
    }

    public List<RfmVector> calculate(Collection<String> customerIds, Collection<OrderRecord> orders,
                                     LocalDateTime calcDate, int windowDays) {
        if (windowDays <= 0) {
            throw new InvalidParameterException("window_days", windowDays, "must be greater than 0");
        }
        Map<String, List<OrderRecord>> ordersByCustomer = orders.stream()
                .collect(Collectors.groupingBy(OrderRecord::getCustomerId));

        // customers are independent of each other, order of the result follows customerIds
        List<RfmVector> vectors = new ArrayList<>(customerIds).parallelStream()
                .map(customerId -> calculate(customerId,
                        ordersByCustomer.getOrDefault(customerId, List.of()), calcDate, windowDays))
                .collect(Collectors.toList());
        log.info("Computed RFM features for {} customers, calcDate: {}, windowDays: {}",
                vectors.size(), calcDate, windowDays);
        return vectors;
    }

    public RfmVector calculate(String customerId, List<OrderRecord> customerOrders,
                               LocalDateTime calcDate, int windowDays) {
        LocalDateTime windowStart = calcDate.minusDays(windowDays);
        List<OrderRecord> qualifying = customerOrders.stream()
                .filter(OrderRecord::isCompleted)
                .filter(order -> order.getOrderDate().isAfter(windowStart) && !order.getOrderDate().isAfter(calcDate))
                .toList();

        if (qualifying.isEmpty()) {
            return RfmVector.builder()
                    .customerId(customerId)
                    .recencyDays(windowDays + 1)
                    .frequency(0)
                    .monetary(BigDecimal.ZERO)
                    .build();
        }

        LocalDateTime lastOrderDate = qualifying.stream()
                .map(OrderRecord::getOrderDate)
                .max(Comparator.naturalOrder())
                .orElseThrow();
        BigDecimal total = qualifying.stream()
                .map(OrderRecord::getOrderAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return RfmVector.builder()
                .customerId(customerId)
                .recencyDays((int) Duration.between(lastOrderDate, calcDate).toDays())
                .frequency(qualifying.size())
                .monetary(monetaryFloorPolicy.apply(total))
                .build();
    }
}
