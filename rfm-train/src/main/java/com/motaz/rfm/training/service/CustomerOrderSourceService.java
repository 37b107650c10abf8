package com.motaz.rfm.training.service;

import com.motaz.rfm.training.dto.OrderRecord;
import com.motaz.rfm.training.model.CustomerEntity;
import com.motaz.rfm.training.model.OrderEntity;
import com.motaz.rfm.training.repository.CustomerRepository;
import com.motaz.rfm.training.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerOrderSourceService {

    private final CustomerRepository customerRepository;
    private final OrderRepository orderRepository;

    @Transactional(readOnly = true)
    public Set<String> loadCustomerIds() {
        Set<String> customerIds = customerRepository.findAllByOrderByCustomerIdAsc().stream()
                .map(CustomerEntity::getCustomerId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        log.info("Found {} customers", customerIds.size());
        return customerIds;
    }

    @Transactional(readOnly = true)
    public List<OrderRecord> loadOrders(LocalDateTime calcDate) {
        //TODO: Stream orders with a fetch size instead of loading the full history into memory
        List<OrderRecord> orders = orderRepository.findAllByOrderDateLessThanEqualOrderByCustomerIdAscOrderDateAsc(calcDate)
                .stream()
                .map(CustomerOrderSourceService::toRecord)
                .toList();
        log.info("Found {} orders up to calcDate: {}", orders.size(), calcDate);
        return orders;
    }

    private static OrderRecord toRecord(OrderEntity order) {
        return OrderRecord.builder()
                .orderId(order.getOrderId())
                .customerId(order.getCustomerId())
                .orderDate(order.getOrderDate())
                .orderAmount(order.getOrderAmount())
                .status(order.getStatus())
                .currency(order.getCurrency())
                .build();
    }
}
