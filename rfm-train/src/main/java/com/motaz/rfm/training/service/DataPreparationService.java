package com.motaz.rfm.training.service;

import com.motaz.rfm.training.dto.OrderRecord;
import com.motaz.rfm.training.model.CustomerEntity;
import com.motaz.rfm.training.model.OrderEntity;
import com.motaz.rfm.training.repository.CustomerRepository;
import com.motaz.rfm.training.repository.OrderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

@Slf4j
@Component
public class DataPreparationService {

    private static final String[] COUNTRIES = {"NL", "BE", "DE", "FR"};
    private static final String CURRENCY = "EUR";

    private final CustomerRepository customerRepository;
    private final OrderRepository orderRepository;
    private final int customers;
    private final long seed;

    public DataPreparationService(CustomerRepository customerRepository,
                                  OrderRepository orderRepository,
                                  @Value("${rfm.demo.customers:500}") int customers,
                                  @Value("${rfm.demo.seed:42}") long seed) {
        this.customerRepository = customerRepository;
        this.orderRepository = orderRepository;
        this.customers = customers;
        this.seed = seed;
    }

    @Transactional
    public int prepareData(LocalDateTime calcDate, int windowDays) {
        if (customerRepository.count() > 0) {
            log.info("Customers already present, skipping demo data preparation");
            return 0;
        }
        Random rnd = new Random(seed);
        List<CustomerEntity> customerEntityList = new ArrayList<>();
        List<OrderEntity> orderEntityList = new ArrayList<>();
        // history reaches past the window so that some orders fall outside of it
        int historyDays = windowDays + windowDays / 2;

        for (int c = 1; c <= customers; c++) {
            String customerId = String.format("C%03d", c);
            CustomerEntity customerEntity = new CustomerEntity();
            customerEntity.setCustomerId(customerId);
            customerEntity.setEmail(customerId.toLowerCase() + "@example.com");
            customerEntity.setCountry(COUNTRIES[rnd.nextInt(COUNTRIES.length)]);
            customerEntity.setCreatedAt(calcDate.minusDays(historyDays).toInstant(ZoneOffset.UTC));
            customerEntityList.add(customerEntity);

            // ~10% of customers never order
            if (rnd.nextDouble() < 0.10) continue;

            double meanAmount = 20 + rnd.nextDouble() * 180;   // 20..200
            int orderCount = 1 + rnd.nextInt(25);
            // active customers order close to calcDate, churned ones only long ago
            int lastActiveDaysAgo = rnd.nextDouble() < 0.3 ? rnd.nextInt(historyDays) : rnd.nextInt(30);
            for (int i = 0; i < orderCount; i++) {
                int daysAgo = lastActiveDaysAgo + rnd.nextInt(Math.max(1, historyDays - lastActiveDaysAgo));
                double amount = Math.max(1, meanAmount + rnd.nextGaussian() * meanAmount * 0.3);
                String status = OrderRecord.STATUS_COMPLETED;
                double roll = rnd.nextDouble();
                if (roll < 0.05) {
                    status = "cancelled";
                } else if (roll < 0.07) {
                    status = "refunded";
                } else if (roll < 0.10) {
                    amount = -amount;   // refund booked as a negative completed order
                }

                OrderEntity orderEntity = new OrderEntity();
                orderEntity.setOrderId(String.format("O%s-%03d", customerId, i));
                orderEntity.setCustomerId(customerId);
                orderEntity.setOrderDate(calcDate.minusDays(daysAgo).minusMinutes(rnd.nextInt(24 * 60)));
                orderEntity.setOrderAmount(BigDecimal.valueOf(amount).setScale(2, RoundingMode.HALF_UP));
                orderEntity.setCurrency(CURRENCY);
                orderEntity.setStatus(status);
                orderEntityList.add(orderEntity);
            }
        }
        customerRepository.saveAll(customerEntityList);
        orderRepository.saveAll(orderEntityList);
        log.info("Prepared {} customers and {} orders", customerEntityList.size(), orderEntityList.size());
        return customerEntityList.size();
    }
}
