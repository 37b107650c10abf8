package com.motaz.rfm.training.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.motaz.rfm.training.dto.IngestionResult;
import com.motaz.rfm.training.dto.OrderRecord;
import com.motaz.rfm.training.exception.IngestionException;
import com.motaz.rfm.training.model.CustomerEntity;
import com.motaz.rfm.training.model.OrderEntity;
import com.motaz.rfm.training.repository.CustomerRepository;
import com.motaz.rfm.training.repository.OrderRepository;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Upserts customers by {@code customer_id} and orders by {@code order_id}. A file is
 * validated completely before its transaction starts.
 */
@Slf4j
@Service
public class CsvIngestionService {

    static final String DEFAULT_CURRENCY = "EUR";

    private static final List<String> ORDER_COLUMNS = List.of("order_id", "customer_id", "order_date", "order_amount");
    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss"));
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"));

    private final CustomerRepository customerRepository;
    private final OrderRepository orderRepository;
    private final TransactionTemplate transactionTemplate;
    private final boolean enabled;
    private final Path customersFile;
    private final Path ordersFile;

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();

    public CsvIngestionService(CustomerRepository customerRepository,
                               OrderRepository orderRepository,
                               TransactionTemplate transactionTemplate,
                               @Value("${rfm.ingestion.enabled:false}") boolean enabled,
                               @Value("${rfm.ingestion.data-dir:./data/input}") String dataDir,
                               @Value("${rfm.ingestion.customers-file:customers.csv}") String customersFile,
                               @Value("${rfm.ingestion.orders-file:orders.csv}") String ordersFile) {
        this.customerRepository = customerRepository;
        this.orderRepository = orderRepository;
        this.transactionTemplate = transactionTemplate;
        this.enabled = enabled;
        this.customersFile = Path.of(dataDir).resolve(customersFile);
        this.ordersFile = Path.of(dataDir).resolve(ordersFile);
    }

    /**
     * Ingests both files. A failing file is reported in {@link IngestionResult#getErrors()}
     * and does not stop the other one.
     */
    public IngestionResult ingestAll() {
        List<String> errors = new ArrayList<>();
        if (!enabled) {
            log.debug("CSV ingestion disabled, skipping");
            return IngestionResult.builder().errors(errors).build();
        }
        int customers = 0;
        int orders = 0;
        try {
            customers = ingestCustomers(customersFile);
        } catch (IngestionException e) {
            log.warn("Customer ingestion failed: {}", e.getMessage());
            errors.add("Customer ingestion error: " + e.getMessage());
        }
        try {
            orders = ingestOrders(ordersFile);
        } catch (IngestionException e) {
            log.warn("Order ingestion failed: {}", e.getMessage());
            errors.add("Order ingestion error: " + e.getMessage());
        }
        return IngestionResult.builder()
                .customersIngested(customers)
                .ordersIngested(orders)
                .errors(errors)
                .build();
    }

    public int ingestCustomers(Path file) {
        CsvTable table = read(file, List.of("customer_id"));
        boolean hasCreatedAt = table.hasColumn("created_at");

        Map<String, CustomerEntity> parsed = new LinkedHashMap<>();
        for (Map<String, String> row : table.getRows()) {
            String customerId = text(row, "customer_id");
            if (customerId == null) continue;
            CustomerEntity customer = new CustomerEntity();
            customer.setCustomerId(customerId);
            customer.setEmail(text(row, "email"));
            customer.setCountry(text(row, "country"));
            if (hasCreatedAt) {
                customer.setCreatedAt(parseDate(text(row, "created_at"))
                        .map(date -> date.toInstant(ZoneOffset.UTC))
                        .orElse(null));
            }
            // a repeated id in the same file updates the earlier row
            parsed.merge(customerId, customer, (earlier, later) -> mergeCustomer(earlier, later, hasCreatedAt));
        }

        Integer inserted = transactionTemplate.execute(status -> {
            Map<String, CustomerEntity> existing = customerRepository.findByCustomerIdIn(parsed.keySet()).stream()
                    .collect(Collectors.toMap(CustomerEntity::getCustomerId, Function.identity()));
            List<CustomerEntity> toSave = new ArrayList<>(parsed.size());
            int created = 0;
            for (CustomerEntity customer : parsed.values()) {
                CustomerEntity current = existing.get(customer.getCustomerId());
                if (current == null) {
                    toSave.add(customer);
                    created++;
                } else {
                    toSave.add(mergeCustomer(current, customer, hasCreatedAt));
                }
            }
            customerRepository.saveAll(toSave);
            return created;
        });
        log.info("Ingested customers from {}, inserted: {}, updated: {}", file, inserted, parsed.size() - inserted);
        return inserted;
    }

    public int ingestOrders(Path file) {
        CsvTable table = read(file, ORDER_COLUMNS);

        Map<String, OrderRecord> parsed = new LinkedHashMap<>();
        for (Map<String, String> row : table.getRows()) {
            String orderId = text(row, "order_id");
            if (orderId == null) continue;
            OrderRecord order = OrderRecord.builder()
                    .orderId(orderId)
                    .customerId(text(row, "customer_id"))
                    .orderDate(parseDate(text(row, "order_date"))
                            .orElseThrow(() -> new IngestionException("Invalid order_date for order " + orderId)))
                    .orderAmount(parseAmount(orderId, text(row, "order_amount")))
                    .currency(Optional.ofNullable(text(row, "currency")).orElse(DEFAULT_CURRENCY))
                    .status(Optional.ofNullable(text(row, "status")).orElse(OrderRecord.STATUS_COMPLETED))
                    .build();
            if (order.getCustomerId() == null) {
                throw new IngestionException("Missing customer_id for order " + orderId);
            }
            parsed.put(orderId, order);
        }

        Integer inserted = transactionTemplate.execute(status -> {
            Map<String, OrderEntity> existing = orderRepository.findByOrderIdIn(parsed.keySet()).stream()
                    .collect(Collectors.toMap(OrderEntity::getOrderId, Function.identity()));
            List<OrderEntity> toSave = new ArrayList<>(parsed.size());
            int created = 0;
            for (OrderRecord order : parsed.values()) {
                OrderEntity entity = existing.get(order.getOrderId());
                if (entity == null) {
                    entity = new OrderEntity();
                    entity.setOrderId(order.getOrderId());
                    created++;
                }
                entity.setCustomerId(order.getCustomerId());
                entity.setOrderDate(order.getOrderDate());
                entity.setOrderAmount(order.getOrderAmount());
                entity.setCurrency(order.getCurrency());
                entity.setStatus(order.getStatus());
                toSave.add(entity);
            }
            orderRepository.saveAll(toSave);
            return created;
        });
        log.info("Ingested orders from {}, inserted: {}, updated: {}", file, inserted, parsed.size() - inserted);
        return inserted;
    }

    private CsvTable read(Path file, List<String> requiredColumns) {
        if (!Files.isRegularFile(file)) {
            throw new IngestionException("CSV file not found: " + file);
        }
        CsvSchema headerSchema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> iterator = csvMapper.readerForMapOf(String.class)
                .with(headerSchema)
                .readValues(file.toFile())) {
            List<Map<String, String>> rows = iterator.readAll();
            CsvSchema header = (CsvSchema) iterator.getParserSchema();
            List<String> missing = requiredColumns.stream()
                    .filter(column -> header == null || header.column(column) == null)
                    .toList();
            if (!missing.isEmpty()) {
                throw new IngestionException("CSV " + file.getFileName() + " must contain columns: " + String.join(", ", missing));
            }
            return new CsvTable(header, rows);
        } catch (IOException e) {
            throw new IngestionException("Unable to read CSV " + file + ": " + e.getMessage(), e);
        }
    }

    private static CustomerEntity mergeCustomer(CustomerEntity target, CustomerEntity update, boolean hasCreatedAt) {
        if (update.getEmail() != null) target.setEmail(update.getEmail());
        if (update.getCountry() != null) target.setCountry(update.getCountry());
        if (hasCreatedAt) target.setCreatedAt(update.getCreatedAt());
        return target;
    }

    private static String text(Map<String, String> row, String column) {
        String value = row.get(column);
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private static BigDecimal parseAmount(String orderId, String value) {
        if (value == null) {
            throw new IngestionException("Missing order_amount for order " + orderId);
        }
        try {
            return new BigDecimal(value).setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            throw new IngestionException("Invalid order_amount '" + value + "' for order " + orderId, e);
        }
    }

    /** Date-only values resolve to the start of the day; unparseable values give empty. */
    static Optional<LocalDateTime> parseDate(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(value, format));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(value, format).atStartOfDay());
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return Optional.of(LocalDateTime.parse(value));
        } catch (DateTimeParseException ignored) {
            // fall through to offset timestamps
        }
        try {
            return Optional.of(OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime());
        } catch (DateTimeParseException e) {
            log.debug("Unparseable date value '{}'", value);
            return Optional.empty();
        }
    }

    @Getter
    @RequiredArgsConstructor
    private static final class CsvTable {
        private final CsvSchema header;
        private final List<Map<String, String>> rows;

        boolean hasColumn(String name) {
            return header != null && header.column(name) != null;
        }
    }
}
