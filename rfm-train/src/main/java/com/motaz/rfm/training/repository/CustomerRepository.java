package com.motaz.rfm.training.repository;

import com.motaz.rfm.training.model.CustomerEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CustomerRepository extends JpaRepository<CustomerEntity, Long> {

    List<CustomerEntity> findAllByOrderByCustomerIdAsc();

    Optional<CustomerEntity> findByCustomerId(String customerId);

    List<CustomerEntity> findByCustomerIdIn(Collection<String> customerIds);
}
