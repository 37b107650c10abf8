package com.motaz.rfm.training.repository;

import com.motaz.rfm.training.model.OrderEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, Long> {

    List<OrderEntity> findAllByOrderDateLessThanEqualOrderByCustomerIdAscOrderDateAsc(LocalDateTime calcDate);

    List<OrderEntity> findByOrderIdIn(Collection<String> orderIds);

}
