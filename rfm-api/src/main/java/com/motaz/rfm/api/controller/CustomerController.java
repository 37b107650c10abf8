package com.motaz.rfm.api.controller;

import com.motaz.rfm.api.dto.CustomerDetailDto;
import com.motaz.rfm.api.dto.CustomerSegmentDto;
import com.motaz.rfm.api.exception.ResourceNotFoundException;
import com.motaz.rfm.api.services.CustomerQueryService;
import com.motaz.rfm.api.services.CustomerSegmentCacheService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/v1/customers")
@RequiredArgsConstructor
public class CustomerController {
    private final CustomerQueryService customerQueryService;
    private final CustomerSegmentCacheService customerSegmentCacheService;

    @GetMapping("/{customerId}")
    public CustomerDetailDto getCustomer(
            @Parameter(description = "The unique identifier of the customer", required = true, example = "C001")
            @PathVariable(name = "customerId") String customerId,
            @RequestParam(name = "calcDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime calcDate) {
        return customerQueryService.getCustomer(customerId, calcDate);
    }

    @GetMapping("/{customerId}/segment")
    public CustomerSegmentDto getCachedSegment(
            @Parameter(description = "The unique identifier of the customer", required = true, example = "C001")
            @PathVariable(name = "customerId") String customerId) {
        return customerSegmentCacheService.findCachedSegment(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Cached segment", customerId));
    }
}
