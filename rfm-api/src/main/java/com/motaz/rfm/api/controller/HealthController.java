package com.motaz.rfm.api.controller;

import com.motaz.rfm.api.dto.HealthResponseDto;
import com.motaz.rfm.api.services.HealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthController {
    private final HealthService healthService;

    @GetMapping("/health")
    public HealthResponseDto health() {
        return healthService.health();
    }
}
