package com.motaz.rfm.api.controller;

import com.motaz.rfm.api.dto.PipelineRunRequestDto;
import com.motaz.rfm.api.dto.PipelineRunResponseDto;
import com.motaz.rfm.api.services.PipelineRunService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/pipeline")
@RequiredArgsConstructor
public class PipelineController {
    private final PipelineRunService pipelineRunService;

    @Operation(summary = "Run feature calculation, clustering and labeling for one calc date")
    @PostMapping("/run")
    public PipelineRunResponseDto run(@Valid @RequestBody(required = false) PipelineRunRequestDto request) {
        return pipelineRunService.run(request);
    }
}
