package com.motaz.rfm.api.services;

import com.motaz.rfm.api.dto.PipelineRunRequestDto;
import com.motaz.rfm.api.dto.PipelineRunResponseDto;
import com.motaz.rfm.training.dto.IngestionResult;
import com.motaz.rfm.training.dto.PipelineRunResult;
import com.motaz.rfm.training.service.CsvIngestionService;
import com.motaz.rfm.training.service.SegmentationPipelineService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class PipelineRunService {

    private final CsvIngestionService csvIngestionService;
    private final SegmentationPipelineService segmentationPipelineService;
    private final CustomerSegmentCacheService customerSegmentCacheService;
    private final int defaultWindowDays;
    private final int defaultK;

    public PipelineRunService(CsvIngestionService csvIngestionService,
                              SegmentationPipelineService segmentationPipelineService,
                              CustomerSegmentCacheService customerSegmentCacheService,
                              @Value("${rfm.pipeline.window-days:365}") int defaultWindowDays,
                              @Value("${rfm.pipeline.k:5}") int defaultK) {
        this.csvIngestionService = csvIngestionService;
        this.segmentationPipelineService = segmentationPipelineService;
        this.customerSegmentCacheService = customerSegmentCacheService;
        this.defaultWindowDays = defaultWindowDays;
        this.defaultK = defaultK;
    }

    public PipelineRunResponseDto run(PipelineRunRequestDto request) {
        PipelineRunRequestDto effective = request != null ? request : new PipelineRunRequestDto();
        LocalDateTime calcDate = effective.getCalcDate() != null ? effective.getCalcDate() : LocalDateTime.now();
        int windowDays = effective.getWindowDays() != null ? effective.getWindowDays() : defaultWindowDays;
        int k = effective.getK() != null ? effective.getK() : defaultK;

        IngestionResult ingestion = csvIngestionService.ingestAll();
        PipelineRunResult result = segmentationPipelineService.run(calcDate, windowDays, k);

        List<String> warnings = new ArrayList<>(ingestion.getErrors());
        warnings.addAll(result.getWarnings());
        try {
            customerSegmentCacheService.cacheLatestSegments();
        } catch (RuntimeException e) {
            // run is committed at this point, report the cache failure as a warning
            log.warn("Segment cache refresh failed after run for calcDate {}", calcDate, e);
            warnings.add("Segment cache refresh failed: " + e.getMessage());
        }

        boolean clean = warnings.isEmpty();
        return PipelineRunResponseDto.builder()
                .status(clean ? PipelineRunResponseDto.STATUS_SUCCESS : PipelineRunResponseDto.STATUS_WARNING)
                .calcDate(result.getCalcDate())
                .windowDays(result.getWindowDays())
                .k(result.getK())
                .customersIngested(ingestion.getCustomersIngested())
                .ordersIngested(ingestion.getOrdersIngested())
                .customersProcessed(result.getCustomersProcessed())
                .clustersCreated(result.getClustersCreated())
                .iterations(result.getIterations())
                .converged(result.isConverged())
                .degenerate(result.isDegenerate())
                .segmentCounts(result.getSegmentCounts())
                .warnings(warnings)
                .message(clean ? "Pipeline completed successfully" : "Pipeline completed with warnings")
                .build();
    }
}
