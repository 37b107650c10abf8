package com.motaz.rfm.api.controller;

import com.motaz.rfm.api.dto.SegmentCustomerPageDto;
import com.motaz.rfm.api.dto.SegmentExportDto;
import com.motaz.rfm.api.dto.SegmentListResponseDto;
import com.motaz.rfm.api.services.SegmentExportService;
import com.motaz.rfm.api.services.SegmentQueryService;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SegmentController {
    static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final SegmentQueryService segmentQueryService;
    private final SegmentExportService segmentExportService;

    @GetMapping("/segments")
    public SegmentListResponseDto getSegments(
            @Parameter(description = "Calc date, latest if omitted", example = "2024-06-30T00:00:00")
            @RequestParam(name = "calcDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime calcDate) {
        return segmentQueryService.listSegments(calcDate);
    }

    @GetMapping("/segments/{segmentName}/customers")
    public SegmentCustomerPageDto getSegmentCustomers(
            @Parameter(description = "Segment display name", required = true, example = "Champions")
            @PathVariable(name = "segmentName") String segmentName,
            @RequestParam(name = "calcDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime calcDate,
            @RequestParam(name = "page", defaultValue = "1") @Min(1) int page,
            @RequestParam(name = "pageSize", defaultValue = "100") @Min(1) @Max(1000) int pageSize) {
        return segmentQueryService.segmentCustomers(segmentName, calcDate, page, pageSize);
    }

    @GetMapping("/export/segments/{segmentName}")
    public ResponseEntity<byte[]> exportSegment(
            @PathVariable(name = "segmentName") String segmentName,
            @RequestParam(name = "calcDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime calcDate) {
        SegmentExportDto export = segmentExportService.exportSegment(segmentName, calcDate);
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(export.getFileName()).build().toString())
                .body(export.getContent().getBytes(StandardCharsets.UTF_8));
    }
}
