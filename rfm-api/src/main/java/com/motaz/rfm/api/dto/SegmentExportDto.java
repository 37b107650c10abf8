package com.motaz.rfm.api.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SegmentExportDto {
    private String fileName;
    private String content;
    private int rows;
}
