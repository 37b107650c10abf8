package com.motaz.rfm.training;

import com.motaz.rfm.training.dto.IngestionResult;
import com.motaz.rfm.training.dto.PipelineRunResult;
import com.motaz.rfm.training.exception.SegmentationException;
import com.motaz.rfm.training.service.CsvIngestionService;
import com.motaz.rfm.training.service.DataPreparationService;
import com.motaz.rfm.training.service.SegmentationPipelineService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;

@Slf4j
@SpringBootApplication
public class SegmentationTrainingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SegmentationTrainingApplication.class, args);
    }

    @Bean
    public CommandLineRunner runSegmentation(CsvIngestionService csvIngestionService,
                                             DataPreparationService dataPreparationService,
                                             SegmentationPipelineService segmentationPipelineService,
                                             @Value("${rfm.pipeline.calc-date:}") String calcDateValue,
                                             @Value("${rfm.pipeline.window-days:365}") int windowDays,
                                             @Value("${rfm.pipeline.k:5}") int k,
                                             @Value("${rfm.pipeline.prepare-data:false}") boolean prepareData) {
        return args -> {
            LocalDateTime calcDate = StringUtils.hasText(calcDateValue)
                    ? LocalDateTime.parse(calcDateValue)
                    : LocalDateTime.now();

            IngestionResult ingestion = csvIngestionService.ingestAll();
            ingestion.getErrors().forEach(error -> log.warn("Ingestion: {}", error));

            if (prepareData) {
                log.info("Preparing demo data...");
                dataPreparationService.prepareData(calcDate, windowDays);
                log.info("Preparing demo data Completed...");
            }

            log.info("Run segmentation pipeline...");
            PipelineRunResult result;
            try {
                result = segmentationPipelineService.run(calcDate, windowDays, k);
            } catch (SegmentationException e) {
                log.error("Segmentation run failed, kind: {}, message: {}", e.getKind(), e.getMessage());
                throw e;
            }
            log.info("Run segmentation pipeline Completed...");
            log.info("Calc date: {}, window days: {}, k: {}", result.getCalcDate(), result.getWindowDays(), result.getK());
            log.info("Customers processed: {}, iterations: {}, converged: {}, degenerate: {}",
                    result.getCustomersProcessed(), result.getIterations(), result.isConverged(), result.isDegenerate());
            result.getSegmentCounts().forEach((segment, count) -> log.info("  {}: {}", segment, count));
            log.info("Customers ingested: {}, orders ingested: {}", ingestion.getCustomersIngested(), ingestion.getOrdersIngested());
            result.getWarnings().forEach(warning -> log.warn("Warning: {}", warning));
        };
    }
}
