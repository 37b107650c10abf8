package com.motaz.rfm.api.config;

import com.motaz.rfm.api.services.CustomerSegmentCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class LoadCustomerSegmentCacheConfig {

    private final CustomerSegmentCacheService customerSegmentCacheService;

    @Bean
    ApplicationRunner initApplicationRunner() {
        return args -> {
            int cached = customerSegmentCacheService.cacheLatestSegments();
            log.info("Startup cache load finished, {} customers", cached);
        };
    }

}
