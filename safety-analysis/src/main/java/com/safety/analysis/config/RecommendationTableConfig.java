package com.safety.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.safety.analysis.service.argument.RecommendationTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * 推荐表配置：启动时从 classpath 加载一次，作为不可变 Bean 注入
 */
@Slf4j
@Configuration
public class RecommendationTableConfig {

    @Bean
    public RecommendationTable recommendationTable(SafetyAnalysisConfig config, ObjectMapper objectMapper) {
        String path = config.getRecommendationTable();
        log.info("【推荐表】-> 加载推荐表: {}", path);

        ClassPathResource resource = new ClassPathResource(path);
        try (InputStream in = resource.getInputStream()) {
            return RecommendationTable.fromStream(in, objectMapper);
        } catch (IOException e) {
            log.error("【推荐表】-> 加载失败: {}", path, e);
            throw new UncheckedIOException("failed to load recommendation table: " + path, e);
        }
    }
}
