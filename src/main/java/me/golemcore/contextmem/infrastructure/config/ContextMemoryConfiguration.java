package me.golemcore.contextmem.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Shared infrastructure beans for context memory and a startup summary of the
 * effective configuration.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ContextMemoryConfiguration {

    private final ContextMemoryProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("Context memory starting...");
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Hot tier budget: {} bytes, demotion after {}d (hot) / {}d (warm)",
                properties.getTiers().getHotMaxSizeBytes(), properties.getTiers().getHotMaxDays(),
                properties.getTiers().getWarmMaxDays());
        log.info("Cache warming: enabled={}, max {} items / {} tokens",
                properties.getWarming().isEnabled(), properties.getWarming().getMaxFilesToWarm(),
                properties.getWarming().getMaxTokensPerWarm());
        log.info("Forecast token limit: {}", properties.getForecast().getTokenLimit());
    }
}
