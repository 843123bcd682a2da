package me.golemcore.contextmem;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Context Memory.
 *
 * <p>
 * Manages the working knowledge an agent keeps next to a size-limited context
 * window.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Tiered Store</b> - hot (memory), warm (disk) and cold (gzip) tiers
 * with access-driven promotion, age-based demotion and LRU eviction</li>
 * <li><b>Access Tracking</b> - per-path frequency, recency and interval
 * statistics with next-access prediction</li>
 * <li><b>Cache Warming</b> - strategy-scored, token-budgeted prefetch</li>
 * <li><b>Forecasting</b> - least-squares token growth model with
 * extract/clear recommendations</li>
 * <li><b>Drift Detection</b> - staleness and switching signals that
 * recommend proactive clearing</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Host entry point   → ContextMemoryCoordinator, ContextClearAdvisor
 * Domain Layer       → Tiered store, tracker, warmer, forecaster, drift checks
 * Infrastructure     → Local storage adapter, configuration
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code context.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ContextMemoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextMemoryApplication.class, args);
    }

}
