package me.golemcore.contextmem.domain.service;

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

import me.golemcore.contextmem.domain.model.ClearAction;
import me.golemcore.contextmem.domain.model.ClearDecision;
import me.golemcore.contextmem.domain.model.ClearTrigger;
import me.golemcore.contextmem.domain.model.ContextClearEvent;
import me.golemcore.contextmem.domain.model.ContextMetrics;
import me.golemcore.contextmem.domain.model.DriftDetectionResult;
import me.golemcore.contextmem.domain.model.ForecastRecommendation;
import me.golemcore.contextmem.domain.model.ForecastResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines the growth forecast and the drift assessment into the single
 * decision the host acts on: continue, extract then clear, or clear now.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextClearAdvisor {

    private static final String LOG_PREFIX = "[ClearAdvisor]";

    private final ContextForecastService forecastService;
    private final ContextDriftDetector driftDetector;
    private final ContextStatsTracker statsTracker;

    public ClearDecision evaluate(ContextMetrics metrics) {
        ForecastResult forecast = forecastService.forecast(metrics);
        DriftDetectionResult drift = driftDetector.detectDrift(metrics.getCurrentTokens());

        List<String> reasons = new ArrayList<>();
        ClearAction action = ClearAction.CONTINUE;
        ForecastRecommendation recommendation = forecast.getRecommendation();

        if (recommendation == ForecastRecommendation.EMERGENCY) {
            action = ClearAction.CLEAR_NOW;
            reasons.add("Context is past 95% of the limit");
        } else {
            if (recommendation == ForecastRecommendation.EXTRACT_NOW) {
                action = ClearAction.EXTRACT_THEN_CLEAR;
                reasons.add("Context is projected to pass 95% within " + forecast.getMessagesUntil95()
                        + " messages");
            }
            if (drift.isShouldClearContext()) {
                action = ClearAction.EXTRACT_THEN_CLEAR;
                reasons.add("Drift score " + drift.getDriftScore() + " (" + drift.getOverallSeverity() + ")");
            }
            if (recommendation == ForecastRecommendation.EXTRACT_SOON) {
                reasons.add("Context is projected to pass 85% within " + forecast.getMessagesUntil85()
                        + " messages");
            }
        }

        log.info("{} {} (forecast={}, drift={})", LOG_PREFIX, action, recommendation, drift.getDriftScore());
        return ClearDecision.builder()
                .action(action)
                .forecast(forecast)
                .drift(drift)
                .reasons(reasons)
                .build();
    }

    /**
     * Records a clear the host performed. Pre-clear hooks run first; drift
     * tracking restarts afterwards.
     */
    public ContextClearEvent executeClear(long currentTokens, String agentId, int toolUsesCleared) {
        ContextClearEvent event = statsTracker.trackClearEvent(currentTokens, toolUsesCleared, currentTokens,
                ClearTrigger.INPUT_TOKENS, agentId);
        driftDetector.reset();
        return event;
    }
}
