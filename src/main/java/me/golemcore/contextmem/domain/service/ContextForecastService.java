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

import me.golemcore.contextmem.domain.model.ContextMetrics;
import me.golemcore.contextmem.domain.model.ForecastRecommendation;
import me.golemcore.contextmem.domain.model.ForecastResult;
import me.golemcore.contextmem.domain.model.ModelCoefficients;
import me.golemcore.contextmem.domain.model.TaskComplexity;
import me.golemcore.contextmem.domain.model.TrainingDataPoint;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import me.golemcore.contextmem.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Predicts context window growth over the next turns and recommends when to
 * extract and clear.
 *
 * <p>
 * Growth per message is a weighted sum of four features: tokens per message,
 * tokens per message scaled by the task complexity impact, average tool result
 * size and tokens per message scaled by a time-of-day factor. Weights start at
 * the configured priors and are refit by least squares (no intercept) once
 * enough outcomes have been recorded. Feature columns that are linearly
 * dependent on earlier ones in the history (a single complexity, a constant
 * time of day) keep their prior weight and only the remaining columns are
 * fitted. Complexity impacts are learned as the mean observed growth-to-rate
 * ratio per complexity.
 *
 * <p>
 * Forecasting never fails for lack of data: sparse history only lowers the
 * reported confidence.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextForecastService {

    private static final String LOG_PREFIX = "[Forecast]";
    private static final String DIRECTORY = "forecaster";
    private static final String TRAINING_FILE = "training-data.json";
    private static final String COEFFICIENTS_FILE = "coefficients.json";

    private static final double EXTRACT_SOON_RATIO = 0.85;
    private static final double EXTRACT_NOW_RATIO = 0.95;
    private static final int SHORT_HORIZON = 5;
    private static final int LONG_HORIZON = 10;
    private static final int UNREACHABLE = -1;
    private static final double SINGULARITY_THRESHOLD = 1e-10;
    private static final double COLLINEARITY_THRESHOLD = 1e-8;
    private static final int FEATURE_COUNT = 4;

    private static final int PEAK_HOUR = 9;
    private static final double TIME_OF_DAY_AMPLITUDE = 0.2;
    private static final double HOURS_PER_DAY = 24.0;
    private static final double MINUTES_PER_HOUR = 60.0;

    private static final TypeReference<List<TrainingDataPoint>> TRAINING_LIST_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ContextMemoryProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final PendingWriteQueue pendingWriteQueue;

    private final List<TrainingDataPoint> trainingData = new ArrayList<>();
    private ModelCoefficients coefficients;

    @PostConstruct
    public void init() {
        coefficients = priorCoefficients();
        loadState();
    }

    public synchronized ForecastResult forecast(ContextMetrics metrics) {
        validate(metrics);
        TaskComplexity complexity = complexityOf(metrics);
        ContextMemoryProperties.ForecastProperties config = properties.getForecast();
        long limit = config.getTokenLimit();
        long current = metrics.getCurrentTokens();
        Instant observedAt = metrics.getObservedAt() != null ? metrics.getObservedAt() : clock.instant();

        double tokensPerMessage = tokensPerMessage(metrics);
        double timeFactor = timeOfDayFactor(observedAt);
        double growth = Math.max(0, predictGrowth(tokensPerMessage, complexity,
                metrics.getAvgToolResultTokens(), timeFactor));

        long in5 = Math.round(current + SHORT_HORIZON * growth);
        long in10 = Math.round(current + LONG_HORIZON * growth);
        int until85 = messagesUntil(current, EXTRACT_SOON_RATIO * limit, growth);
        int until95 = messagesUntil(current, EXTRACT_NOW_RATIO * limit, growth);
        double minutesPerMessage = metrics.getMinutesPerMessage() != null
                ? metrics.getMinutesPerMessage()
                : config.getDefaultMinutesPerMessage();
        double minutes = until85 == UNREACHABLE ? UNREACHABLE : until85 * minutesPerMessage;

        double ratio = (double) current / limit;
        ForecastRecommendation recommendation;
        if (ratio >= EXTRACT_NOW_RATIO) {
            recommendation = ForecastRecommendation.EMERGENCY;
        } else if ((double) in5 / limit >= EXTRACT_NOW_RATIO) {
            recommendation = ForecastRecommendation.EXTRACT_NOW;
        } else if ((double) in10 / limit >= EXTRACT_SOON_RATIO) {
            recommendation = ForecastRecommendation.EXTRACT_SOON;
        } else {
            recommendation = ForecastRecommendation.CONTINUE;
        }

        double confidence = confidence(trainingData.size());
        List<String> reasoning = new ArrayList<>();
        reasoning.add(String.format(Locale.ROOT, "Current usage %.1f%% of %d tokens", ratio * 100, limit));
        reasoning.add(String.format(Locale.ROOT, "Projected growth %.0f tokens/message (%s task)", growth,
                complexity.name().toLowerCase(Locale.ROOT)));
        reasoning.add(String.format(Locale.ROOT, "Projected %.1f%% in 5 messages, %.1f%% in 10 messages",
                100.0 * in5 / limit, 100.0 * in10 / limit));
        if (!coefficients.isFitted()) {
            reasoning.add("Using prior coefficients (" + trainingData.size() + " training samples)");
        }
        if (confidence < 0.5) {
            reasoning.add(String.format(Locale.ROOT, "Low confidence (%.2f): limited training history", confidence));
        }

        log.debug("{} {} at {}/{} tokens, growth {}/msg, confidence {}", LOG_PREFIX, recommendation, current, limit,
                Math.round(growth), confidence);
        return ForecastResult.builder()
                .predictedTokensIn5(in5)
                .predictedTokensIn10(in10)
                .messagesUntil85(until85)
                .messagesUntil95(until95)
                .estimatedMinutesUntilThreshold(minutes)
                .confidence(confidence)
                .recommendation(recommendation)
                .growthPerMessage(growth)
                .reasoning(reasoning)
                .build();
    }

    /**
     * Adds an observed outcome for the given metrics and refits the model.
     */
    public synchronized void recordOutcome(ContextMetrics metrics, long actualTokensAfter5,
            long actualTokensAfter10) {
        validate(metrics);
        Instant observedAt = metrics.getObservedAt() != null ? metrics.getObservedAt() : clock.instant();
        trainingData.add(TrainingDataPoint.builder()
                .currentTokens(metrics.getCurrentTokens())
                .tokensPerMessage(tokensPerMessage(metrics))
                .taskComplexity(complexityOf(metrics))
                .avgToolResultTokens(metrics.getAvgToolResultTokens())
                .timeOfDayFactor(timeOfDayFactor(observedAt))
                .actualTokensAfter5(actualTokensAfter5)
                .actualTokensAfter10(actualTokensAfter10)
                .timestamp(observedAt)
                .build());
        pruneExpired();
        refit();
        persist();
    }

    public synchronized ModelCoefficients getCoefficients() {
        return ModelCoefficients.builder()
                .tokensPerMessage(coefficients.getTokensPerMessage())
                .complexity(coefficients.getComplexity())
                .toolResult(coefficients.getToolResult())
                .timeOfDay(coefficients.getTimeOfDay())
                .complexityImpact(new EnumMap<>(coefficients.getComplexityImpact()))
                .sampleCount(coefficients.getSampleCount())
                .fitted(coefficients.isFitted())
                .fittedAt(coefficients.getFittedAt())
                .build();
    }

    public synchronized int getTrainingSampleCount() {
        return trainingData.size();
    }

    /**
     * Drops training samples past the retention window and refits.
     *
     * @return number of samples removed
     */
    public synchronized int pruneTrainingData() {
        int removed = pruneExpired();
        if (removed > 0) {
            refit();
            persist();
            log.info("{} Pruned {} training samples older than {} days", LOG_PREFIX, removed,
                    properties.getForecast().getRetentionDays());
        }
        return removed;
    }

    double timeOfDayFactor(Instant at) {
        ZonedDateTime local = at.atZone(clock.getZone());
        double hour = local.getHour() + local.getMinute() / MINUTES_PER_HOUR;
        return 1 + TIME_OF_DAY_AMPLITUDE * Math.cos(2 * Math.PI * (hour - PEAK_HOUR) / HOURS_PER_DAY);
    }

    private double predictGrowth(double tokensPerMessage, TaskComplexity complexity, double toolResult,
            double timeFactor) {
        double[] features = features(tokensPerMessage, complexityImpact(complexity), toolResult, timeFactor);
        return coefficients.getTokensPerMessage() * features[0]
                + coefficients.getComplexity() * features[1]
                + coefficients.getToolResult() * features[2]
                + coefficients.getTimeOfDay() * features[3];
    }

    private static double[] features(double tokensPerMessage, double complexityImpact, double toolResult,
            double timeFactor) {
        return new double[] {
                tokensPerMessage,
                tokensPerMessage * complexityImpact,
                toolResult,
                tokensPerMessage * timeFactor
        };
    }

    private double complexityImpact(TaskComplexity complexity) {
        Double learned = coefficients.getComplexityImpact().get(complexity);
        return learned != null ? learned : priorImpact(complexity);
    }

    private double priorImpact(TaskComplexity complexity) {
        ContextMemoryProperties.ForecastProperties config = properties.getForecast();
        return switch (complexity) {
        case SIMPLE -> config.getSimpleComplexity();
        case MEDIUM -> config.getMediumComplexity();
        case COMPLEX -> config.getComplexComplexity();
        };
    }

    private double confidence(int samples) {
        ContextMemoryProperties.ForecastProperties config = properties.getForecast();
        double progress = Math.min(1.0, (double) samples / config.getFullConfidenceSamples());
        double value = config.getBaseConfidence() + (config.getMaxConfidence() - config.getBaseConfidence()) * progress;
        return Math.min(config.getMaxConfidence(), value);
    }

    private static int messagesUntil(long current, double target, double growth) {
        if (current >= target) {
            return 0;
        }
        if (growth <= 0) {
            return UNREACHABLE;
        }
        double messages = Math.ceil((target - current) / growth);
        return messages >= Integer.MAX_VALUE ? UNREACHABLE : (int) messages;
    }

    private void refit() {
        ContextMemoryProperties.ForecastProperties config = properties.getForecast();
        ModelCoefficients refitted = priorCoefficients();
        refitted.setSampleCount(trainingData.size());

        Map<TaskComplexity, SummaryStatistics> impactStats = new EnumMap<>(TaskComplexity.class);
        for (TrainingDataPoint point : trainingData) {
            if (point.getTaskComplexity() != null && point.getTokensPerMessage() > 0) {
                impactStats.computeIfAbsent(point.getTaskComplexity(), c -> new SummaryStatistics())
                        .addValue(point.observedGrowthPerTurn() / point.getTokensPerMessage());
            }
        }
        impactStats.forEach((complexity, stats) -> {
            if (stats.getN() >= config.getMinSamplesForComplexity() && Double.isFinite(stats.getMean())
                    && stats.getMean() > 0) {
                refitted.getComplexityImpact().put(complexity, stats.getMean());
            }
        });

        if (trainingData.size() >= config.getMinSamplesForRefit()) {
            fitWeights(refitted);
        }
        coefficients = refitted;
    }

    private void fitWeights(ModelCoefficients target) {
        int n = trainingData.size();
        double[] y = new double[n];
        double[][] x = new double[n][];
        for (int i = 0; i < n; i++) {
            TrainingDataPoint point = trainingData.get(i);
            TaskComplexity complexity = point.getTaskComplexity() != null
                    ? point.getTaskComplexity()
                    : TaskComplexity.MEDIUM;
            Double impact = target.getComplexityImpact().get(complexity);
            x[i] = features(point.getTokensPerMessage(), impact != null ? impact : priorImpact(complexity),
                    point.getAvgToolResultTokens(), point.getTimeOfDayFactor());
            y[i] = point.observedGrowthPerTurn();
        }

        List<Integer> columns = independentColumns(x);
        if (columns.isEmpty()) {
            log.debug("{} No usable feature columns, keeping priors", LOG_PREFIX);
            return;
        }

        double[] weights = {
                target.getTokensPerMessage(), target.getComplexity(), target.getToolResult(), target.getTimeOfDay()
        };
        double[][] design = new double[n][columns.size()];
        double[] residual = y.clone();
        for (int i = 0; i < n; i++) {
            for (int feature = 0; feature < FEATURE_COUNT; feature++) {
                int column = columns.indexOf(feature);
                if (column >= 0) {
                    design[i][column] = x[i][feature];
                } else {
                    residual[i] -= weights[feature] * x[i][feature];
                }
            }
        }

        try {
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
            regression.setNoIntercept(true);
            regression.newSampleData(residual, design);
            double[] beta = regression.estimateRegressionParameters();
            for (double b : beta) {
                if (!Double.isFinite(b)) {
                    log.debug("{} Non-finite coefficients, keeping priors", LOG_PREFIX);
                    return;
                }
            }
            for (int column = 0; column < beta.length; column++) {
                weights[columns.get(column)] = beta[column];
            }
            target.setTokensPerMessage(weights[0]);
            target.setComplexity(weights[1]);
            target.setToolResult(weights[2]);
            target.setTimeOfDay(weights[3]);
            target.setFitted(true);
            target.setFittedAt(clock.instant());
            log.info("{} Refit on {} samples (columns {}): tpm={}, complexity={}, tool={}, timeOfDay={}",
                    LOG_PREFIX, n, columns, weights[0], weights[1], weights[2], weights[3]);
        } catch (MathIllegalArgumentException e) {
            log.debug("{} Least-squares refit failed, keeping priors: {}", LOG_PREFIX, e.getMessage());
        }
    }

    /**
     * Greedily selects the feature columns that are linearly independent of the
     * ones already selected. Columns are scaled to unit norm first so the rank
     * test does not depend on token magnitudes.
     */
    static List<Integer> independentColumns(double[][] x) {
        int n = x.length;
        List<Integer> selected = new ArrayList<>();
        List<double[]> scaled = new ArrayList<>();
        for (int feature = 0; feature < FEATURE_COUNT; feature++) {
            double norm = 0;
            for (double[] row : x) {
                norm += row[feature] * row[feature];
            }
            norm = Math.sqrt(norm);
            if (norm == 0 || !Double.isFinite(norm)) {
                continue;
            }
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                column[i] = x[i][feature] / norm;
            }

            RealMatrix candidate = new Array2DRowRealMatrix(n, scaled.size() + 1);
            for (int j = 0; j < scaled.size(); j++) {
                candidate.setColumn(j, scaled.get(j));
            }
            candidate.setColumn(scaled.size(), column);
            if (n > scaled.size() && new QRDecomposition(candidate, COLLINEARITY_THRESHOLD).getSolver()
                    .isNonSingular()) {
                selected.add(feature);
                scaled.add(column);
            }
        }
        return selected;
    }

    private ModelCoefficients priorCoefficients() {
        ContextMemoryProperties.ForecastProperties config = properties.getForecast();
        return ModelCoefficients.builder()
                .tokensPerMessage(config.getTokensPerMessageWeight())
                .complexity(config.getComplexityWeight())
                .toolResult(config.getToolResultWeight())
                .timeOfDay(config.getTimeOfDayWeight())
                .complexityImpact(new EnumMap<>(TaskComplexity.class))
                .build();
    }

    private int pruneExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getForecast().getRetentionDays()));
        int before = trainingData.size();
        trainingData.removeIf(p -> p.getTimestamp() != null && p.getTimestamp().isBefore(cutoff));
        return before - trainingData.size();
    }

    private static double tokensPerMessage(ContextMetrics metrics) {
        if (metrics.getTokensPerMessage() != null) {
            return metrics.getTokensPerMessage();
        }
        return metrics.getMessageCount() > 0 ? (double) metrics.getCurrentTokens() / metrics.getMessageCount() : 0;
    }

    private static TaskComplexity complexityOf(ContextMetrics metrics) {
        return metrics.getTaskComplexity() != null ? metrics.getTaskComplexity() : TaskComplexity.MEDIUM;
    }

    private static void validate(ContextMetrics metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (metrics.getCurrentTokens() < 0) {
            throw new IllegalArgumentException("currentTokens must not be negative");
        }
    }

    private void persist() {
        try {
            pendingWriteQueue.submit(DIRECTORY, TRAINING_FILE, objectMapper.writeValueAsString(trainingData));
            pendingWriteQueue.submit(DIRECTORY, COEFFICIENTS_FILE, objectMapper.writeValueAsString(coefficients));
            pendingWriteQueue.drain();
        } catch (JsonProcessingException e) {
            log.warn("{} Failed to serialize forecaster state: {}", LOG_PREFIX, e.getMessage());
        }
    }

    private void loadState() {
        try {
            String json = storagePort.getText(DIRECTORY, TRAINING_FILE).join();
            if (json != null && !json.isBlank()) {
                trainingData.addAll(objectMapper.readValue(json, TRAINING_LIST_TYPE));
            }
            pruneExpired();
            refit();
            log.info("{} Loaded {} training samples (fitted={})", LOG_PREFIX, trainingData.size(),
                    coefficients.isFitted());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("{} Failed to load training data, using priors: {}", LOG_PREFIX, e.getMessage());
        }
    }
}
