package me.golemcore.contextmem.domain.service;

import me.golemcore.contextmem.MutableClock;
import me.golemcore.contextmem.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.contextmem.domain.model.ContextMetrics;
import me.golemcore.contextmem.domain.model.ForecastRecommendation;
import me.golemcore.contextmem.domain.model.ForecastResult;
import me.golemcore.contextmem.domain.model.ModelCoefficients;
import me.golemcore.contextmem.domain.model.TaskComplexity;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryConfiguration;
import me.golemcore.contextmem.infrastructure.config.ContextMemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextForecastServiceTest {

    private static final long LIMIT = 200_000;

    @TempDir
    Path tempDir;

    private ContextMemoryProperties properties;
    private LocalStorageAdapter storage;
    private MutableClock clock;
    private ContextForecastService forecaster;

    @BeforeEach
    void setUp() {
        properties = new ContextMemoryProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        // 09:00 UTC is the time-of-day peak, factor 1.2
        clock = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
        forecaster = newForecaster();
    }

    private ContextForecastService newForecaster() {
        ContextForecastService service = new ContextForecastService(storage, properties,
                ContextMemoryConfiguration.objectMapper(), clock, new PendingWriteQueue(storage, properties));
        service.init();
        return service;
    }

    private static ContextMetrics metrics(long tokens, double tokensPerMessage, TaskComplexity complexity) {
        return ContextMetrics.builder()
                .currentTokens(tokens)
                .messageCount(10)
                .tokensPerMessage(tokensPerMessage)
                .taskComplexity(complexity)
                .build();
    }

    @Test
    void pastNinetyFivePercentIsEmergency() {
        ForecastResult result = forecaster.forecast(metrics(192_000, 1500, TaskComplexity.COMPLEX));

        assertEquals(ForecastRecommendation.EMERGENCY, result.getRecommendation());
        assertEquals(0, result.getMessagesUntil85());
        assertEquals(0, result.getMessagesUntil95());
    }

    @Test
    void projectedToPassNinetyFiveInFiveIsExtractNow() {
        ForecastResult result = forecaster.forecast(metrics(185_000, 2000, TaskComplexity.MEDIUM));

        assertEquals(ForecastRecommendation.EXTRACT_NOW, result.getRecommendation());
        assertEquals(1640, result.getGrowthPerMessage(), 1e-6);
        assertEquals(193_200, result.getPredictedTokensIn5());
    }

    @Test
    void projectedToPassEightyFiveInTenIsExtractSoon() {
        ForecastResult result = forecaster.forecast(metrics(165_000, 1000, TaskComplexity.MEDIUM));

        assertEquals(ForecastRecommendation.EXTRACT_SOON, result.getRecommendation());
        assertEquals(173_200, result.getPredictedTokensIn10());
    }

    @Test
    void lowUsageContinuesWithThresholdEstimates() {
        ForecastResult result = forecaster.forecast(metrics(10_000, 1000, TaskComplexity.MEDIUM));

        assertEquals(ForecastRecommendation.CONTINUE, result.getRecommendation());
        assertEquals(196, result.getMessagesUntil85());
        assertEquals(220, result.getMessagesUntil95());
        assertEquals(392.0, result.getEstimatedMinutesUntilThreshold(), 1e-9);
    }

    @Test
    void complexTasksGrowFasterThanSimpleOnes() {
        double simple = forecaster.forecast(metrics(10_000, 1000, TaskComplexity.SIMPLE)).getGrowthPerMessage();
        double complex = forecaster.forecast(metrics(10_000, 1000, TaskComplexity.COMPLEX)).getGrowthPerMessage();

        assertTrue(complex > simple);
    }

    @Test
    void noGrowthMeansThresholdsAreNeverReached() {
        ContextMetrics idle = ContextMetrics.builder().currentTokens(5_000).messageCount(0).build();

        ForecastResult result = forecaster.forecast(idle);

        assertEquals(0, result.getGrowthPerMessage(), 0);
        assertEquals(-1, result.getMessagesUntil85());
        assertEquals(-1, result.getMessagesUntil95());
        assertEquals(-1, result.getEstimatedMinutesUntilThreshold(), 0);
        assertEquals(ForecastRecommendation.CONTINUE, result.getRecommendation());
    }

    @Test
    void withoutHistoryConfidenceIsLowAndSaysSo() {
        ForecastResult result = forecaster.forecast(metrics(50_000, 800, TaskComplexity.MEDIUM));

        assertEquals(0.3, result.getConfidence(), 1e-9);
        assertTrue(result.getReasoning().stream().anyMatch(r -> r.startsWith("Using prior coefficients")));
        assertTrue(result.getReasoning().stream().anyMatch(r -> r.startsWith("Low confidence")));
    }

    @Test
    void rejectsInvalidMetrics() {
        assertThrows(IllegalArgumentException.class, () -> forecaster.forecast(null));
        assertThrows(IllegalArgumentException.class,
                () -> forecaster.forecast(metrics(-1, 100, TaskComplexity.SIMPLE)));
    }

    @Test
    void missingComplexityDefaultsToMedium() {
        ContextMetrics noComplexity = metrics(10_000, 1000, null);

        ForecastResult result = forecaster.forecast(noComplexity);

        assertNull(noComplexity.getTaskComplexity());
        assertEquals(820, result.getGrowthPerMessage(), 1e-6);
        assertTrue(result.getReasoning().stream().anyMatch(r -> r.contains("(medium task)")));
    }

    // ==================== Learning ====================

    private void recordVariedOutcomes(int samples) {
        TaskComplexity[] complexities = TaskComplexity.values();
        for (int i = 0; i < samples; i++) {
            TaskComplexity complexity = complexities[i % complexities.length];
            double tokensPerMessage = 100 + 37.0 * i;
            double toolResult = 50 + (i * i % 7) * 20;
            double growth = 0.5 * tokensPerMessage + 0.3 * toolResult + (i % 3) * 40;
            long current = 20_000 + 1_000L * i;
            ContextMetrics observed = ContextMetrics.builder()
                    .currentTokens(current)
                    .messageCount(10)
                    .tokensPerMessage(tokensPerMessage)
                    .taskComplexity(complexity)
                    .avgToolResultTokens(toolResult)
                    .observedAt(clock.instant().plus(Duration.ofHours(2L * i)))
                    .build();
            forecaster.recordOutcome(observed, Math.round(current + 5 * growth), Math.round(current + 10 * growth));
        }
    }

    @Test
    void fewSamplesKeepPriorWeights() {
        recordVariedOutcomes(4);

        ModelCoefficients coefficients = forecaster.getCoefficients();
        assertFalse(coefficients.isFitted());
        assertEquals(0.4, coefficients.getTokensPerMessage(), 1e-9);
        assertEquals(4, coefficients.getSampleCount());
    }

    @Test
    void enoughVariedSamplesRefitWeights() {
        recordVariedOutcomes(12);

        ModelCoefficients coefficients = forecaster.getCoefficients();
        assertTrue(coefficients.isFitted());
        assertEquals(12, coefficients.getSampleCount());
        assertEquals(3, coefficients.getComplexityImpact().size());
        assertTrue(Double.isFinite(coefficients.getTokensPerMessage()));

        ForecastResult result = forecaster.forecast(metrics(10_000, 500, TaskComplexity.MEDIUM));
        assertTrue(result.getConfidence() > 0.3);
        assertTrue(result.getReasoning().stream().noneMatch(r -> r.startsWith("Using prior coefficients")));
    }

    private void recordSingleComplexityOutcomes(int samples, Duration spacing) {
        for (int i = 0; i < samples; i++) {
            Instant observedAt = clock.instant().plus(spacing.multipliedBy(i));
            double tokensPerMessage = 200 + 23.0 * i;
            double toolResult = 40 + (i * 7 % 11) * 15;
            double growth = 0.5 * tokensPerMessage + 0.3 * toolResult
                    + 0.1 * tokensPerMessage * forecaster.timeOfDayFactor(observedAt);
            long current = 30_000 + 500L * i;
            ContextMetrics observed = ContextMetrics.builder()
                    .currentTokens(current)
                    .messageCount(10)
                    .tokensPerMessage(tokensPerMessage)
                    .taskComplexity(TaskComplexity.MEDIUM)
                    .avgToolResultTokens(toolResult)
                    .observedAt(observedAt)
                    .build();
            forecaster.recordOutcome(observed, Math.round(current + 5 * growth), Math.round(current + 10 * growth));
        }
    }

    @Test
    void singleComplexityHistoryStillRefits() {
        recordSingleComplexityOutcomes(40, Duration.ofHours(5));

        ModelCoefficients coefficients = forecaster.getCoefficients();
        assertTrue(coefficients.isFitted());
        assertEquals(40, coefficients.getSampleCount());
        assertEquals(0.3, coefficients.getComplexity(), 1e-9);
        assertEquals(0.3, coefficients.getToolResult(), 0.01);
        assertEquals(0.1, coefficients.getTimeOfDay(), 0.01);

        // 0.5 * 800 + 0.3 * 300 + 0.1 * 800 * 1.2
        ContextMetrics next = ContextMetrics.builder()
                .currentTokens(10_000)
                .messageCount(10)
                .tokensPerMessage(800.0)
                .taskComplexity(TaskComplexity.MEDIUM)
                .avgToolResultTokens(300)
                .build();
        assertEquals(586, forecaster.forecast(next).getGrowthPerMessage(), 2.0);
    }

    @Test
    void constantTimeOfDayKeepsItsPriorWeight() {
        recordSingleComplexityOutcomes(20, Duration.ofDays(1));

        ModelCoefficients coefficients = forecaster.getCoefficients();
        assertTrue(coefficients.isFitted());
        assertEquals(0.3, coefficients.getComplexity(), 1e-9);
        assertEquals(0.1, coefficients.getTimeOfDay(), 1e-9);
        assertEquals(0.3, coefficients.getToolResult(), 0.01);
    }

    @Test
    void independentColumnsDropsDependentFeatures() {
        double[][] x = {
                {100, 120, 10, 0},
                {200, 240, 30, 0},
                {300, 360, 20, 0},
                {400, 480, 60, 0}
        };

        assertEquals(List.of(0, 2), ContextForecastService.independentColumns(x));
    }

    @Test
    void trainingDataSurvivesRestart() {
        recordVariedOutcomes(12);
        assertTrue(Files.exists(tempDir.resolve("forecaster/training-data.json")));
        assertTrue(Files.exists(tempDir.resolve("forecaster/coefficients.json")));

        ContextForecastService restarted = newForecaster();

        assertEquals(12, restarted.getTrainingSampleCount());
        assertTrue(restarted.getCoefficients().isFitted());
    }

    @Test
    void expiredSamplesArePruned() {
        recordVariedOutcomes(3);
        clock.advance(Duration.ofDays(92));

        assertEquals(3, forecaster.pruneTrainingData());
        assertEquals(0, forecaster.getTrainingSampleCount());
    }
}
