package com.jay.ptanalyzer.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads and exposes the analysis tuning from analysis.yaml.
 * Values are read once at startup and cached. A plain {@code new AnalysisConfig()}
 * carries the built-in defaults, which match the shipped analysis.yaml.
 */
@Slf4j
@Component
public class AnalysisConfig {

    @Value("${analysis.config-file:analysis.yaml}")
    private String configFile;

    // ── Sections ──────────────────────────────────────────────────────────────
    private Pipeline pipeline = new Pipeline();
    private Levels levels = new Levels();
    private Volatility volatility = new Volatility();
    private Target target = new Target();
    private Confidence confidence = new Confidence();
    private Recommendation recommendation = new Recommendation();

    @PostConstruct
    public void load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", configFile);
                return;
            }
            ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
            // an empty section ("levels:" with no keys) reads as null; keep its defaults
            if (root.getPipeline() != null)       this.pipeline       = root.getPipeline();
            if (root.getLevels() != null)         this.levels         = root.getLevels();
            if (root.getVolatility() != null)     this.volatility     = root.getVolatility();
            if (root.getTarget() != null)         this.target         = root.getTarget();
            if (root.getConfidence() != null)     this.confidence     = root.getConfidence();
            if (root.getRecommendation() != null) this.recommendation = root.getRecommendation();
            log.info("AnalysisConfig loaded from '{}'. Trend gate: {} bars, indicator gate: {} bars",
                configFile, pipeline.getMinBarsTrend(), pipeline.getMinBarsIndicators());
        } catch (IOException e) {
            log.error("Failed to load '{}' — analyzer will use defaults: {}", configFile, e.getMessage());
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Pipeline pipeline()             { return pipeline; }
    public Levels levels()                 { return levels; }
    public Volatility volatility()         { return volatility; }
    public Target target()                 { return target; }
    public Confidence confidence()         { return confidence; }
    public Recommendation recommendation() { return recommendation; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Pipeline pipeline = new Pipeline();
        private Levels levels = new Levels();
        private Volatility volatility = new Volatility();
        private Target target = new Target();
        private Confidence confidence = new Confidence();
        private Recommendation recommendation = new Recommendation();
    }

    /** Minimum bar counts before each orchestrated stage runs. */
    @Data public static class Pipeline {
        private int minBarsIndicators = 50;
        private int minBarsLevels = 50;
        private int minBarsTrend = 200;
        private int minBarsVolatility = 20;
    }

    @Data public static class Levels {
        private double tolerance = 0.02;
        private int minTouches = 2;
        private int maxLevels = 5;
    }

    @Data public static class Volatility {
        private int period = 20;
        private int tradingDaysPerYear = 252;
        private double highThreshold = 0.25;
        private double mediumThreshold = 0.15;
    }

    @Data public static class Target {
        private double bollingerUpperWeight = 0.15;
        private double bollingerMiddleWeight = 0.10;
        private double fibonacciWeight = 0.20;
        private double levelWeight = 0.15;
        private double maProjectionWeight = 0.15;
        private double maProjectionUp = 1.05;
        private double maProjectionDown = 0.95;
        private double volatilityRangeFactor = 0.5;
        private double fallbackRangePct = 0.1;
    }

    @Data public static class Confidence {
        private int highThreshold = 80;
        private int mediumThreshold = 60;
    }

    @Data public static class Recommendation {
        private double buyDeltaPct = 10;
        private double strongDeltaPct = 20;
        private double minConfidence = 60;
        private double minConfidenceStrong = 40;
    }
}
