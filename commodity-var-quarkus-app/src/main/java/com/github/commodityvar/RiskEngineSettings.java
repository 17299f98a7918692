package com.github.commodityvar;

import com.github.commodityvar.dto.RiskRequest;
import com.github.commodityvar.market.UnitTable;
import com.github.commodityvar.risk.ParametricVaREngine;
import com.github.commodityvar.risk.VaRModel;
import io.quarkus.logging.Log;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.List;
import java.util.Locale;

@ApplicationScoped
public class RiskEngineSettings {

    @ConfigProperty(name = "var.method", defaultValue = VaRModel.PARAMETRIC)
    String method;

    @ConfigProperty(name = "var.confidence-level", defaultValue = "0.99")
    double confidenceLevel;

    @ConfigProperty(name = "var.lookback-days", defaultValue = "365")
    int lookbackDays;

    @ConfigProperty(name = "var.horizon-days", defaultValue = "1")
    int horizonDays;

    @ConfigProperty(name = "var.breakdown-dimensions", defaultValue = "Total,BUSINESS LINE,METAL")
    List<String> breakdownDimensions;

    @ConfigProperty(name = "var.outlier-threshold", defaultValue = "4.0")
    double outlierThreshold;

    @ConfigProperty(name = "var.parallel-partitions", defaultValue = "false")
    boolean parallelPartitions;

    @ConfigProperty(name = "var.units.position", defaultValue = "LB:0.0004536,MT:1.0")
    List<String> positionUnits;

    @ConfigProperty(name = "var.units.price", defaultValue = "USD/LB:0.0004536,USD/MT:1.0")
    List<String> priceUnits;

    private UnitTable positionUnitTable;
    private UnitTable priceUnitTable;

    @PostConstruct
    void init() {
        validate(defaults());
        positionUnitTable = UnitTable.parse(positionUnits);
        priceUnitTable = UnitTable.parse(priceUnits);
        Log.infof("VaR defaults: method=%s, confidence=%s, lookback=%dd, horizon=%dd, breakdowns=%s",
                method, confidenceLevel, lookbackDays, horizonDays, breakdownDimensions);
    }

    public RunSettings defaults() {
        return new RunSettings(
                normalizeMethod(method),
                confidenceLevel,
                lookbackDays,
                horizonDays,
                List.copyOf(breakdownDimensions),
                outlierThreshold,
                parallelPartitions
        );
    }

    /**
     * Applies the request's overrides on top of the configured defaults.
     */
    public RunSettings resolve(RiskRequest request, String methodOverride) {
        RunSettings defaults = defaults();
        String resolvedMethod = methodOverride != null ? methodOverride
                : request.method() != null ? request.method() : defaults.method();
        RunSettings settings = new RunSettings(
                normalizeMethod(resolvedMethod),
                request.confidenceLevel() != null ? request.confidenceLevel() : defaults.confidenceLevel(),
                request.lookbackDays() != null ? request.lookbackDays() : defaults.lookbackDays(),
                request.horizonDays() != null ? request.horizonDays() : defaults.horizonDays(),
                request.breakdownDimensions() != null ? breakdownLabels(request.breakdownDimensions()) : defaults.breakdownDimensions(),
                defaults.outlierThreshold(),
                defaults.parallelPartitions()
        );
        validate(settings);
        return settings;
    }

    public UnitTable positionUnits() {
        return positionUnitTable;
    }

    public UnitTable priceUnits() {
        return priceUnitTable;
    }

    static void validate(RunSettings settings) {
        if (!VaRModel.isKnown(settings.method())) {
            throw new IllegalArgumentException("Unknown VaR method: " + settings.method());
        }
        ParametricVaREngine.checkConfidence(settings.confidenceLevel());
        ParametricVaREngine.checkHorizon(settings.horizonDays());
        if (settings.lookbackDays() < 0) {
            throw new IllegalArgumentException("Lookback must not be negative: " + settings.lookbackDays());
        }
        if (!(settings.outlierThreshold() > 0)) {
            throw new IllegalArgumentException("Outlier threshold must be positive: " + settings.outlierThreshold());
        }
    }

    private static List<String> breakdownLabels(List<String> labels) {
        for (int i = 0; i < labels.size(); i++) {
            if (labels.get(i) == null || labels.get(i).isBlank()) {
                throw new IllegalArgumentException("breakdownDimensions[" + i + "]: label is missing");
            }
        }
        return List.copyOf(labels);
    }

    private static String normalizeMethod(String method) {
        return method != null ? method.trim().toLowerCase(Locale.ROOT) : null;
    }
}
