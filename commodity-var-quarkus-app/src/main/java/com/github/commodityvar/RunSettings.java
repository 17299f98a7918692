package com.github.commodityvar;

import java.util.List;

/**
 * Effective settings of a single VaR run.
 */
public record RunSettings(
        String method,
        double confidenceLevel,
        int lookbackDays,
        int horizonDays,
        List<String> breakdownDimensions,
        double outlierThreshold,
        boolean parallelPartitions
) {}
