package com.github.commodityvar.risk;

/**
 * Outcome of one breakdown partition: a VaR figure or the reason there is none.
 *
 * @param dimension Breakdown dimension label, e.g. {@code BUSINESS LINE}
 * @param value     Partition value, e.g. {@code Copper}
 * @param var       VaR of the partition, null on failure
 * @param error     Failure kind, null on success
 * @param message   Human-readable failure cause, null on success
 */
public record PartitionResult(
        String dimension,
        String value,
        Double var,
        RiskErrorKind error,
        String message
) {

    public static PartitionResult success(String dimension, String value, double var) {
        return new PartitionResult(dimension, value, var, null, null);
    }

    public static PartitionResult failure(String dimension, String value, RiskCalculationException e) {
        return new PartitionResult(dimension, value, null, e.kind(), e.getMessage());
    }

    public static PartitionResult failure(String dimension, String value, RiskErrorKind kind, String message) {
        return new PartitionResult(dimension, value, null, kind, message);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
