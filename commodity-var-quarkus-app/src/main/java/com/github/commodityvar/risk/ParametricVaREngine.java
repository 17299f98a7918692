package com.github.commodityvar.risk;

import com.github.commodityvar.market.InstrumentKey;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.jboss.logging.Logger;

/**
 * Variance-covariance Value-at-Risk.
 * <p>
 * {@code VaR = portfolioValue * z * sqrt(w' * Sigma * w)} where {@code w} is the
 * weight vector laid out in the covariance matrix's instrument order. Instruments
 * without return history are not in the matrix and contribute no variance.
 */
public class ParametricVaREngine {

    private static final Logger LOG = Logger.getLogger(ParametricVaREngine.class);

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    /**
     * Standard normal quantile at the given confidence, e.g. 2.326 for 0.99.
     */
    public static double zScore(double confidenceLevel) {
        checkConfidence(confidenceLevel);
        return STANDARD_NORMAL.inverseCumulativeProbability(confidenceLevel);
    }

    public static void checkConfidence(double confidenceLevel) {
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new IllegalArgumentException("Confidence level must be in (0, 1): " + confidenceLevel);
        }
    }

    /**
     * Scales a one-day VaR to a {@code days}-day horizon by the square root of time.
     */
    public static double scaleToHorizon(double oneDayVaR, int days) {
        checkHorizon(days);
        return oneDayVaR * Math.sqrt(days);
    }

    public static void checkHorizon(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("Horizon must be at least one day: " + days);
        }
    }

    /**
     * Portfolio return variance {@code w' * Sigma * w}, never below zero.
     */
    public double portfolioVariance(WeightVector weights, CovarianceMatrix covariance) {
        if (covariance.isEmpty()) {
            return 0.0;
        }
        for (InstrumentKey key : weights.weights().keySet()) {
            if (!covariance.contains(key)) {
                LOG.debugf("%s has no return history, its weight counts as zero", key);
            }
        }
        RealVector w = new ArrayRealVector(weights.reindex(covariance.instruments()), false);
        double variance = w.dotProduct(covariance.toRealMatrix().operate(w));
        // PSD matrix, a negative value is rounding noise
        return Math.max(variance, 0.0);
    }

    public double valueAtRisk(WeightVector weights, CovarianceMatrix covariance, double zScore, double portfolioValue) {
        double volatility = Math.sqrt(portfolioVariance(weights, covariance));
        return portfolioValue * zScore * volatility;
    }
}
