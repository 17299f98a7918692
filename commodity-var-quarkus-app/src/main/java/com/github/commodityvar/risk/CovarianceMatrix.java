package com.github.commodityvar.risk;

import com.github.commodityvar.market.InstrumentKey;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Covariance of daily returns, indexed by instrument.
 * <p>
 * Rows and columns follow {@link #instruments()}. Instances are immutable.
 */
public final class CovarianceMatrix {

    private final List<InstrumentKey> instruments;
    private final Map<InstrumentKey, Integer> index;
    private final double[][] values;
    private final int observations;

    CovarianceMatrix(List<InstrumentKey> instruments, double[][] values, int observations) {
        if (values.length != instruments.size()) {
            throw new IllegalArgumentException("Expected " + instruments.size() + " rows but got " + values.length);
        }
        this.instruments = List.copyOf(instruments);
        this.index = new HashMap<>();
        for (int i = 0; i < this.instruments.size(); i++) {
            index.put(this.instruments.get(i), i);
        }
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != values.length) {
                throw new IllegalArgumentException("Covariance matrix must be square");
            }
            this.values[i] = values[i].clone();
        }
        this.observations = observations;
    }

    public static CovarianceMatrix of(List<InstrumentKey> instruments, double[][] values) {
        return new CovarianceMatrix(instruments, values, 0);
    }

    public List<InstrumentKey> instruments() {
        return instruments;
    }

    public int size() {
        return instruments.size();
    }

    public boolean isEmpty() {
        return instruments.isEmpty();
    }

    /**
     * Number of return observations the matrix was estimated from.
     */
    public int observations() {
        return observations;
    }

    public int indexOf(InstrumentKey key) {
        Integer i = index.get(key);
        return i != null ? i : -1;
    }

    public boolean contains(InstrumentKey key) {
        return index.containsKey(key);
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    public double get(InstrumentKey row, InstrumentKey column) {
        int i = indexOf(row);
        int j = indexOf(column);
        if (i < 0 || j < 0) {
            throw new IllegalArgumentException("Instrument not in covariance matrix: " + (i < 0 ? row : column));
        }
        return values[i][j];
    }

    public double variance(InstrumentKey key) {
        return get(key, key);
    }

    public RealMatrix toRealMatrix() {
        return MatrixUtils.createRealMatrix(values);
    }

    @Override
    public String toString() {
        return "CovarianceMatrix{instruments=" + instruments + ", observations=" + observations + "}";
    }
}
