package com.riansoft.delivery_dispatch.model;

/**
 * Square arc-cost matrix over depot and customers, in meters. Not required to be symmetric.
 */
public class DistanceMatrix {
    private final double[][] values;

    public DistanceMatrix(double[][] values) {
        int size = values.length;
        if (size == 0) {
            throw new IllegalArgumentException("Distance matrix must not be empty");
        }
        this.values = new double[size][];
        for (int i = 0; i < size; i++) {
            if (values[i] == null || values[i].length != size) {
                throw new IllegalArgumentException("Distance matrix row " + i + " is not of length " + size);
            }
            for (int j = 0; j < size; j++) {
                double value = values[i][j];
                if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
                    throw new IllegalArgumentException("Invalid distance at [" + i + "][" + j + "]: " + value);
                }
            }
            if (values[i][i] != 0) {
                throw new IllegalArgumentException("Distance from node " + i + " to itself must be 0");
            }
            this.values[i] = values[i].clone();
        }
    }

    public int size() {
        return values.length;
    }

    public double get(int from, int to) {
        return values[from][to];
    }

    /**
     * Integral copy for solvers that only accept long arc costs.
     */
    public long[][] toLongMatrix() {
        long[][] matrix = new long[values.length][values.length];
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < values.length; j++) {
                matrix[i][j] = Math.round(values[i][j]);
            }
        }
        return matrix;
    }

    /**
     * Sub-matrix over the given node ids, in the given order.
     */
    public DistanceMatrix subMatrix(int[] nodeIds) {
        double[][] sub = new double[nodeIds.length][nodeIds.length];
        for (int i = 0; i < nodeIds.length; i++) {
            for (int j = 0; j < nodeIds.length; j++) {
                sub[i][j] = values[nodeIds[i]][nodeIds[j]];
            }
        }
        return new DistanceMatrix(sub);
    }
}
