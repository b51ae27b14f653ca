package com.paperradar.common.similarity;

final class VectorMath {

    private VectorMath() {}

    static void requireDimension(float[] vector, int dimension) {
        if (vector == null || vector.length != dimension) {
            throw new IllegalArgumentException("expected vector of length " + dimension
                + ", got " + (vector == null ? "null" : vector.length));
        }
    }

    /** Unit-length copy; a zero vector stays zero. */
    static float[] normalize(float[] vector) {
        double norm = 0.0;
        for (float v : vector) norm += (double) v * v;
        norm = Math.sqrt(norm);
        float[] out = new float[vector.length];
        if (norm == 0.0) return out;
        for (int i = 0; i < vector.length; i++) out[i] = (float) (vector[i] / norm);
        return out;
    }

    static double dot(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) sum += (double) a[i] * b[i];
        return sum;
    }
}
