package com.dynop.wayfinding.syntax;

/**
 * Diamond-shaped justified graph values D_k used to relativize real asymmetry across graph sizes.
 *
 * <p>For 3 &le; k &le; 16 the tabulated values are used; above that the closed form
 * {@code 2(k(log2((k+2)/3) - 1) + 1) / ((k-1)(k-2))} is evaluated directly.
 */
public final class DiamondNormalization {

    /** Largest component size served from the table. */
    public static final int TABLE_LIMIT = 16;

    private static final double[] TABLE = {
            // k = 3 .. 16
            0.211, 0.333, 0.352, 0.349, 0.340, 0.328, 0.317,
            0.306, 0.295, 0.285, 0.276, 0.267, 0.259, 0.251
    };

    private DiamondNormalization() {
    }

    /**
     * @param k Component size, at least 3
     * @return D_k
     * @throws IllegalArgumentException if {@code k < 3}
     */
    public static double value(int k) {
        if (k < 3) {
            throw new IllegalArgumentException("D_k is defined for k >= 3, was " + k);
        }
        if (k <= TABLE_LIMIT) {
            return TABLE[k - 3];
        }
        return closedForm(k);
    }

    static double closedForm(int k) {
        double log2 = Math.log((k + 2) / 3.0) / Math.log(2);
        return 2.0 * (k * (log2 - 1) + 1) / ((double) (k - 1) * (k - 2));
    }
}
