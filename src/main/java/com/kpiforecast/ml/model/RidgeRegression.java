package com.kpiforecast.ml.model;

/**
 * Penalized least squares solved through the Cholesky factor of {@code XᵀX + diag(penalties)}.
 * The factor is kept so predictive variances can be computed for new rows.
 */
final class RidgeRegression {

    private final double[] coefficients;
    private final double[][] factor;
    private final double residualVariance;

    private RidgeRegression(double[] coefficients, double[][] factor, double residualVariance) {
        this.coefficients = coefficients;
        this.factor = factor;
        this.residualVariance = residualVariance;
    }

    static RidgeRegression fit(double[][] x, double[] y, double[] penalties) {
        int n = x.length;
        int p = penalties.length;
        double[][] gram = new double[p][p];
        double[] xty = new double[p];
        for (int r = 0; r < n; r++) {
            double[] row = x[r];
            for (int i = 0; i < p; i++) {
                xty[i] += row[i] * y[r];
                for (int j = 0; j <= i; j++) {
                    gram[i][j] += row[i] * row[j];
                }
            }
        }
        for (int i = 0; i < p; i++) {
            gram[i][i] += penalties[i];
            for (int j = 0; j < i; j++) {
                gram[j][i] = gram[i][j];
            }
        }

        double[][] factor = cholesky(gram);
        double[] coefficients = backSubstitute(factor, forwardSubstitute(factor, xty));

        double sse = 0.0;
        for (int r = 0; r < n; r++) {
            double err = y[r] - dot(x[r], coefficients);
            sse += err * err;
        }
        return new RidgeRegression(coefficients, factor, n == 0 ? 0.0 : sse / n);
    }

    double predict(double[] row) {
        return dot(row, coefficients);
    }

    /** σ² (1 + xᵀA⁻¹x): noise plus parameter uncertainty for a new observation. */
    double predictiveVariance(double[] row) {
        double[] z = forwardSubstitute(factor, row);
        double quad = 0.0;
        for (double v : z) {
            quad += v * v;
        }
        return residualVariance * (1.0 + quad);
    }

    double residualVariance() {
        return residualVariance;
    }

    double coefficient(int index) {
        return coefficients[index];
    }

    private static double[][] cholesky(double[][] a) {
        int p = a.length;
        double[][] l = new double[p][p];
        for (int i = 0; i < p; i++) {
            for (int j = 0; j <= i; j++) {
                double sum = a[i][j];
                for (int k = 0; k < j; k++) {
                    sum -= l[i][k] * l[j][k];
                }
                if (i == j) {
                    if (sum <= 0.0) {
                        throw new IllegalStateException("design matrix is not positive definite at column " + i);
                    }
                    l[i][i] = Math.sqrt(sum);
                } else {
                    l[i][j] = sum / l[j][j];
                }
            }
        }
        return l;
    }

    private static double[] forwardSubstitute(double[][] l, double[] b) {
        int p = b.length;
        double[] z = new double[p];
        for (int i = 0; i < p; i++) {
            double sum = b[i];
            for (int k = 0; k < i; k++) {
                sum -= l[i][k] * z[k];
            }
            z[i] = sum / l[i][i];
        }
        return z;
    }

    private static double[] backSubstitute(double[][] l, double[] z) {
        int p = z.length;
        double[] w = new double[p];
        for (int i = p - 1; i >= 0; i--) {
            double sum = z[i];
            for (int k = i + 1; k < p; k++) {
                sum -= l[k][i] * w[k];
            }
            w[i] = sum / l[i][i];
        }
        return w;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
