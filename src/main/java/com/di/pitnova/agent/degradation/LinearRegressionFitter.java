package com.di.pitnova.agent.degradation;

import org.ejml.UtilEjml;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.decomposition.svd.SafeSvd_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;

/**
 * Ordinary least squares with intercept. Regressors and target are mean-centred and solved through
 * the SVD pseudo-inverse, so a rank-deficient design (e.g. fuel load falling exactly in step with
 * lap-in-stint) gives the minimum-norm coefficients instead of failing. The intercept is recovered
 * as {@code mean(y) - mean(x) . beta}.
 */
final class LinearRegressionFitter {

    private LinearRegressionFitter() {}

    /**
     * @param x row-major design, one row per sample, no intercept column
     * @param y targets, same length as {@code x}
     */
    static LinearFit fit(double[][] x, double[] y) {
        int n = y.length;
        if (n == 0 || x.length != n) {
            throw new IllegalArgumentException("design and target must be non-empty and of equal length");
        }
        int p = x[0].length;

        double[] xMean = new double[p];
        double yMean = 0.0;
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) xMean[j] += x[i][j];
            yMean += y[i];
        }
        for (int j = 0; j < p; j++) xMean[j] /= n;
        yMean /= n;

        DMatrixRMaj a = new DMatrixRMaj(n, p);
        double[] b = new double[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) a.unsafe_set(i, j, x[i][j] - xMean[j]);
            b[i] = y[i] - yMean;
        }

        double[] beta = solveMinimumNorm(a, b, n, p);

        double intercept = yMean;
        for (int j = 0; j < p; j++) intercept -= xMean[j] * beta[j];

        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < n; i++) {
            double fitted = intercept;
            for (int j = 0; j < p; j++) fitted += beta[j] * x[i][j];
            ssRes += (y[i] - fitted) * (y[i] - fitted);
            ssTot += (y[i] - yMean) * (y[i] - yMean);
        }
        double r2 = ssTot > 0.0 ? 1.0 - ssRes / ssTot : 1.0;
        return new LinearFit(intercept, beta, r2);
    }

    private static double[] solveMinimumNorm(DMatrixRMaj a, double[] b, int n, int p) {
        double[] beta = new double[p];
        SingularValueDecomposition_F64<DMatrixRMaj> svd =
                new SafeSvd_DDRM(DecompositionFactory_DDRM.svd(n, p, true, true, true));
        if (!svd.decompose(a)) {
            throw new IllegalStateException("SVD failed to converge on a " + n + "x" + p + " design");
        }
        DMatrixRMaj u = svd.getU(null, false);
        DMatrixRMaj v = svd.getV(null, false);
        double[] s = svd.getSingularValues();
        int k = svd.numberOfSingularValues();

        double maxS = 0.0;
        for (int i = 0; i < k; i++) maxS = Math.max(maxS, s[i]);
        double tol = Math.max(n, p) * maxS * UtilEjml.EPS;

        for (int i = 0; i < k; i++) {
            if (s[i] <= tol) continue;
            double ub = 0.0;
            for (int r = 0; r < n; r++) ub += u.unsafe_get(r, i) * b[r];
            double scale = ub / s[i];
            for (int j = 0; j < p; j++) beta[j] += scale * v.unsafe_get(j, i);
        }
        return beta;
    }

    /** Intercept, slope coefficients in design-column order, and R². */
    record LinearFit(double intercept, double[] coefficients, double rSquared) {}
}
