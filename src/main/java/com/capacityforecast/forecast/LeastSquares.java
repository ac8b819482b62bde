package com.capacityforecast.forecast;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Linear least-squares fits shared by the regression-based models.
 */
final class LeastSquares {

    private LeastSquares() {
    }

    /**
     * Ordinary least squares with an intercept. Returns {@code [intercept, b1, ..., bk]}.
     */
    static double[] ols(double[] y, double[][] x) {
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
        regression.newSampleData(y, x);
        return regression.estimateRegressionParameters();
    }

    /**
     * Ridge regression over an explicit design matrix. Columns flagged in {@code penalized}
     * receive the {@code lambda} penalty; the others are fitted freely.
     */
    static double[] ridge(double[] y, double[][] x, boolean[] penalized, double lambda) {
        RealMatrix design = new Array2DRowRealMatrix(x, false);
        RealMatrix gram = design.transpose().multiply(design);
        for (int j = 0; j < penalized.length; j++) {
            if (penalized[j]) {
                gram.addToEntry(j, j, lambda);
            }
        }
        RealVector rhs = design.transpose().operate(new ArrayRealVector(y, false));
        return new LUDecomposition(gram).getSolver().solve(rhs).toArray();
    }

    static double predict(double[] coefficients, double[] row, boolean intercept) {
        int offset = intercept ? 1 : 0;
        double value = intercept ? coefficients[0] : 0.0;
        for (int j = 0; j < row.length; j++) {
            value += coefficients[j + offset] * row[j];
        }
        return value;
    }
}
