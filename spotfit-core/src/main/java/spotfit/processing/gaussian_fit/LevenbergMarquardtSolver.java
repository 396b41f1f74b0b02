/*
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of SPOTFIT
 *
 * SPOTFIT is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SPOTFIT is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SPOTFIT.  If not, see <http://www.gnu.org/licenses/>.
 */
package spotfit.processing.gaussian_fit;

import Jama.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Levenberg-Marquardt least-square solver with a Jacobian estimated by forward differences.
 * Termination criteria are relative: on the decrease of the sum of squared residuals (fTol) and on the parameter step (xTol).
 * When no criterion is met within the maximal number of iterations, the last accepted parameters are kept.
 * @author Jean Ollion
 */
public class LevenbergMarquardtSolver {
    public static final Logger logger = LoggerFactory.getLogger(LevenbergMarquardtSolver.class);
    public static final double EPSFCN = Math.sqrt(Math.ulp(1d)); // relative step for finite differences
    static final double MAX_LAMBDA = 1e16;
    static final double MIN_DIAGONAL = 1e-12; // damping of parameters the residuals do not depend on
    private final int maxIteration;
    private final double lambda;
    private final double fTol, xTol;
    private final boolean numericalJacobian;

    /**
     * Creates a new Levenberg-Marquardt solver for least-square curve fitting problems.
     * @param maxIteration stop and return after this many iterations if not done
     * @param lambda blend between steepest descent (lambda high) and
     *	jump to bottom of quadratic (lambda zero). Start with 0.001.
     * @param fTol relative decrease of the sum of squared residuals below which the fit is considered converged
     * @param xTol relative parameter step below which the fit is considered converged
     * @param numericalJacobian if true, derivatives are estimated by forward differences, otherwise {@link FitFunctionCustom#grad(double[], double[], int)} is used
     */
    public LevenbergMarquardtSolver(int maxIteration, double lambda, double fTol, double xTol, boolean numericalJacobian) {
        this.maxIteration = maxIteration;
        this.lambda = lambda;
        this.fTol = fTol;
        this.xTol = xTol;
        this.numericalJacobian = numericalJacobian;
    }

    /**
     * Creates a new Levenberg-Marquardt solver with default parameters set to:
     * <ul>
     * 	<li> <code>maxIter = 200</code>
     * 	<li> <code>lambda  = 1e-3</code>
     * 	<li> <code>fTol = xTol = 1e-2</code>
     * 	<li> numerical Jacobian
     * </ul>
     */
    public LevenbergMarquardtSolver() {
        this(200, 1e-3, 1e-2, 1e-2, true);
    }

    @Override
    public String toString() {
        return "Levenberg-Marquardt least-square curve fitting algorithm";
    }

    /**
     * Fits the function f to the observations
     * @param x domain points
     * @param y observed values at {@code x}
     * @param a start parameters, replaced by the fitted parameters
     * @param f model function
     */
    public void fit(double[][] x, double[] y, double[] a, FitFunctionCustom f) {
        fitWithStatus(x, y, a, f);
    }

    /**
     * Same as {@link #fit(double[][], double[], double[], FitFunctionCustom)}, also returns the termination status
     */
    public FitResult fitWithStatus(double[][] x, double[] y, double[] a, FitFunctionCustom f) {
        return solve(x, a, y, f, lambda, fTol, xTol, maxIteration, numericalJacobian);
    }

    /*
     * STATIC METHODS
     */

    /**
     * Calculate the current sum-squared-error
     */
    public static double chiSquared(final double[] y, final double[] values) {
        double sum = 0.;
        for (int i = 0; i < y.length; i++) {
            double d = y[i] - values[i];
            sum += d * d;
        }
        return sum;
    }

    /**
     * Fills the Jacobian of f with respect to the parameters: jac[i][k] = df(x[i])/da[k]
     * @param values f evaluated at a
     * @param work buffer of same length as values
     */
    public static void jacobian(final double[][] x, final double[] a, final FitFunctionCustom f, final double[] values, final double[] work, final double[][] jac, boolean numerical) {
        if (!numerical) {
            for (int i = 0; i<x.length; ++i) {
                for (int k = 0; k<a.length; ++k) jac[i][k] = f.grad(x[i], a, k);
            }
            return;
        }
        for (int k = 0; k<a.length; ++k) {
            double ak = a[k];
            double h = EPSFCN * Math.max(Math.abs(ak), 1);
            a[k] = ak + h;
            f.values(x, a, work);
            a[k] = ak;
            for (int i = 0; i<x.length; ++i) jac[i][k] = (work[i] - values[i]) / h;
        }
    }

    /**
     * Minimize E = sum {(y[k] - f(x[k],a)) }^2
     * Note that function implements the value and gradient of f(x,a),
     * NOT the value and gradient of E with respect to a!
     *
     * @param x array of domain points, each may be multidimensional
     * @param a the parameters/state of the model, modified in place: contains the last accepted parameters on return
     * @param y corresponding array of values
     * @param lambda blend between steepest descent (lambda high) and
     *	jump to bottom of quadratic (lambda zero). Start with 0.001.
     * @param fTol relative decrease of E below which the fit is converged
     * @param xTol relative parameter step below which the fit is converged
     * @param maxIter stop and return after this many iterations if not done
     * @param numericalJacobian whether derivatives are estimated by forward differences
     *
     * @return fit status, holding a reference to {@code a}
     */
    public static FitResult solve(double[][] x, double[] a, double[] y, FitFunctionCustom f, double lambda, double fTol, double xTol, int maxIter, boolean numericalJacobian) {
        final int npts = y.length;
        final int nparm = a.length;
        double[] values = new double[npts];
        double[] nextValues = new double[npts];
        double[] work = new double[npts];
        double[][] jac = new double[npts][nparm];
        double[] na = new double[nparm]; // next parameters

        f.values(x, a, values);
        double e0 = chiSquared(y, values);
        if (!Double.isFinite(e0)) {
            logger.debug("invalid start point: {} chi²={}", FitParameter.toString(a), e0);
            return new FitResult(a, 0, false, e0);
        }
        if (e0 == 0) return new FitResult(a, 0, true, e0);

        // g = gradient, JtJ = jacobian, d = step to minimum
        // JtJ d = g, solve for d
        double[][] JtJ = new double[nparm][nparm];
        double[][] A = new double[nparm][nparm];
        double[] g = new double[nparm];
        boolean recompute = true;
        boolean converged = false;
        int iter = 0;
        while (iter < maxIter) {
            ++iter;
            if (recompute) {
                jacobian(x, a, f, values, work, jac, numericalJacobian);
                for (int r = 0; r < nparm; r++) {
                    g[r] = 0.;
                    for (int c = 0; c < nparm; c++) JtJ[r][c] = 0.;
                }
                for (int i = 0; i < npts; i++) {
                    double res = y[i] - values[i];
                    double[] ji = jac[i];
                    for (int r = 0; r < nparm; r++) {
                        g[r] += res * ji[r];
                        for (int c = r; c < nparm; c++) JtJ[r][c] += ji[r] * ji[c];
                    }
                }
                for (int r = 0; r < nparm; r++) {
                    for (int c = 0; c < r; c++) JtJ[r][c] = JtJ[c][r];
                }
                recompute = false;
            }
            // boost diagonal towards gradient descent
            for (int r = 0; r < nparm; r++) {
                System.arraycopy(JtJ[r], 0, A[r], 0, nparm);
                A[r][r] += lambda * Math.max(JtJ[r][r], MIN_DIAGONAL);
            }
            double[] d;
            try {
                d = new Matrix(A).lu().solve(new Matrix(g, nparm)).getRowPackedCopy();
            } catch (RuntimeException re) { // Matrix is singular
                lambda *= 10.;
                if (lambda > MAX_LAMBDA) break;
                continue;
            }
            for (int k = 0; k < nparm; k++) na[k] = a[k] + d[k];
            double e1 = Double.NaN;
            if (f.isValid(na)) {
                f.values(x, na, nextValues);
                e1 = chiSquared(y, nextValues);
            }
            if (Double.isNaN(e1) || e1 > e0) { // new location worse than before
                lambda *= 10.;
                if (lambda > MAX_LAMBDA) break;
                continue;
            }
            // new location better, accept new parameters
            double actualReduction = (e0 - e1) / e0;
            double predictedReduction = 0;
            for (int r = 0; r < nparm; r++) {
                double jd = 0;
                for (int c = 0; c < nparm; c++) jd += JtJ[r][c] * d[c];
                predictedReduction += d[r] * (2 * g[r] - jd);
            }
            predictedReduction /= e0;
            boolean smallStep = true;
            for (int k = 0; k < nparm; k++) {
                if (Math.abs(d[k]) > xTol * (Math.abs(na[k]) + xTol)) {
                    smallStep = false;
                    break;
                }
            }
            lambda *= 0.1;
            e0 = e1;
            // simply assigning a = na will not get results copied back to caller
            System.arraycopy(na, 0, a, 0, nparm);
            double[] tmp = values;
            values = nextValues;
            nextValues = tmp;
            recompute = true;
            if (e1 == 0 || smallStep || (actualReduction <= fTol && predictedReduction <= fTol)) {
                converged = true;
                break;
            }
        }
        if (!converged && logger.isTraceEnabled()) logger.trace("fit did not converge after {} iterations: {} chi²={}", iter, FitParameter.toString(a), e0);
        return new FitResult(a, iter, converged, e0);
    }
}
