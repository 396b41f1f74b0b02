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

/**
 * Outcome of a least-square fit: last accepted parameters and termination status
 * @author Jean Ollion
 */
public class FitResult {
    final double[] parameters;
    final int iterations;
    final boolean converged;
    final double chiSquared;

    public FitResult(double[] parameters, int iterations, boolean converged, double chiSquared) {
        this.parameters = parameters;
        this.iterations = iterations;
        this.converged = converged;
        this.chiSquared = chiSquared;
    }

    /**
     * @return result of a spot that was not fitted: NaN parameters
     */
    public static FitResult unfitted() {
        return new FitResult(FitParameter.nanParameters(), 0, false, Double.NaN);
    }

    public double[] getParameters() {
        return parameters;
    }

    public int getIterations() {
        return iterations;
    }

    /**
     * @return true if a tolerance criterion was met before the maximal number of iterations was reached
     */
    public boolean isConverged() {
        return converged;
    }

    public double getChiSquared() {
        return chiSquared;
    }

    public boolean isFitted() {
        return !Double.isNaN(chiSquared);
    }

    @Override
    public String toString() {
        return "FitResult{"+FitParameter.toString(parameters)+", iterations="+iterations+", converged="+converged+", chi²="+chiSquared+"}";
    }
}
