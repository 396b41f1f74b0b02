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
 * Model function f(x; a) fitted by {@link LevenbergMarquardtSolver}
 */
public interface FitFunctionCustom {
    /**
     * @param x domain point
     * @param a parameters
     * @return f(x; a)
     */
    double val(double[] x, double[] a);

    /**
     * @return partial derivative df(x; a)/da[k]
     */
    double grad(double[] x, double[] a, int k);

    int getNParameters();

    default boolean isValid(double[] parameters) {
        for (double v : parameters) if (!Double.isFinite(v)) return false;
        return true;
    }

    /**
     * Evaluates the function on all domain points at once
     * @param x domain points
     * @param a parameters
     * @param values output array, same length as {@code x}
     */
    default void values(double[][] x, double[] a, double[] values) {
        for (int i = 0; i<x.length; ++i) values[i] = val(x[i], a);
    }
}
