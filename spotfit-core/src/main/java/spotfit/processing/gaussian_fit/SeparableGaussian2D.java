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

import static spotfit.processing.gaussian_fit.FitParameter.*;

/**
 * A 2-dimensional, axis-aligned, normalized Gaussian peak function plus a constant background.
 * <p>
 * This fitting target function is defined over dimension <code>2</code>, by the
 * following <code>6</code> parameters:
 *
 * <pre>
 * k = 0..1    - x₀, y₀
 * k = 2       - N
 * k = 3       - C
 * k = 4..5    - σx, σy
 * </pre>
 *
 * with
 *
 * <pre>
 * f(x, y) = N × g(y; y₀, σy) × g(x; x₀, σx) + C
 * g(t; μ, σ) = 1 / (√(2π) σ) × exp( - (t - μ)² / (2σ²) )
 * </pre>
 *
 * The function is separable: on the pixel grid of a spot, the model is the outer product of two 1D profiles.
 * The profile and model buffers are reused between evaluations, thus an instance must not be shared between threads.
 *
 * @author Jean Ollion
 */
public class SeparableGaussian2D implements FitFunctionCustom {
	public static final double INV_SQRT_2PI = 0.3989422804014327;
	final Grid grid;
	final double[] profileX, profileY;

	public SeparableGaussian2D(Grid grid) {
		this.grid = grid;
		this.profileX = new double[grid.size()];
		this.profileY = new double[grid.size()];
	}

	public Grid getGrid() {
		return grid;
	}

	@Override
	public String toString() {
		return "Separable Gaussian function N × g(y; y₀, σy) × g(x; x₀, σx) + C";
	}

	/**
	 * Normalized 1D gaussian density
	 * @param mu center
	 * @param sigma standard deviation
	 * @param grid points where the density is evaluated
	 * @param profile output, same length as grid
	 * @return profile
	 */
	public static double[] profile(double mu, double sigma, double[] grid, double[] profile) {
		double norm = INV_SQRT_2PI / sigma;
		for (int k = 0; k<grid.length; ++k) {
			double d = (grid[k] - mu) / sigma;
			profile[k] = norm * Math.exp(-0.5 * d * d);
		}
		return profile;
	}

	/**
	 * Computes the model on the whole spot grid
	 * @param a parameters
	 * @param model output in row-major order, length size²
	 * @return model
	 */
	public double[] model(double[] a, double[] model) {
		double[] g = grid.getValues();
		profile(a[X], a[SX], g, profileX);
		profile(a[Y], a[SY], g, profileY);
		int size = g.length;
		double n = a[PHOTONS];
		double bg = a[BG];
		for (int i = 0; i<size; ++i) {
			double ny = n * profileY[i];
			int off = i * size;
			for (int j = 0; j<size; ++j) model[off + j] = ny * profileX[j] + bg;
		}
		return model;
	}

	/**
	 * @param a parameters
	 * @param spot observed values in row-major order
	 * @param residuals output: spot - model, in row-major order
	 * @return residuals
	 */
	public double[] residuals(double[] a, double[] spot, double[] residuals) {
		model(a, residuals);
		for (int i = 0; i<residuals.length; ++i) residuals[i] = spot[i] - residuals[i];
		return residuals;
	}

	@Override
	public void values(double[][] x, double[] a, double[] values) {
		if (x == grid.getCoordinates()) model(a, values);
		else for (int i = 0; i<x.length; ++i) values[i] = val(x[i], a);
	}

	@Override
	public final double val(final double[] x, final double[] a) {
		return a[PHOTONS] * G(x[0], a[X], a[SX]) * G(x[1], a[Y], a[SY]) + a[BG];
	}

	/**
	 * Partial derivatives indices are ordered as follows:
	 * <pre>
	 * k = 0..1    - x₀, y₀
	 * k = 2       - N
	 * k = 3       - C
	 * k = 4..5    - σx, σy
	 * </pre>
	 */
	@Override
	public final double grad(final double[] x, final double[] a, final int k) {
		switch (k) {
			case PHOTONS:
				return G(x[0], a[X], a[SX]) * G(x[1], a[Y], a[SY]);
			case BG:
				return 1;
			case X:
			case Y: {
				double d = x[k] - a[k];
				double s = a[k + SX];
				return a[PHOTONS] * G(x[0], a[X], a[SX]) * G(x[1], a[Y], a[SY]) * d / (s * s);
			}
			case SX:
			case SY: {
				int dim = k - SX;
				double d = x[dim] - a[dim];
				double s = a[k];
				return a[PHOTONS] * G(x[0], a[X], a[SX]) * G(x[1], a[Y], a[SY]) * (d * d / (s * s * s) - 1 / s);
			}
			default:
				throw new IllegalArgumentException("k must be inferior to "+N_PARAMETERS);
		}
	}

	@Override
	public boolean isValid(double[] a) {
		for (double v : a) if (!Double.isFinite(v)) return false;
		return a[SX] > 0 && a[SY] > 0;
	}

	@Override
	public int getNParameters() {
		return N_PARAMETERS;
	}

	private static double G(double t, double mu, double sigma) {
		double d = (t - mu) / sigma;
		return INV_SQRT_2PI / sigma * Math.exp(-0.5 * d * d);
	}
}
