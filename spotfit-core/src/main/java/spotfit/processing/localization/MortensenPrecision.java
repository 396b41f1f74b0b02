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
package spotfit.processing.localization;

/**
 * Localization precision of a gaussian spot with pixelation and background noise (Mortensen et al. 2010, Nature Methods 7:377):
 * <pre>
 * σa² = σ² + 1/12
 * v = σa² × (16/9 + 8π σa² bg / N) / N
 * </pre>
 * v is doubled with electron-multiplying gain (excess noise factor √2). Precision is √v, NaN if undefined.
 * @author Jean Ollion
 */
public class MortensenPrecision implements LocalizationPrecision {
    @Override
    public double compute(double photons, double sigma, double bg, boolean emGain) {
        double sa2 = sigma * sigma + 1d / 12;
        double v = sa2 * (16d / 9 + (8 * Math.PI * sa2 * bg) / photons) / photons;
        if (emGain) v *= 2;
        if (!(v >= 0)) return Double.NaN;
        return Math.sqrt(v);
    }
}
