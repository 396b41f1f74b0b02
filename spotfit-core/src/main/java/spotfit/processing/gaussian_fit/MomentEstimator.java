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

import spotfit.data_structure.Spot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static spotfit.processing.gaussian_fit.FitParameter.*;

/**
 * Start point of the fit, computed from the moments of the spot after removal of its minimal value:
 * <ul>
 *     <li>background: minimal value</li>
 *     <li>center: center of mass, relative to the spot center</li>
 *     <li>photons: sum of background-removed intensities, at least 1</li>
 *     <li>sigmas: square root of the second central moments along each axis, at least {@code minSigma}</li>
 * </ul>
 * @author Jean Ollion
 */
public class MomentEstimator {
    public static final Logger logger = LoggerFactory.getLogger(MomentEstimator.class);
    final double minSigma;
    final DegenerateSpotPolicy policy;

    public MomentEstimator(double minSigma, DegenerateSpotPolicy policy) {
        if (!(minSigma>0)) throw new IllegalArgumentException("Minimal sigma must be >0, got: "+minSigma);
        this.minSigma = minSigma;
        this.policy = policy;
    }

    /**
     * @return true if all pixels of the spot have the same value: no intensity remains after background removal
     */
    public static boolean isDegenerate(Spot spot) {
        double min = spot.getMin();
        for (int i = 0; i<spot.size(); ++i) {
            for (int j = 0; j<spot.size(); ++j) {
                if (spot.getPixel(i, j)>min) return false;
            }
        }
        return true;
    }

    /**
     * @param spot spot to estimate parameters on
     * @return start parameters, or null if the spot is degenerate and the policy is {@link DegenerateSpotPolicy#SKIP}
     * @throws DegenerateSpotException if the spot is degenerate and the policy is {@link DegenerateSpotPolicy#REJECT}
     */
    public double[] initializeFit(Spot spot) {
        final int size = spot.size();
        final int half = spot.half();
        final double bg = spot.getMin();
        double sum = 0, sumI = 0, sumJ = 0;
        for (int i = 0; i<size; ++i) {
            for (int j = 0; j<size; ++j) {
                double v = spot.getPixel(i, j) - bg;
                sum += v;
                sumI += i * v;
                sumJ += j * v;
            }
        }
        final double[] start = new double[N_PARAMETERS];
        start[BG] = bg;
        start[PHOTONS] = Math.max(1, sum);
        if (sum<=0) {
            switch (policy) {
                case REJECT:
                    throw new DegenerateSpotException(sum);
                case SKIP:
                    logger.debug("degenerate spot skipped: sum={}", sum);
                    return null;
                case FLOOR:
                default:
                    start[X] = 0;
                    start[Y] = 0;
                    start[SX] = minSigma;
                    start[SY] = minSigma;
                    logger.debug("degenerate spot: start at center with floored parameters: {}", FitParameter.toString(start));
                    return start;
            }
        }
        double y0 = sumI / sum;
        double x0 = sumJ / sum;
        double devI = 0, devJ = 0;
        for (int i = 0; i<size; ++i) {
            for (int j = 0; j<size; ++j) {
                double v = spot.getPixel(i, j) - bg;
                devI += v * (i - y0) * (i - y0);
                devJ += v * (j - x0) * (j - x0);
            }
        }
        start[SY] = Math.max(minSigma, Math.sqrt(devI / sum));
        start[SX] = Math.max(minSigma, Math.sqrt(devJ / sum));
        start[X] = x0 - half;
        start[Y] = y0 - half;
        return start;
    }
}
