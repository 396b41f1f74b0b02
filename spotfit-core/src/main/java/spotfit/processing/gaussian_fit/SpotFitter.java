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

/**
 * Fits a {@link SeparableGaussian2D} on a single spot by least squares, starting from the moments of the spot ({@link MomentEstimator}).
 * The model buffers are reused from one spot to the next: an instance must be confined to a single thread.
 * @author Jean Ollion
 */
public class SpotFitter {
    public static final Logger logger = LoggerFactory.getLogger(SpotFitter.class);
    final MomentEstimator estimator;
    final LevenbergMarquardtSolver solver;
    SeparableGaussian2D model;

    public SpotFitter(SpotFitConfig config) {
        this.estimator = config.getStartPointEstimator();
        this.solver = config.getSolver();
    }

    public SpotFitter() {
        this(new SpotFitConfig());
    }

    /**
     * @param spot spot to fit
     * @return fitted parameters [x, y, photons, bg, sx, sy], see {@link FitParameter}. x and y are relative to the spot center.
     * Parameters are returned even if the fit did not converge. They are NaN if the spot was skipped.
     */
    public double[] fit(Spot spot) {
        return fitWithStatus(spot).getParameters();
    }

    /**
     * The fit of a flat spot is discarded (NaN parameters) unless it converged with its center inside the spot.
     * @param spot spot to fit
     * @return fitted parameters and convergence status
     * @throws DegenerateSpotException if the spot is flat and the policy is {@link DegenerateSpotPolicy#REJECT}
     */
    public FitResult fitWithStatus(Spot spot) {
        Grid grid = Grid.get(spot.size());
        if (model == null || model.getGrid() != grid) model = new SeparableGaussian2D(grid);
        double[] start = estimator.initializeFit(spot);
        if (start == null) return FitResult.unfitted();
        FitResult res = solver.fitWithStatus(grid.getCoordinates(), spot.copyPixels(), start, model);
        if (MomentEstimator.isDegenerate(spot) && !(res.isConverged() && centerWithin(res.getParameters(), grid.half()))) {
            logger.debug("degenerate spot: fit discarded: {}", res);
            return FitResult.unfitted();
        }
        if (logger.isTraceEnabled()) logger.trace("fit: {}", res);
        return res;
    }

    static boolean centerWithin(double[] parameters, int half) {
        return Math.abs(parameters[FitParameter.X])<=half && Math.abs(parameters[FitParameter.Y])<=half;
    }
}
