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

import spotfit.data_structure.Spot;
import spotfit.processing.gaussian_fit.FitParameter;
import spotfit.processing.gaussian_fit.FitResult;
import spotfit.processing.gaussian_fit.SpotFitConfig;
import spotfit.processing.gaussian_fit.SpotFitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Sequential fit of an ordered collection of spots.
 * @author Jean Ollion
 */
public class BatchFitter {
    public static final Logger logger = LoggerFactory.getLogger(BatchFitter.class);
    final SpotFitConfig config;

    public BatchFitter(SpotFitConfig config) {
        this.config = config;
    }

    public BatchFitter() {
        this(new SpotFitConfig());
    }

    /**
     * @param spots spots, all of the same size
     * @return one row of parameters per spot (see {@link FitParameter}) in the order of {@code spots}. Rows of spots that were not fitted are NaN.
     */
    public double[][] fitSpots(List<Spot> spots) {
        checkSpots(spots);
        return fitSpots(spots, 0, spots.size());
    }

    /**
     * Fits the spots of indices [{@code start}; {@code start + count})
     * @return one row of parameters per fitted spot, row i corresponds to spot {@code start + i}
     */
    public double[][] fitSpots(List<Spot> spots, int start, int count) {
        if (start<0 || count<0 || start+count>spots.size()) throw new IndexOutOfBoundsException("Range ["+start+"; "+(start+count)+") out of bounds for "+spots.size()+" spots");
        double[][] theta = new double[count][FitParameter.N_PARAMETERS];
        for (double[] row : theta) Arrays.fill(row, Double.NaN);
        SpotFitter fitter = new SpotFitter(config);
        int skipped = 0, notConverged = 0;
        for (int i = 0; i<count; ++i) {
            FitResult res = fitter.fitWithStatus(spots.get(start + i));
            if (!res.isFitted()) {
                ++skipped;
                continue;
            }
            System.arraycopy(res.getParameters(), 0, theta[i], 0, FitParameter.N_PARAMETERS);
            if (!res.isConverged()) ++notConverged;
        }
        if (skipped>0) logger.warn("spots [{}; {}): {} degenerate spot(s) were not fitted", start, start+count, skipped);
        if (notConverged>0) logger.debug("spots [{}; {}): {}/{} fit(s) did not converge", start, start+count, notConverged, count);
        return theta;
    }

    /**
     * @throws IllegalArgumentException if spots do not all have the same size
     */
    public static void checkSpots(List<Spot> spots) {
        if (spots.isEmpty()) return;
        int size = spots.get(0).size();
        for (int i = 1; i<spots.size(); ++i) {
            if (spots.get(i).size()!=size) throw new IllegalArgumentException("All spots must have the same size: spot #"+i+" has size "+spots.get(i).size()+" instead of "+size);
        }
    }
}
