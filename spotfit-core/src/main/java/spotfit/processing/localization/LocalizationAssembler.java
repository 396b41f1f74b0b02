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

import spotfit.data_structure.Identification;
import spotfit.data_structure.Localization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static spotfit.processing.gaussian_fit.FitParameter.*;

/**
 * Builds localizations from fitted parameters and the identifications of the spots
 * @author Jean Ollion
 */
public class LocalizationAssembler {
    public static final Logger logger = LoggerFactory.getLogger(LocalizationAssembler.class);
    final LocalizationPrecision precision;

    public LocalizationAssembler(LocalizationPrecision precision) {
        this.precision = precision;
    }

    public LocalizationAssembler() {
        this(new MortensenPrecision());
    }

    /**
     * @param identifications detection metadata, aligned with the rows of {@code theta}
     * @param theta fitted parameters, one row per spot, see {@link spotfit.processing.gaussian_fit.FitParameter}
     * @param emGain sensor readout mode, passed to the precision formula
     * @return localizations sorted by frame. Localizations of the same frame keep the order of the identifications
     */
    public List<Localization> locsFromFits(List<Identification> identifications, double[][] theta, boolean emGain) {
        if (identifications.size()!=theta.length) throw new IllegalArgumentException("Identification number ("+identifications.size()+") differs from fit number ("+theta.length+")");
        List<Localization> locs = new ArrayList<>(theta.length);
        for (int i = 0; i<theta.length; ++i) {
            double[] t = theta[i];
            if (t.length<N_PARAMETERS) throw new IllegalArgumentException("Fit #"+i+" has "+t.length+" parameters instead of "+N_PARAMETERS);
            Identification id = identifications.get(i);
            double lpx = precision.compute(t[PHOTONS], t[SX], t[BG], emGain);
            double lpy = precision.compute(t[PHOTONS], t[SY], t[BG], emGain);
            double a = Math.max(t[SX], t[SY]);
            double b = Math.min(t[SX], t[SY]);
            double ellipticity = (a - b) / a;
            locs.add(new Localization(id.getFrame(), (float)(t[X] + id.getX()), (float)(t[Y] + id.getY()),
                    (float)t[PHOTONS], (float)t[SX], (float)t[SY], (float)t[BG],
                    (float)lpx, (float)lpy, (float)ellipticity, (float)id.getNetGradient()));
        }
        locs.sort(Comparator.comparingLong(Localization::getFrame)); // stable
        logger.debug("{} localizations assembled", locs.size());
        return locs;
    }
}
