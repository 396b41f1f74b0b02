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

import java.util.Arrays;

/**
 * Layout of the fitted parameter vector:
 * <pre>
 * k = 0 - x       offset from the spot center along columns
 * k = 1 - y       offset from the spot center along rows
 * k = 2 - photons integrated intensity above background
 * k = 3 - bg      background
 * k = 4 - sx      standard deviation along x
 * k = 5 - sy      standard deviation along y
 * </pre>
 * @author Jean Ollion
 */
public class FitParameter {
    public static final int X = 0;
    public static final int Y = 1;
    public static final int PHOTONS = 2;
    public static final int BG = 3;
    public static final int SX = 4;
    public static final int SY = 5;
    public static final int N_PARAMETERS = 6;
    public static final String[] NAMES = new String[]{"x", "y", "photons", "bg", "sx", "sy"};

    public static double[] nanParameters() {
        double[] res = new double[N_PARAMETERS];
        Arrays.fill(res, Double.NaN);
        return res;
    }

    public static String toString(double[] parameters) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i<parameters.length; ++i) {
            if (i>0) sb.append(", ");
            sb.append(i<NAMES.length ? NAMES[i] : "p"+i).append('=').append(parameters[i]);
        }
        return sb.append(']').toString();
    }
}
