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
 * Thrown when a spot has no intensity above its minimal value, so that its moments are undefined.
 * @author Jean Ollion
 */
public class DegenerateSpotException extends RuntimeException {
    private final double intensitySum;
    public DegenerateSpotException(double intensitySum) {
        super("Degenerate spot: background-removed intensity sum is "+intensitySum);
        this.intensitySum = intensitySum;
    }

    public double getIntensitySum() {
        return intensitySum;
    }
}
