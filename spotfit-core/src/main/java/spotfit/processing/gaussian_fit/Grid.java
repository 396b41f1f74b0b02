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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pixel coordinates of a spot of a given size, relative to its center: [-H, ..., H] with H = (size-1)/2.
 * One instance per size is shared by all fits; arrays must not be modified.
 * @author Jean Ollion
 */
public class Grid {
    private static final Map<Integer, Grid> GRIDS = new ConcurrentHashMap<>();
    private final int size, half;
    private final double[] values;
    private final double[][] coordinates;

    private Grid(int size) {
        if (size<1 || size%2==0) throw new IllegalArgumentException("Grid size must be odd, got: "+size);
        this.size = size;
        this.half = (size - 1) / 2;
        this.values = new double[size];
        for (int i = 0; i<size; ++i) values[i] = i - half;
        this.coordinates = new double[size * size][];
        for (int i = 0; i<size; ++i) {
            for (int j = 0; j<size; ++j) coordinates[i * size + j] = new double[]{values[j], values[i]}; // x = column, y = row
        }
    }

    public static Grid get(int size) {
        return GRIDS.computeIfAbsent(size, Grid::new);
    }

    public int size() {
        return size;
    }

    public int half() {
        return half;
    }

    /**
     * @return the 1D coordinate sequence [-H, ..., H]
     */
    public double[] getValues() {
        return values;
    }

    /**
     * @return (x, y) coordinates of each pixel, in row-major order
     */
    public double[][] getCoordinates() {
        return coordinates;
    }
}
