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
package spotfit.data_structure;

import java.util.Arrays;

/**
 * Square pixel window cropped around a candidate emitter. Side length is odd, center pixel is at index (size-1)/2 along both axes.
 * Pixels are stored in row-major order: index = row * size + column, row being the y axis and column the x axis.
 * Instances are immutable.
 * @author Jean Ollion
 */
public class Spot {
    private final int size;
    private final double[] pixels;

    /**
     * @param pixels pixel intensities indexed as pixels[row][column]. Values are copied.
     */
    public Spot(double[][] pixels) {
        this.size = pixels.length;
        checkSize(size);
        this.pixels = new double[size * size];
        for (int i = 0; i<size; ++i) {
            if (pixels[i].length!=size) throw new IllegalArgumentException("Spot must be square: row "+i+" has length "+pixels[i].length+" instead of "+size);
            System.arraycopy(pixels[i], 0, this.pixels, i * size, size);
        }
        checkValues();
    }

    /**
     * @param size side length
     * @param rowMajorPixels pixel intensities in row-major order. Values are copied.
     */
    public Spot(int size, double[] rowMajorPixels) {
        checkSize(size);
        if (rowMajorPixels.length != size * size) throw new IllegalArgumentException("Expected "+(size*size)+" pixels, got "+rowMajorPixels.length);
        this.size = size;
        this.pixels = Arrays.copyOf(rowMajorPixels, rowMajorPixels.length);
        checkValues();
    }

    public Spot(int size, float[] rowMajorPixels) {
        checkSize(size);
        if (rowMajorPixels.length != size * size) throw new IllegalArgumentException("Expected "+(size*size)+" pixels, got "+rowMajorPixels.length);
        this.size = size;
        this.pixels = new double[rowMajorPixels.length];
        for (int i = 0; i<rowMajorPixels.length; ++i) pixels[i] = rowMajorPixels[i];
        checkValues();
    }

    private static void checkSize(int size) {
        if (size<3 || size%2==0) throw new IllegalArgumentException("Spot size must be odd and >=3, got: "+size);
    }

    private void checkValues() {
        for (int i = 0; i<pixels.length; ++i) {
            if (!Double.isFinite(pixels[i])) throw new IllegalArgumentException("Non-finite pixel value at row "+(i/size)+" column "+(i%size)+": "+pixels[i]);
        }
    }

    public int size() {
        return size;
    }

    /**
     * @return index of the center pixel along each axis
     */
    public int half() {
        return (size - 1) / 2;
    }

    public double getPixel(int row, int column) {
        return pixels[row * size + column];
    }

    /**
     * @return copy of the pixel intensities in row-major order
     */
    public double[] copyPixels() {
        return Arrays.copyOf(pixels, pixels.length);
    }

    public double getMin() {
        double min = pixels[0];
        for (int i = 1; i<pixels.length; ++i) if (pixels[i]<min) min = pixels[i];
        return min;
    }

    @Override
    public String toString() {
        return "Spot{size="+size+"}";
    }
}
