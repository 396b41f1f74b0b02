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

/**
 * Detection metadata of a spot: integer-resolution center in the frame, frame index and detection strength.
 * @author Jean Ollion
 */
public class Identification {
    public static final long MAX_FRAME = 0xFFFFFFFFL;
    private final long frame;
    private final int x, y;
    private final double netGradient;

    /**
     * @param frame frame index, unsigned 32-bit value
     * @param x column of the spot center in the frame
     * @param y row of the spot center in the frame
     * @param netGradient detection strength
     */
    public Identification(long frame, int x, int y, double netGradient) {
        if (frame<0 || frame>MAX_FRAME) throw new IllegalArgumentException("Frame must be an unsigned 32-bit integer, got: "+frame);
        this.frame = frame;
        this.x = x;
        this.y = y;
        this.netGradient = netGradient;
    }

    public long getFrame() {
        return frame;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public double getNetGradient() {
        return netGradient;
    }

    @Override
    public String toString() {
        return "Identification{frame="+frame+", x="+x+", y="+y+", netGradient="+netGradient+"}";
    }
}
