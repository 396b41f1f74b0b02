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
 * Final localization record. Frame is an unsigned 32-bit value, all other fields are single precision.
 * x and y are absolute coordinates in the frame, in pixels.
 * @author Jean Ollion
 */
public final class Localization {
    private final long frame;
    private final float x, y, photons, sx, sy, bg, lpx, lpy, ellipticity, netGradient;

    public Localization(long frame, float x, float y, float photons, float sx, float sy, float bg, float lpx, float lpy, float ellipticity, float netGradient) {
        this.frame = frame;
        this.x = x;
        this.y = y;
        this.photons = photons;
        this.sx = sx;
        this.sy = sy;
        this.bg = bg;
        this.lpx = lpx;
        this.lpy = lpy;
        this.ellipticity = ellipticity;
        this.netGradient = netGradient;
    }

    public long getFrame() {
        return frame;
    }

    public float getX() {
        return x;
    }

    public float getY() {
        return y;
    }

    public float getPhotons() {
        return photons;
    }

    public float getSx() {
        return sx;
    }

    public float getSy() {
        return sy;
    }

    public float getBg() {
        return bg;
    }

    public float getLpx() {
        return lpx;
    }

    public float getLpy() {
        return lpy;
    }

    public float getEllipticity() {
        return ellipticity;
    }

    public float getNetGradient() {
        return netGradient;
    }

    /**
     * @return true if no field is NaN or infinite
     */
    public boolean isFinite() {
        return Float.isFinite(x) && Float.isFinite(y) && Float.isFinite(photons) && Float.isFinite(sx) && Float.isFinite(sy)
                && Float.isFinite(bg) && Float.isFinite(lpx) && Float.isFinite(lpy) && Float.isFinite(ellipticity) && Float.isFinite(netGradient);
    }

    @Override
    public String toString() {
        return "Localization{frame="+frame+", x="+x+", y="+y+", photons="+photons+", sx="+sx+", sy="+sy+", bg="+bg
                +", lpx="+lpx+", lpy="+lpy+", ellipticity="+ellipticity+", netGradient="+netGradient+"}";
    }
}
