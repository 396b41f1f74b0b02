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

import spotfit.data_structure.Localization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 *
 * @author Jean Ollion
 */
public class LocalizationFilter {
    public static final Logger logger = LoggerFactory.getLogger(LocalizationFilter.class);

    /**
     * Removes localizations with non-finite values, located outside the frame (0 &lt; x &lt; width, 0 &lt; y &lt; height) or with non-positive precision
     * @param locs localizations
     * @param width frame width
     * @param height frame height
     * @return valid localizations, in the same order
     */
    public static List<Localization> ensureSanity(List<Localization> locs, int width, int height) {
        List<Localization> res = locs.stream()
                .filter(Localization::isFinite)
                .filter(l -> l.getX() > 0 && l.getY() > 0 && l.getX() < width && l.getY() < height)
                .filter(l -> l.getLpx() > 0 && l.getLpy() > 0)
                .collect(Collectors.toList());
        if (res.size()<locs.size()) logger.debug("{}/{} localizations removed", locs.size()-res.size(), locs.size());
        return res;
    }

    /**
     * @return localizations located at a distance strictly inferior to {@code radius} from (x, y), in the same order
     */
    public static List<Localization> locsAt(double x, double y, List<Localization> locs, double radius) {
        double r2 = radius * radius;
        return locs.stream().filter(l -> {
            double dx = l.getX() - x;
            double dy = l.getY() - y;
            return dx * dx + dy * dy < r2;
        }).collect(Collectors.toList());
    }
}
