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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;

/**
 * Contiguous range of spot indices [start; start + count) fitted by a single worker, and once submitted, its pending result.
 * @author Jean Ollion
 */
public class FitTask {
    final int index, start, count;
    final Future<double[][]> future;

    public FitTask(int index, int start, int count) {
        this(index, start, count, null);
    }

    private FitTask(int index, int start, int count, Future<double[][]> future) {
        this.index = index;
        this.start = start;
        this.count = count;
        this.future = future;
    }

    /**
     * Splits [0; nSpots) into {@code nTasks} contiguous ranges whose sizes are floor(nSpots/nTasks) or floor(nSpots/nTasks)+1.
     * The first nSpots mod nTasks ranges are the larger ones.
     * @return ranges in index order
     */
    public static List<FitTask> partition(int nSpots, int nTasks) {
        if (nSpots<0) throw new IllegalArgumentException("Negative spot number: "+nSpots);
        if (nTasks<1) throw new IllegalArgumentException("Task number must be >=1, got: "+nTasks);
        int base = nSpots / nTasks;
        int remainder = nSpots % nTasks;
        List<FitTask> res = new ArrayList<>(nTasks);
        int start = 0;
        for (int i = 0; i<nTasks; ++i) {
            int count = i < remainder ? base + 1 : base;
            res.add(new FitTask(i, start, count));
            start += count;
        }
        return res;
    }

    FitTask submitted(Future<double[][]> future) {
        return new FitTask(index, start, count, future);
    }

    public int getIndex() {
        return index;
    }

    public int getStart() {
        return start;
    }

    public int getCount() {
        return count;
    }

    public int getEnd() {
        return start + count;
    }

    /**
     * @return pending result of the task, null if the task was not submitted. Can be used to cancel the task or wait with a timeout.
     */
    public Future<double[][]> getFuture() {
        return future;
    }

    @Override
    public String toString() {
        return "task #"+index+" ["+start+"; "+getEnd()+")";
    }
}
