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
package spotfit.core;

/**
 * Coarse progress feedback. Calls are made from the thread that waits on the fitting tasks.
 * @author Jean Ollion
 */
public interface ProgressCallback {
    void incrementTaskNumber(int subtask);
    int getTaskNumber();
    void incrementProgress();
    void log(String message);
}
