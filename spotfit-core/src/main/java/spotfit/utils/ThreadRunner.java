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
package spotfit.utils;

import spotfit.core.ProgressCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool sizing and thread utilities
 * @author Jean Ollion
 */
public class ThreadRunner {
    public final static Logger logger = LoggerFactory.getLogger(ThreadRunner.class);
    /**
     * fraction of the available processors used for fitting workers, the remaining ones are left to the calling process and the system
     */
    public static double CPU_FRACTION = 0.75;

    public static int getMaxCPUs() {
        return Runtime.getRuntime().availableProcessors();
    }

    /**
     * @return max(1, floor({@link #CPU_FRACTION} × available processors))
     */
    public static int defaultWorkerCount() {
        return workerCount(getMaxCPUs());
    }

    public static int workerCount(int cpus) {
        return Math.max(1, (int)(CPU_FRACTION * cpus));
    }

    public static ProgressCallback loggerProgressCallback(final Logger logger) {
        return new ProgressCallback() {
            int taskCount = 0;
            int taskNumber = 0;
            @Override
            public synchronized void incrementTaskNumber(int subtask) {
                this.taskNumber+=subtask;
            }

            @Override
            public synchronized int getTaskNumber() {
                return taskNumber;
            }

            @Override
            public synchronized void incrementProgress() {
                logger.debug("Current: {}/{}", ++taskCount, taskNumber);
            }

            @Override
            public void log(String message) {
                logger.debug(message);
            }
        };
    }

    public static PriorityThreadFactory priorityThreadFactory(String namePrefix, int priority) {return new PriorityThreadFactory(namePrefix, priority);}
    public static class PriorityThreadFactory implements ThreadFactory {
        private static final AtomicInteger poolNumber = new AtomicInteger(1);
        private final AtomicInteger threadNumber = new AtomicInteger(1);
        private final String namePrefix;
        private final int priority;
        public PriorityThreadFactory(String namePrefix, int priority) {
            if (priority<Thread.MIN_PRIORITY) priority=Thread.MIN_PRIORITY;
            if (priority>Thread.MAX_PRIORITY) priority=Thread.MAX_PRIORITY;
            this.priority=priority;
            this.namePrefix = namePrefix + "-" + poolNumber.getAndIncrement() + "-thread-";
        }
        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            if (t.isDaemon()) t.setDaemon(false);
            if (t.getPriority() != priority) t.setPriority(priority);
            return t;
        }
    }
}
