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

import spotfit.core.ProgressCallback;
import spotfit.data_structure.Spot;
import spotfit.processing.gaussian_fit.SpotFitConfig;
import spotfit.utils.MultipleException;
import spotfit.utils.Pair;
import spotfit.utils.ThreadRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Fits spots on a fixed pool of worker threads.
 * Spots are split into {@code tasksPerWorker} × {@code workers} contiguous tasks of balanced size ({@link FitTask#partition(int, int)}),
 * each task is fitted sequentially by a {@link BatchFitter}. Results are assembled in spot order, whatever the order of completion of the tasks.
 * <p>
 * Usage:
 * <pre>
 * try (ParallelFitScheduler scheduler = new ParallelFitScheduler()) {
 *     double[][] theta = scheduler.fit(spots);
 * }
 * </pre>
 * @author Jean Ollion
 */
public class ParallelFitScheduler implements AutoCloseable {
    public static final Logger logger = LoggerFactory.getLogger(ParallelFitScheduler.class);
    public static final int TASKS_PER_WORKER = 100;
    final int workers, tasksPerWorker;
    final SpotFitConfig config;
    final ExecutorService executor;

    public ParallelFitScheduler() {
        this(new SpotFitConfig());
    }

    public ParallelFitScheduler(SpotFitConfig config) {
        this(ThreadRunner.defaultWorkerCount(), config);
    }

    public ParallelFitScheduler(int workers, SpotFitConfig config) {
        this(workers, TASKS_PER_WORKER, config);
    }

    /**
     * @param workers number of worker threads
     * @param tasksPerWorker number of tasks per worker
     * @param config fit parameters, copied
     */
    public ParallelFitScheduler(int workers, int tasksPerWorker, SpotFitConfig config) {
        if (workers<1) throw new IllegalArgumentException("Worker number must be >=1, got: "+workers);
        if (tasksPerWorker<1) throw new IllegalArgumentException("Task number per worker must be >=1, got: "+tasksPerWorker);
        this.workers = workers;
        this.tasksPerWorker = tasksPerWorker;
        this.config = config.duplicate();
        this.executor = Executors.newFixedThreadPool(workers, ThreadRunner.priorityThreadFactory("spotfit", Thread.NORM_PRIORITY));
    }

    public int getWorkerCount() {
        return workers;
    }

    public int getTaskCount() {
        return workers * tasksPerWorker;
    }

    /**
     * @return the tasks {@code nSpots} spots are split into
     */
    public List<FitTask> partition(int nSpots) {
        return FitTask.partition(nSpots, getTaskCount());
    }

    public double[][] fit(List<Spot> spots) {
        return fit(spots, null);
    }

    /**
     * Fits the spots and blocks until all tasks are done.
     * @param spots spots, all of the same size
     * @param pcb optional, progress is incremented once per completed task
     * @return same as {@link BatchFitter#fitSpots(List)}
     * @throws MultipleException if at least one task failed, holding the failed tasks and their errors
     */
    public double[][] fit(List<Spot> spots, ProgressCallback pcb) {
        CompletionService<double[][]> completion = new ExecutorCompletionService<>(executor);
        List<FitTask> tasks = submit(spots, completion::submit);
        if (pcb!=null) {
            pcb.log(spots.size()+" spots submitted in "+tasks.size()+" tasks on "+workers+" workers");
            pcb.incrementTaskNumber(tasks.size());
            for (int i = 0; i<tasks.size(); ++i) {
                try {
                    completion.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break; // reported by the aggregation
                }
                pcb.incrementProgress();
            }
        }
        try {
            return fitsFromTasks(tasks);
        } catch (MultipleException e) {
            if (pcb!=null) pcb.log(e.getExceptions().size()+" task(s) failed");
            throw e;
        }
    }

    /**
     * Submits the fitting tasks and returns immediately. Use {@link #fitsFromTasks(List)} to get the fitted parameters.
     * Tasks with no spots are not submitted.
     * @param spots spots, all of the same size
     * @return submitted tasks, in spot order
     */
    public List<FitTask> submit(List<Spot> spots) {
        return submit(spots, executor::submit);
    }

    private List<FitTask> submit(List<Spot> spots, Function<Callable<double[][]>, Future<double[][]>> submitter) {
        BatchFitter.checkSpots(spots);
        final List<Spot> input = Collections.unmodifiableList(new ArrayList<>(spots));
        final BatchFitter fitter = new BatchFitter(config);
        List<FitTask> res = new ArrayList<>();
        for (FitTask t : partition(input.size())) {
            if (t.count==0) continue;
            res.add(t.submitted(submitter.apply(() -> fitter.fitSpots(input, t.start, t.count))));
        }
        logger.debug("{} spots submitted in {} tasks on {} workers", input.size(), res.size(), workers);
        return res;
    }

    public static double[][] fitsFromTasks(List<FitTask> tasks) {
        return fitsFromTasks(tasks, null);
    }

    /**
     * Waits for all tasks and concatenates their results in the order of {@code tasks}
     * @param tasks tasks returned by {@link #submit(List)}
     * @param pcb optional, progress is incremented once per retrieved task
     * @return fitted parameters, one row per spot
     * @throws MultipleException if at least one task failed, was cancelled or if the waiting thread was interrupted
     */
    public static double[][] fitsFromTasks(List<FitTask> tasks, ProgressCallback pcb) {
        int n = 0;
        for (FitTask t : tasks) n += t.count;
        if (pcb!=null) pcb.incrementTaskNumber(tasks.size());
        double[][] theta = new double[n][];
        List<Pair<String, Throwable>> errors = new ArrayList<>();
        int offset = 0;
        for (FitTask t : tasks) {
            if (t.future==null) {
                if (t.count>0) errors.add(new Pair<>(t.toString(), new IllegalStateException("Task was not submitted")));
            } else {
                try {
                    double[][] block = t.future.get();
                    System.arraycopy(block, 0, theta, offset, block.length);
                } catch (ExecutionException e) {
                    logger.error("error while fitting spots of "+t, e.getCause());
                    errors.add(new Pair<>(t.toString(), e.getCause()));
                } catch (CancellationException e) {
                    errors.add(new Pair<>(t.toString(), e));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    errors.add(new Pair<>(t.toString(), e));
                    break;
                }
            }
            offset += t.count;
            if (pcb!=null) pcb.incrementProgress();
        }
        if (!errors.isEmpty()) {
            MultipleException e = new MultipleException(errors);
            if (pcb!=null) pcb.log(e.getExceptions().size()+" task(s) failed");
            throw e;
        }
        return theta;
    }

    /**
     * Stops the workers once submitted tasks are done
     */
    @Override
    public void close() {
        executor.shutdown();
    }
}
