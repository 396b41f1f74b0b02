package spotfit.processing.localization;

import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotfit.core.ProgressCallback;
import spotfit.data_structure.Spot;
import spotfit.processing.gaussian_fit.DegenerateSpotException;
import spotfit.processing.gaussian_fit.DegenerateSpotPolicy;
import spotfit.processing.gaussian_fit.SpotFitConfig;
import spotfit.test_utils.SyntheticSpots;
import spotfit.utils.MultipleException;
import spotfit.utils.Pair;
import spotfit.utils.ThreadRunner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class TestParallelFitScheduler {
    public final static Logger logger = LoggerFactory.getLogger(TestParallelFitScheduler.class);

    static class CountingProgress implements ProgressCallback {
        int taskNumber, progress;
        final List<String> messages = new ArrayList<>();
        @Override
        public synchronized void incrementTaskNumber(int subtask) {
            taskNumber += subtask;
        }
        @Override
        public synchronized int getTaskNumber() {
            return taskNumber;
        }
        @Override
        public synchronized void incrementProgress() {
            ++progress;
        }
        @Override
        public synchronized void log(String message) {
            logger.debug(message);
            messages.add(message);
        }
    }

    @Test
    public void testSameAsSequential() {
        List<Spot> spots = SyntheticSpots.randomSpots(997, 7, 1);
        double[][] sequential = new BatchFitter().fitSpots(spots);
        double[][] parallel;
        try (ParallelFitScheduler scheduler = new ParallelFitScheduler(4, new SpotFitConfig())) {
            assertEquals(4, scheduler.getWorkerCount());
            assertEquals(400, scheduler.getTaskCount());
            parallel = scheduler.fit(spots, ThreadRunner.loggerProgressCallback(logger));
        }
        assertEquals(997, parallel.length);
        for (int i = 0; i<spots.size(); ++i) assertArrayEquals("spot #"+i, sequential[i], parallel[i], 0);
    }

    @Test
    public void testAsynchronousSubmission() {
        List<Spot> spots = SyntheticSpots.randomSpots(50, 7, 2);
        double[][] sequential = new BatchFitter().fitSpots(spots);
        try (ParallelFitScheduler scheduler = new ParallelFitScheduler(2, 4, new SpotFitConfig())) {
            List<FitTask> tasks = scheduler.submit(spots);
            assertEquals(8, tasks.size());
            for (int i = 0; i<tasks.size(); ++i) {
                assertEquals(i, tasks.get(i).getIndex());
                assertNotNull(tasks.get(i).getFuture());
            }
            CountingProgress pcb = new CountingProgress();
            double[][] parallel = ParallelFitScheduler.fitsFromTasks(tasks, pcb);
            assertEquals(8, pcb.getTaskNumber());
            assertEquals(8, pcb.progress);
            for (int i = 0; i<spots.size(); ++i) assertArrayEquals("spot #"+i, sequential[i], parallel[i], 0);
        }
    }

    @Test
    public void testProgressOnNonEmptyTasks() {
        List<Spot> spots = SyntheticSpots.randomSpots(3, 5, 3);
        CountingProgress pcb = new CountingProgress();
        try (ParallelFitScheduler scheduler = new ParallelFitScheduler(2, 2, new SpotFitConfig())) {
            double[][] theta = scheduler.fit(spots, pcb);
            assertEquals(3, theta.length);
        }
        assertEquals("empty tasks are not submitted", 3, pcb.getTaskNumber());
        assertEquals(3, pcb.progress);
        assertEquals(Collections.singletonList("3 spots submitted in 3 tasks on 2 workers"), pcb.messages);
    }

    @Test
    public void testFailedTask() {
        List<Spot> spots = new ArrayList<>(SyntheticSpots.randomSpots(20, 5, 4));
        spots.set(6, SyntheticSpots.flatSpot(5, 10));
        SpotFitConfig config = new SpotFitConfig().setDegenerateSpotPolicy(DegenerateSpotPolicy.REJECT);
        CountingProgress pcb = new CountingProgress();
        try (ParallelFitScheduler scheduler = new ParallelFitScheduler(2, 2, config)) {
            scheduler.fit(spots, pcb);
            fail("a degenerate spot should make its task fail");
        } catch (MultipleException e) {
            List<Pair<String, Throwable>> errors = e.getExceptions();
            assertEquals(1, errors.size());
            assertEquals("task #1 [5; 10)", errors.get(0).key);
            assertTrue(errors.get(0).value instanceof DegenerateSpotException);
            assertEquals(0, ((DegenerateSpotException)errors.get(0).value).getIntensitySum(), 0);
            assertEquals("1 task(s) failed", pcb.messages.get(pcb.messages.size() - 1));
        }
    }

    @Test
    public void testNoSpot() {
        try (ParallelFitScheduler scheduler = new ParallelFitScheduler(2, new SpotFitConfig())) {
            assertEquals(0, scheduler.fit(Collections.emptyList()).length);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMixedSizes() {
        List<Spot> spots = new ArrayList<>(SyntheticSpots.randomSpots(2, 5, 5));
        spots.addAll(SyntheticSpots.randomSpots(2, 7, 5));
        try (ParallelFitScheduler scheduler = new ParallelFitScheduler(1, new SpotFitConfig())) {
            scheduler.fit(spots);
        }
    }

    @Test
    public void testConfigCopied() {
        SpotFitConfig config = new SpotFitConfig().setDegenerateSpotPolicy(DegenerateSpotPolicy.SKIP);
        try (ParallelFitScheduler scheduler = new ParallelFitScheduler(1, 1, config)) {
            config.setDegenerateSpotPolicy(DegenerateSpotPolicy.REJECT);
            double[][] theta = scheduler.fit(Collections.singletonList(SyntheticSpots.flatSpot(5, 1)));
            assertTrue("skipped", Double.isNaN(theta[0][0]));
        }
    }
}
