package spotfit.processing.localization;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TestFitTask {

    static void assertContiguous(List<FitTask> tasks, int nSpots) {
        int start = 0;
        for (int i = 0; i<tasks.size(); ++i) {
            assertEquals("index", i, tasks.get(i).getIndex());
            assertEquals("start of "+tasks.get(i), start, tasks.get(i).getStart());
            start = tasks.get(i).getEnd();
        }
        assertEquals("all spots covered", nSpots, start);
    }

    @Test
    public void testBalancedPartition() {
        List<FitTask> tasks = FitTask.partition(10, 3);
        assertEquals(3, tasks.size());
        assertEquals(4, tasks.get(0).getCount());
        assertEquals(3, tasks.get(1).getCount());
        assertEquals(3, tasks.get(2).getCount());
        assertContiguous(tasks, 10);
    }

    @Test
    public void testLargerTasksFirst() {
        List<FitTask> tasks = FitTask.partition(997, 400);
        assertEquals(400, tasks.size());
        for (int i = 0; i<tasks.size(); ++i) assertEquals(tasks.get(i).toString(), i<197 ? 3 : 2, tasks.get(i).getCount());
        assertContiguous(tasks, 997);
    }

    @Test
    public void testFewerSpotsThanTasks() {
        List<FitTask> tasks = FitTask.partition(3, 5);
        assertEquals(5, tasks.size());
        int[] counts = tasks.stream().mapToInt(FitTask::getCount).toArray();
        assertArrayEquals(new int[]{1, 1, 1, 0, 0}, counts);
        assertContiguous(tasks, 3);
        assertNull("not submitted", tasks.get(0).getFuture());
    }

    @Test
    public void testName() {
        assertEquals("task #2 [8; 11)", FitTask.partition(11, 3).get(2).toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoTask() {
        FitTask.partition(10, 0);
    }
}
