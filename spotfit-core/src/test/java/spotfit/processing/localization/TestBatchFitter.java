package spotfit.processing.localization;

import org.junit.Test;
import spotfit.data_structure.Spot;
import spotfit.processing.gaussian_fit.DegenerateSpotPolicy;
import spotfit.processing.gaussian_fit.SpotFitConfig;
import spotfit.test_utils.SyntheticSpots;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;
import static spotfit.processing.gaussian_fit.FitParameter.*;

public class TestBatchFitter {

    @Test
    public void testOrderAndSkippedSpots() {
        List<Spot> spots = new ArrayList<>();
        double[] offsets = new double[]{-0.4, 0.1, 0, 0.35};
        for (double o : offsets) spots.add(SyntheticSpots.spot(7, SyntheticSpots.parameters(o, -o, 800, 5, 1.2, 1.2)));
        spots.set(2, SyntheticSpots.flatSpot(7, 5));
        double[][] theta = new BatchFitter(new SpotFitConfig().setDegenerateSpotPolicy(DegenerateSpotPolicy.SKIP)).fitSpots(spots);
        assertEquals(4, theta.length);
        for (int i = 0; i<4; ++i) {
            assertEquals(N_PARAMETERS, theta[i].length);
            if (i==2) {
                for (double p : theta[i]) assertTrue("skipped spot", Double.isNaN(p));
            } else {
                assertEquals("x of spot #"+i, offsets[i], theta[i][X], 0.05);
                assertEquals("y of spot #"+i, -offsets[i], theta[i][Y], 0.05);
            }
        }
    }

    @Test
    public void testFlatSpotUnderDefaultPolicy() {
        List<Spot> spots = new ArrayList<>(SyntheticSpots.randomSpots(3, 7, 21));
        spots.add(1, SyntheticSpots.flatSpot(7, 10));
        double[][] theta = new BatchFitter().fitSpots(spots);
        double[] flat = theta[1];
        if (Double.isNaN(flat[X])) {
            for (double p : flat) assertTrue("unfitted spot", Double.isNaN(p));
        } else {
            assertTrue("x inside the spot", Math.abs(flat[X])<=3);
            assertTrue("y inside the spot", Math.abs(flat[Y])<=3);
        }
        for (int i : new int[]{0, 2, 3}) {
            for (double p : theta[i]) assertTrue("spot #"+i, Double.isFinite(p));
        }
    }

    @Test
    public void testRange() {
        List<Spot> spots = SyntheticSpots.randomSpots(10, 5, 11);
        BatchFitter fitter = new BatchFitter();
        double[][] all = fitter.fitSpots(spots);
        double[][] range = fitter.fitSpots(spots, 3, 4);
        assertEquals(4, range.length);
        for (int i = 0; i<4; ++i) assertArrayEquals(all[3 + i], range[i], 0);
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testRangeOutOfBounds() {
        new BatchFitter().fitSpots(SyntheticSpots.randomSpots(3, 5, 0), 2, 2);
    }
}
