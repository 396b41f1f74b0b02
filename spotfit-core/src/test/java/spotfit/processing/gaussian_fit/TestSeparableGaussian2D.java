package spotfit.processing.gaussian_fit;

import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotfit.data_structure.Spot;
import spotfit.test_utils.SyntheticSpots;

import static org.junit.Assert.*;
import static spotfit.processing.gaussian_fit.FitParameter.*;

public class TestSeparableGaussian2D {
    public final static Logger logger = LoggerFactory.getLogger(TestSeparableGaussian2D.class);

    @Test
    public void testGridLayout() {
        Grid grid = Grid.get(5);
        assertSame("grid cached", grid, Grid.get(5));
        assertArrayEquals(new double[]{-2, -1, 0, 1, 2}, grid.getValues(), 0);
        double[][] coords = grid.getCoordinates();
        assertEquals(25, coords.length);
        // row 1, column 3
        assertArrayEquals("x from column, y from row", new double[]{1, -1}, coords[1 * 5 + 3], 0);
    }

    @Test
    public void testModelIsOuterProduct() {
        Grid grid = Grid.get(7);
        SeparableGaussian2D f = new SeparableGaussian2D(grid);
        double[] a = SyntheticSpots.parameters(0.8, -0.7, 700, 3, 1.1, 1.6);
        double[] model = f.model(a, new double[49]);
        double[][] coords = grid.getCoordinates();
        for (int i = 0; i<coords.length; ++i) assertEquals("pixel "+i, f.val(coords[i], a), model[i], 1e-9);
        // maximum located in the row of y and the column of x
        int argMax = 0;
        for (int i = 1; i<model.length; ++i) if (model[i]>model[argMax]) argMax = i;
        assertEquals("row of max", 3 - 1, argMax / 7);
        assertEquals("column of max", 3 + 1, argMax % 7);
    }

    @Test
    public void testNormalization() {
        SeparableGaussian2D f = new SeparableGaussian2D(Grid.get(21));
        double[] a = SyntheticSpots.parameters(0.2, 0.1, 1000, 0, 1.5, 1.5);
        double[] model = f.model(a, new double[21 * 21]);
        double sum = 0;
        for (double v : model) sum += v;
        assertEquals("integrated intensity", 1000, sum, 1);
    }

    @Test
    public void testResiduals() {
        SeparableGaussian2D f = new SeparableGaussian2D(Grid.get(5));
        double[] a = SyntheticSpots.parameters(0, 0, 100, 2, 1, 1);
        Spot spot = SyntheticSpots.spot(5, SyntheticSpots.parameters(0.3, 0, 120, 2, 1, 1));
        double[] obs = spot.copyPixels();
        double[] res = f.residuals(a, obs, new double[25]);
        double[] model = f.model(a, new double[25]);
        for (int i = 0; i<25; ++i) assertEquals(obs[i] - model[i], res[i], 1e-12);
    }

    @Test
    public void testGradient() {
        SeparableGaussian2D f = new SeparableGaussian2D(Grid.get(7));
        double[] a = SyntheticSpots.parameters(0.4, -0.3, 500, 10, 1.3, 0.9);
        double h = 1e-6;
        for (double[] x : Grid.get(7).getCoordinates()) {
            for (int k = 0; k<N_PARAMETERS; ++k) {
                double[] ap = a.clone(), am = a.clone();
                ap[k] += h;
                am[k] -= h;
                double numerical = (f.val(x, ap) - f.val(x, am)) / (2 * h);
                assertEquals("d/d"+NAMES[k]+" at "+x[0]+";"+x[1], numerical, f.grad(x, a, k), 1e-5 * Math.max(1, Math.abs(numerical)));
            }
        }
    }

    @Test
    public void testValidity() {
        SeparableGaussian2D f = new SeparableGaussian2D(Grid.get(3));
        assertEquals(N_PARAMETERS, f.getNParameters());
        assertTrue(f.isValid(SyntheticSpots.parameters(0, 0, 10, 0, 1, 1)));
        assertFalse("null width", f.isValid(SyntheticSpots.parameters(0, 0, 10, 0, 0, 1)));
        assertFalse("negative width", f.isValid(SyntheticSpots.parameters(0, 0, 10, 0, 1, -1)));
        assertFalse("NaN", f.isValid(SyntheticSpots.parameters(Double.NaN, 0, 10, 0, 1, 1)));
    }
}
