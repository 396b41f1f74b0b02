package spotfit.data_structure;

import org.junit.Test;

import static org.junit.Assert.*;

public class TestSpot {

    @Test
    public void testRowMajorLayout() {
        Spot spot = new Spot(new double[][]{{0, 1, 2}, {3, 4, 5}, {6, 7, 8}});
        assertEquals(3, spot.size());
        assertEquals(1, spot.half());
        assertEquals("row 1, column 2", 5, spot.getPixel(1, 2), 0);
        assertArrayEquals(new double[]{0, 1, 2, 3, 4, 5, 6, 7, 8}, spot.copyPixels(), 0);
        assertEquals(0, spot.getMin(), 0);
    }

    @Test
    public void testImmutable() {
        double[] pixels = new double[]{1, 1, 1, 1, 2, 1, 1, 1, 1};
        Spot spot = new Spot(3, pixels);
        pixels[4] = 10;
        spot.copyPixels()[4] = 10;
        assertEquals(2, spot.getPixel(1, 1), 0);
    }

    @Test
    public void testSinglePrecision() {
        Spot spot = new Spot(3, new float[]{1, 1, 1, 1, 2.5f, 1, 1, 1, 1});
        assertEquals(2.5, spot.getPixel(1, 1), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEvenSize() {
        new Spot(4, new double[16]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNotSquare() {
        new Spot(new double[][]{{0, 1, 2}, {3, 4}, {6, 7, 8}});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonFinitePixel() {
        double[] pixels = new double[9];
        pixels[3] = Double.NaN;
        new Spot(3, pixels);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPixelNumber() {
        new Spot(3, new double[8]);
    }
}
