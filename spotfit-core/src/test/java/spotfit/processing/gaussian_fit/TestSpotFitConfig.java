package spotfit.processing.gaussian_fit;

import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.junit.Test;
import spotfit.utils.JSONUtils;

import static org.junit.Assert.*;

public class TestSpotFitConfig {

    @Test
    public void testDefaults() {
        SpotFitConfig config = new SpotFitConfig();
        assertEquals(200, config.maxIter);
        assertEquals(1e-3, config.lambda, 0);
        assertEquals(1e-2, config.fTol, 0);
        assertEquals(1e-2, config.xTol, 0);
        assertTrue(config.numericalJacobian);
        assertEquals(DegenerateSpotPolicy.FLOOR, config.degenerateSpotPolicy);
    }

    @Test
    public void testJSON() throws ParseException {
        SpotFitConfig config = new SpotFitConfig().setMaxIter(50).setLambda(0.01).setFTol(1e-4).setXTol(1e-5)
                .setNumericalJacobian(false).setMinInitialSigma(0.5).setDegenerateSpotPolicy(DegenerateSpotPolicy.REJECT);
        SpotFitConfig parsed = JSONUtils.parse(SpotFitConfig::new, config.toString());
        assertEquals(config.toJSONEntry(), parsed.toJSONEntry());
        assertEquals(50, parsed.maxIter);
        assertEquals(DegenerateSpotPolicy.REJECT, parsed.degenerateSpotPolicy);
    }

    @Test
    public void testPartialJSON() throws ParseException {
        SpotFitConfig config = JSONUtils.parse(SpotFitConfig::new, "{\"maxIter\":10,\"degenerateSpotPolicy\":\"SKIP\"}");
        assertEquals(10, config.maxIter);
        assertEquals(DegenerateSpotPolicy.SKIP, config.degenerateSpotPolicy);
        assertEquals("missing entries keep default", 1e-2, config.fTol, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownPolicy() throws ParseException {
        JSONUtils.parse(SpotFitConfig::new, "{\"degenerateSpotPolicy\":\"IGNORE\"}");
    }

    @Test(expected = ParseException.class)
    public void testNotAnObject() throws ParseException {
        JSONUtils.parse("[1, 2]");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidLambda() {
        new SpotFitConfig().setLambda(0);
    }

    @Test
    public void testDuplicate() {
        SpotFitConfig config = new SpotFitConfig().setMaxIter(20);
        SpotFitConfig dup = config.duplicate();
        dup.setMaxIter(30);
        assertEquals(20, config.maxIter);
        JSONObject json = dup.toJSONEntry();
        assertEquals(30, ((Number)json.get("maxIter")).intValue());
    }
}
