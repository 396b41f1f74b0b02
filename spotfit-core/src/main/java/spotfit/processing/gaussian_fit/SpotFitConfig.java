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
package spotfit.processing.gaussian_fit;

import spotfit.utils.JSONSerializable;
import spotfit.utils.JSONUtils;
import org.json.simple.JSONObject;

/**
 * Parameters of the spot fit.
 * <ul>
 *     <li>maxIter see {@link LevenbergMarquardtSolver#LevenbergMarquardtSolver(int, double, double, double, boolean)}</li>
 *     <li>lambda initial damping</li>
 *     <li>fTol, xTol relative tolerances on the residual decrease and on the parameter step</li>
 *     <li>numericalJacobian derivatives estimated by forward differences (default) or computed analytically</li>
 *     <li>minInitialSigma lower bound of the initial widths estimated from the moments</li>
 *     <li>degenerateSpotPolicy handling of flat spots, see {@link DegenerateSpotPolicy}</li>
 * </ul>
 * @author Jean Ollion
 */
public class SpotFitConfig implements JSONSerializable {
    public int maxIter = 200;
    public double lambda = 1e-3;
    public double fTol = 1e-2;
    public double xTol = 1e-2;
    public boolean numericalJacobian = true;
    public double minInitialSigma = 0.1;
    public DegenerateSpotPolicy degenerateSpotPolicy = DegenerateSpotPolicy.FLOOR;

    public SpotFitConfig duplicate() {
        return new SpotFitConfig()
                .setMaxIter(maxIter)
                .setLambda(lambda)
                .setFTol(fTol)
                .setXTol(xTol)
                .setNumericalJacobian(numericalJacobian)
                .setMinInitialSigma(minInitialSigma)
                .setDegenerateSpotPolicy(degenerateSpotPolicy);
    }

    public SpotFitConfig setMaxIter(int maxIter) {
        if (maxIter<1) throw new IllegalArgumentException("maxIter must be >=1");
        this.maxIter = maxIter;
        return this;
    }

    public SpotFitConfig setLambda(double lambda) {
        if (!(lambda>0)) throw new IllegalArgumentException("lambda must be >0");
        this.lambda = lambda;
        return this;
    }

    public SpotFitConfig setFTol(double fTol) {
        if (!(fTol>=0)) throw new IllegalArgumentException("fTol must be >=0");
        this.fTol = fTol;
        return this;
    }

    public SpotFitConfig setXTol(double xTol) {
        if (!(xTol>=0)) throw new IllegalArgumentException("xTol must be >=0");
        this.xTol = xTol;
        return this;
    }

    public SpotFitConfig setNumericalJacobian(boolean numericalJacobian) {
        this.numericalJacobian = numericalJacobian;
        return this;
    }

    public SpotFitConfig setMinInitialSigma(double minInitialSigma) {
        if (!(minInitialSigma>0)) throw new IllegalArgumentException("minInitialSigma must be >0");
        this.minInitialSigma = minInitialSigma;
        return this;
    }

    public SpotFitConfig setDegenerateSpotPolicy(DegenerateSpotPolicy degenerateSpotPolicy) {
        if (degenerateSpotPolicy==null) throw new IllegalArgumentException("policy cannot be null");
        this.degenerateSpotPolicy = degenerateSpotPolicy;
        return this;
    }

    public LevenbergMarquardtSolver getSolver() {
        return new LevenbergMarquardtSolver(maxIter, lambda, fTol, xTol, numericalJacobian);
    }

    public MomentEstimator getStartPointEstimator() {
        return new MomentEstimator(minInitialSigma, degenerateSpotPolicy);
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("maxIter", maxIter);
        res.put("lambda", lambda);
        res.put("fTol", fTol);
        res.put("xTol", xTol);
        res.put("numericalJacobian", numericalJacobian);
        res.put("minInitialSigma", minInitialSigma);
        res.put("degenerateSpotPolicy", degenerateSpotPolicy.name());
        return res;
    }

    /**
     * Missing entries keep their current value
     */
    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof JSONObject)) throw new IllegalArgumentException("Expected a JSON object, got: "+jsonEntry);
        JSONObject json = (JSONObject)jsonEntry;
        setMaxIter(JSONUtils.getInt(json, "maxIter", maxIter));
        setLambda(JSONUtils.getDouble(json, "lambda", lambda));
        setFTol(JSONUtils.getDouble(json, "fTol", fTol));
        setXTol(JSONUtils.getDouble(json, "xTol", xTol));
        setNumericalJacobian(JSONUtils.getBoolean(json, "numericalJacobian", numericalJacobian));
        setMinInitialSigma(JSONUtils.getDouble(json, "minInitialSigma", minInitialSigma));
        setDegenerateSpotPolicy(JSONUtils.getEnum(json, "degenerateSpotPolicy", DegenerateSpotPolicy.class, degenerateSpotPolicy));
    }

    @Override
    public String toString() {
        return JSONUtils.serialize(this);
    }
}
