package spotfit.processing.gaussian_fit;

/**
 * What to do with a spot whose background-removed intensity sums to zero (flat spot)
 */
public enum DegenerateSpotPolicy {
    /**
     * moment denominators are floored to 1, the initial center is the spot center and the widths are floored: the spot is fitted.
     * The parameters are kept only if the fit converged with its center inside the spot, otherwise they are NaN
     */
    FLOOR,
    /**
     * the spot is not fitted, its parameters are NaN
     */
    SKIP,
    /**
     * a {@link DegenerateSpotException} is thrown, which fails the whole fitting task
     */
    REJECT
}
