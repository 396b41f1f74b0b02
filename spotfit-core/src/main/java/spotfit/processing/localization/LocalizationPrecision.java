package spotfit.processing.localization;

/**
 * Estimated positional uncertainty of a localization along one axis
 */
@FunctionalInterface
public interface LocalizationPrecision {
    /**
     * @param photons integrated intensity above background
     * @param sigma gaussian standard deviation along the axis, in pixels
     * @param bg background level
     * @param emGain sensor readout mode (electron-multiplying gain)
     * @return precision in pixels
     */
    double compute(double photons, double sigma, double bg, boolean emGain);
}
