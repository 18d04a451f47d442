package nl.bytesoflife.natalchart.house;

/**
 * One house division method. Implementations are stateless.
 */
@FunctionalInterface
interface HouseAlgorithm {

    /**
     * @return twelve cusp longitudes, index 0 holding cusp 1
     * @throws HouseConvergenceException when the method is undefined for this frame
     */
    double[] cusps(HouseFrame frame);
}
