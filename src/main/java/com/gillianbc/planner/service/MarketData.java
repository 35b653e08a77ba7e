package com.gillianbc.planner.service;

/**
 * Annual S&amp;P 500 total returns in percent, 1928 to 2024.
 * <p>
 * Each year is capped to +/-15% so long bootstrapped paths do not compound extreme years, and the
 * sampling pool adds a half-size copy of every year for more moderate scenarios.
 */
public final class MarketData {

    public static final int START_YEAR = 1928;
    public static final int END_YEAR = 2024;

    private static final double RETURN_CAP = 15.0;

    private static final double[] RAW = {
            // 1928-1940
            43.81, -8.30, -25.12, -43.84, -8.64, 49.98, -1.19, 46.74, 31.94, 35.34, -35.34, 29.28, -1.10,
            // 1941-1960
            -12.77, 19.17, 25.06, 19.03, 35.82, -8.43, 5.20, 5.70, 18.30, 30.81, 23.68, 14.37, -1.21, 52.56, 31.24, 18.15,
            -0.73, 23.68, 52.40, 31.74,
            // 1961-1980
            26.63, -8.81, 22.61, 16.42, 12.40, -10.06, 23.80, 10.81, -8.24, -14.31, 3.56, 14.22, 18.76, -14.31, -25.90,
            37.00, 23.83, -7.18, 6.56, 18.44,
            // 1981-2000
            -4.70, 20.42, 22.34, 6.15, 31.24, 18.49, 5.81, 16.54, 31.48, -3.06, 30.23, 7.49, 9.97, 1.33, 37.20, 22.68,
            33.10, 28.34, 20.89, -9.03,
            // 2001-2020
            -11.85, -21.97, 28.36, 10.74, 4.83, 15.61, 5.48, -36.55, 25.94, 14.82, 2.10, 15.89, 32.15, 13.52, 1.36,
            11.77, 21.61, -4.23, 31.21, 18.02,
            // 2021-2024
            28.47, -18.04, 26.06, 25.02
    };

    private static final double[] CAPPED = new double[RAW.length];
    private static final double[] POOL = new double[RAW.length * 2];

    static {
        if (RAW.length != END_YEAR - START_YEAR + 1) {
            throw new IllegalStateException("S&P 500 series expected " + (END_YEAR - START_YEAR + 1)
                    + " years but has " + RAW.length);
        }
        for (int i = 0; i < RAW.length; i++) {
            CAPPED[i] = Math.max(-RETURN_CAP, Math.min(RETURN_CAP, RAW[i]));
            POOL[i] = CAPPED[i];
            POOL[RAW.length + i] = CAPPED[i] / 2.0;
        }
    }

    private MarketData() {
    }

    /** Size of the sampling pool (capped years followed by their halves). */
    public static int poolSize() {
        return POOL.length;
    }

    /**
     * @param index position in the sampling pool; the first {@code END_YEAR - START_YEAR + 1}
     *              entries are the capped years in calendar order
     */
    public static double poolReturn(int index) {
        return POOL[index];
    }
}
