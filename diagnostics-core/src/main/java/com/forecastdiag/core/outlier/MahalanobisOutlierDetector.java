package com.forecastdiag.core.outlier;

import com.forecastdiag.core.util.Stats;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Multivariate outlier detector based on the Mahalanobis distance.
 *
 * <p>
 * Each row of the input is one point. The detector estimates the mean and the
 * sample covariance of all points, computes every point's distance
 * {@code sqrt((x - μ)ᵀ Σ⁻¹ (x - μ))} and flags the points whose distance is
 * strictly above the {@code (1 - contamination)} percentile of all distances.
 * Distances within a relative 1e-9 of the cut-off count as ties and are not
 * flagged.
 * </p>
 *
 * <h3>Singular covariance</h3>
 * <p>
 * The rank of Σ is read from its singular values: any value at or below
 * 1e-10 times the largest one counts as zero. A rank-deficient Σ (collinear
 * points, a constant feature or constant input) is replaced by its
 * Moore-Penrose pseudo-inverse, so directions without variance contribute
 * nothing to the distance.
 * </p>
 *
 * <h3>Univariate input</h3>
 * <p>
 * {@link #detect(double[])} treats each value as a one-feature point, which
 * reduces to {@code |x - mean| / s}. This overlaps with
 * {@link ZScoreOutlierDetector}; the difference is the percentile-based
 * cut-off.
 * </p>
 *
 * @since 1.0.0
 */
public class MahalanobisOutlierDetector implements OutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MahalanobisOutlierDetector.class);

    public static final String METHOD = "mahalanobis";
    public static final double DEFAULT_CONTAMINATION = 0.1;

    static final double TIE_TOLERANCE = 1e-9;
    static final double RANK_TOLERANCE = 1e-10;

    private final double contamination;

    public MahalanobisOutlierDetector() {
        this(DEFAULT_CONTAMINATION);
    }

    /**
     * @param contamination expected share of anomalies, in (0, 1)
     */
    public MahalanobisOutlierDetector(double contamination) {
        if (!(contamination > 0 && contamination < 1)) {
            throw new IllegalArgumentException("Contamination must be in (0, 1), got: " + contamination);
        }
        this.contamination = contamination;
    }

    @Override
    public boolean[] detect(double[] values) {
        Stats.requireNonEmpty(values, "values");
        double[][] points = new double[values.length][1];
        for (int i = 0; i < values.length; i++) {
            points[i][0] = values[i];
        }
        return detect(points);
    }

    /**
     * Flag outlying rows of a point matrix.
     *
     * @param points one row per point, all rows of equal non-zero width
     * @return one flag per row
     * @throws IllegalArgumentException if the matrix is empty or ragged
     */
    public boolean[] detect(double[][] points) {
        double[] distances = distances(points);
        boolean[] flags = new boolean[distances.length];
        if (distances.length < 2) {
            return flags;
        }
        double cutoff = Stats.percentile(distances, (1 - contamination) * 100);
        double threshold = cutoff + TIE_TOLERANCE * Math.max(1.0, cutoff);
        for (int i = 0; i < distances.length; i++) {
            flags[i] = distances[i] > threshold;
        }
        return flags;
    }

    /**
     * Mahalanobis distance of every row from the sample mean.
     *
     * @param points one row per point
     * @return one distance per row; all zero when fewer than two points
     */
    public double[] distances(double[][] points) {
        int dimension = checkShape(points);
        int n = points.length;
        double[] distances = new double[n];
        if (n < 2) {
            return distances;
        }

        RealMatrix data = new Array2DRowRealMatrix(points, false);
        double[] mean = new double[dimension];
        for (int j = 0; j < dimension; j++) {
            mean[j] = Stats.mean(data.getColumn(j));
        }
        RealMatrix inverse = invert(new Covariance(data).getCovarianceMatrix());

        RealVector centre = new ArrayRealVector(mean, false);
        for (int i = 0; i < n; i++) {
            RealVector diff = data.getRowVector(i).subtract(centre);
            double squared = inverse.operate(diff).dotProduct(diff);
            // rounding can push a zero distance slightly negative
            distances[i] = Math.sqrt(Math.max(0.0, squared));
        }
        return distances;
    }

    @Override
    public String getMethodName() {
        return METHOD;
    }

    @Override
    public double getParameter() {
        return contamination;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static RealMatrix invert(RealMatrix covariance) {
        SingularValueDecomposition svd = new SingularValueDecomposition(covariance);
        double[] singular = svd.getSingularValues();
        double floor = singular[0] * RANK_TOLERANCE;
        int rank = 0;
        while (rank < singular.length && singular[rank] > floor) {
            rank++;
        }
        if (rank == singular.length) {
            return new LUDecomposition(covariance).getSolver().getInverse();
        }

        LOG.debug("Covariance matrix has rank {} of {}; using pseudo-inverse", rank, singular.length);
        RealMatrix u = svd.getU();
        RealMatrix v = svd.getV();
        RealMatrix pseudo = new Array2DRowRealMatrix(singular.length, singular.length);
        for (int k = 0; k < rank; k++) {
            pseudo = pseudo.add(v.getColumnVector(k).outerProduct(u.getColumnVector(k))
                    .scalarMultiply(1.0 / singular[k]));
        }
        return pseudo;
    }

    private static int checkShape(double[][] points) {
        Objects.requireNonNull(points, "points must not be null");
        if (points.length == 0) {
            throw new IllegalArgumentException("points must not be empty");
        }
        int dimension = Objects.requireNonNull(points[0], "row 0 must not be null").length;
        if (dimension == 0) {
            throw new IllegalArgumentException("points must have at least one feature");
        }
        for (int i = 1; i < points.length; i++) {
            Objects.requireNonNull(points[i], "row " + i + " must not be null");
            if (points[i].length != dimension) {
                throw new IllegalArgumentException("Row " + i + " has " + points[i].length
                        + " feature(s), expected " + dimension);
            }
        }
        return dimension;
    }
}
