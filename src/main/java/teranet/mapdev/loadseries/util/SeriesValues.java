package teranet.mapdev.loadseries.util;

import org.apache.commons.math3.util.Precision;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

/**
 * Cell-level helpers shared by the stages: missing-value tokens, 4-decimal rounding and
 * the text form written to CSV.
 */
public final class SeriesValues {

    public static final int DECIMALS = 4;

    /** Tokens the extraction step writes for readings it did not get */
    private static final Set<String> NULL_TOKENS = Set.of("", "null", "none", "nan");

    private SeriesValues() {
    }

    /**
     * Missing or zero. Zero is the sentinel the meters report when no reading was taken.
     */
    public static boolean isMissingOrZero(double value) {
        return Double.isNaN(value) || value == 0.0;
    }

    public static boolean isNullToken(String raw) {
        return raw == null || NULL_TOKENS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Parse a value cell.
     *
     * @param raw         cell text
     * @param zeroMissing whether a literal zero counts as missing
     * @return the value, or NaN for null tokens (and zero when requested)
     * @throws NumberFormatException for any other non-numeric text
     */
    public static double parse(String raw, boolean zeroMissing) {
        if (isNullToken(raw)) {
            return Double.NaN;
        }
        double value = Double.parseDouble(raw.trim());
        if (Double.isInfinite(value)) {
            throw new NumberFormatException("Infinite value: " + raw);
        }
        if (zeroMissing && value == 0.0) {
            return Double.NaN;
        }
        return value;
    }

    /**
     * Round half-up to 4 decimals; NaN stays NaN and negative zero becomes zero.
     */
    public static double round(double value) {
        if (Double.isNaN(value)) {
            return value;
        }
        double rounded = Precision.round(value, DECIMALS);
        return rounded == 0.0 ? 0.0 : rounded;
    }

    public static void roundInPlace(double[][] matrix) {
        for (double[] row : matrix) {
            for (int col = 0; col < row.length; col++) {
                row[col] = round(row[col]);
            }
        }
    }

    public static int countMissing(double[] values) {
        int missing = 0;
        for (double v : values) {
            if (Double.isNaN(v)) {
                missing++;
            }
        }
        return missing;
    }

    public static int countMissing(double[][] matrix) {
        int missing = 0;
        for (double[] row : matrix) {
            missing += countMissing(row);
        }
        return missing;
    }

    /**
     * Plain decimal text without exponent; integral values keep one decimal ("12.0"),
     * missing values are written as an empty cell.
     */
    public static String format(double value) {
        if (Double.isNaN(value)) {
            return "";
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        if (decimal.scale() <= 0) {
            return decimal.setScale(1).toPlainString();
        }
        return decimal.toPlainString();
    }
}
