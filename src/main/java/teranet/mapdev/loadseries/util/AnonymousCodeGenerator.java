package teranet.mapdev.loadseries.util;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replacement codes for surviving lines and transformers.
 *
 * Lines become 1, 2, 3, ... and the transformers of a line A to Z, then Z1, Z2, ...
 * Codes are handed out in the order the survivors were visited.
 */
public final class AnonymousCodeGenerator {

    private static final int LETTERS = 26;

    private AnonymousCodeGenerator() {
    }

    /**
     * @param index zero-based position among surviving lines
     */
    public static String lineCode(int index) {
        requireNonNegative(index);
        return String.valueOf(index + 1);
    }

    /**
     * @param index zero-based position among surviving transformers of one line
     */
    public static String transformerCode(int index) {
        requireNonNegative(index);
        if (index < LETTERS) {
            return String.valueOf((char) ('A' + index));
        }
        return "Z" + (index - LETTERS + 1);
    }

    /**
     * Original transformer code to new code, keeping the given order.
     */
    public static Map<String, String> assignTransformerCodes(List<String> originals) {
        Map<String, String> codes = new LinkedHashMap<>();
        for (String original : originals) {
            codes.put(original, transformerCode(codes.size()));
        }
        return codes;
    }

    private static void requireNonNegative(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Index must be non-negative, got " + index);
        }
    }
}
