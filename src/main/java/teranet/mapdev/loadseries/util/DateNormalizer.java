package teranet.mapdev.loadseries.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the date column of metric files and renders it as yyyy/MM/dd.
 *
 * Accepted inputs (time part, if any, is ignored):
 *   "2023-05-01"          -> 2023/05/01
 *   "2023/5/1"            -> 2023/05/01
 *   "2023-05-01 00:00:00" -> 2023/05/01
 *   "20230501"            -> 2023/05/01
 */
public final class DateNormalizer {

    public static final DateTimeFormatter OUTPUT_FORMAT = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private static final Pattern SEPARATED_DATE = Pattern.compile(
            "^(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})(?:[ T].*)?$");
    private static final Pattern COMPACT_DATE = Pattern.compile("^(\\d{4})(\\d{2})(\\d{2})$");

    private DateNormalizer() {
    }

    /**
     * @param raw raw cell text
     * @return parsed date, or empty when the text is not a valid calendar date
     */
    public static Optional<LocalDate> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.trim();
        Matcher matcher = SEPARATED_DATE.matcher(text);
        if (!matcher.matches()) {
            matcher = COMPACT_DATE.matcher(text);
            if (!matcher.matches()) {
                return Optional.empty();
            }
        }
        try {
            return Optional.of(LocalDate.of(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3))));
        } catch (java.time.DateTimeException e) {
            return Optional.empty();
        }
    }

    public static String format(LocalDate date) {
        return OUTPUT_FORMAT.format(date);
    }
}
