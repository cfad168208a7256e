package ai.statute.converter.numeral;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts ordinal numbers from statute headings such as {@code 第十二条} or {@code 第３章}.
 *
 * <p>Kanji numerals are decoded up to 99. Runs containing hundreds, thousands or ten-thousands
 * are not decoded and yield an empty result.</p>
 */
public final class NumeralExtractor {

    private static final Pattern DIGITS = Pattern.compile("[0-9０-９]+");
    private static final Pattern ORDINAL_KANJI = Pattern.compile("第([一二三四五六七八九十百千万壱弐参拾]+)");
    private static final char TEN = '十';
    private static final Map<Character, Integer> UNITS = Map.ofEntries(
            Map.entry('一', 1),
            Map.entry('二', 2),
            Map.entry('三', 3),
            Map.entry('四', 4),
            Map.entry('五', 5),
            Map.entry('六', 6),
            Map.entry('七', 7),
            Map.entry('八', 8),
            Map.entry('九', 9),
            Map.entry('壱', 1),
            Map.entry('弐', 2),
            Map.entry('参', 3));

    private NumeralExtractor() {
    }

    public static Optional<Integer> extract(String heading) {
        if (heading == null || heading.isBlank()) {
            return Optional.empty();
        }
        Matcher digits = DIGITS.matcher(heading);
        if (digits.find()) {
            return parseDigits(digits.group());
        }
        Matcher kanji = ORDINAL_KANJI.matcher(heading);
        if (kanji.find()) {
            return convertKanji(kanji.group(1));
        }
        return Optional.empty();
    }

    /**
     * Decodes a bare kanji numeral run between 1 and 99.
     */
    public static Optional<Integer> convertKanji(String run) {
        if (run == null || run.isEmpty() || run.length() > 3) {
            return Optional.empty();
        }
        int tenIndex = run.indexOf(TEN);
        if (tenIndex < 0) {
            return run.length() == 1 ? unit(run.charAt(0)) : Optional.empty();
        }
        if (run.indexOf(TEN, tenIndex + 1) >= 0) {
            return Optional.empty();
        }
        String tensPart = run.substring(0, tenIndex);
        String unitsPart = run.substring(tenIndex + 1);
        Optional<Integer> tens = tensPart.isEmpty() ? Optional.of(1) : single(tensPart);
        Optional<Integer> units = unitsPart.isEmpty() ? Optional.of(0) : single(unitsPart);
        if (tens.isEmpty() || units.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(tens.get() * 10 + units.get());
    }

    private static Optional<Integer> single(String part) {
        return part.length() == 1 ? unit(part.charAt(0)) : Optional.empty();
    }

    private static Optional<Integer> unit(char ch) {
        return Optional.ofNullable(UNITS.get(ch));
    }

    private static Optional<Integer> parseDigits(String raw) {
        StringBuilder ascii = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            ascii.append(ch >= '０' && ch <= '９' ? (char) ('0' + (ch - '０')) : ch);
        }
        try {
            return Optional.of(Integer.parseInt(ascii.toString()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
