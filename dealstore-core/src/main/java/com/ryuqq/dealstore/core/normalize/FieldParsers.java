package com.ryuqq.dealstore.core.normalize;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Lenient text parsers shared by normalization, patching and the file codec.
 *
 * <p>Each parser accepts the forms users actually type into a spreadsheet cell
 * ("£1,250.00", "15/03/2025", "Yes"). Parsers that can fail return {@link Optional#empty()}
 * for blank or unparseable input and leave it to the caller to decide whether that is
 * an error.</p>
 *
 * @author DealStore Team
 * @since 1.0.0
 */
public final class FieldParsers {

    private static final List<DateTimeFormatter> DAY_FIRST_FORMATS = List.of(
        DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT),
        DateTimeFormatter.ofPattern("d-M-uuuu").withResolverStyle(ResolverStyle.STRICT)
    );

    private static final Pattern TAG_SEPARATORS = Pattern.compile("[,;|]");

    private FieldParsers() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    /**
     * Parses ISO dates ({@code 2025-03-15}), ISO date-times (date part kept) and UK
     * day-first dates ({@code 15/03/2025}, {@code 5-3-2025}).
     *
     * @param value raw text, may be null
     * @return parsed date, or empty for blank or unrecognized input
     */
    public static Optional<LocalDate> parseDate(String value) {
        if (isBlank(value)) {
            return Optional.empty();
        }
        String text = value.trim();
        Optional<LocalDate> parsed = attempt(LocalDate::parse, text)
            .or(() -> attempt(t -> LocalDateTime.parse(t).toLocalDate(), text))
            .or(() -> attempt(t -> OffsetDateTime.parse(t).toLocalDate(), text));
        for (DateTimeFormatter format : DAY_FIRST_FORMATS) {
            if (parsed.isPresent()) {
                break;
            }
            parsed = attempt(t -> LocalDate.parse(t, format), text);
        }
        return parsed;
    }

    private static Optional<LocalDate> attempt(Function<String, LocalDate> parser, String text) {
        try {
            return Optional.of(parser.apply(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses a money amount, ignoring the pound sign, thousands separators and spaces.
     *
     * @param value raw text such as {@code "£12,500.50"}
     * @return amount, or empty for blank or non-numeric input
     */
    public static Optional<BigDecimal> parseAmount(String value) {
        if (isBlank(value)) {
            return Optional.empty();
        }
        String clean = value.replace("£", "").replace(",", "").replace(" ", "").trim();
        if (clean.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(clean));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Lenient probability used when reading stored rows: a trailing {@code %} is ignored,
     * values are clamped to {@code [0, 100]} and garbage reads as 0 (so normalization
     * later fills in the stage default).
     *
     * @param value raw text such as {@code "60%"}
     * @return probability in [0, 100]
     */
    public static int parseProbability(String value) {
        if (isBlank(value)) {
            return 0;
        }
        try {
            int parsed = Integer.parseInt(value.replace("%", "").trim());
            return Math.max(0, Math.min(100, parsed));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Parses {@code true/false}, {@code yes/no}, {@code y/n} and {@code 1/0}, ignoring case.
     *
     * @param value raw text
     * @return parsed flag, or empty when the text is none of the accepted forms
     */
    public static Optional<Boolean> parseBoolean(String value) {
        if (isBlank(value)) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "y":
            case "1":
                return Optional.of(Boolean.TRUE);
            case "false":
            case "no":
            case "n":
            case "0":
                return Optional.of(Boolean.FALSE);
            default:
                return Optional.empty();
        }
    }

    /**
     * Splits a tag cell on {@code ,}, {@code ;} or {@code |}, trimming each tag and
     * dropping empty ones.
     *
     * @param value raw text such as {@code "solar; battery|urgent"}
     * @return tags in their original order, possibly empty
     */
    public static List<String> parseTags(String value) {
        List<String> tags = new ArrayList<>();
        if (isBlank(value)) {
            return tags;
        }
        for (String part : TAG_SEPARATORS.split(value)) {
            String tag = part.trim();
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    /**
     * Percent-escapes a query component. Spaces become {@code %20}, never {@code +}.
     *
     * @param value text to escape
     * @return escaped text
     */
    public static String escapeQuery(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
