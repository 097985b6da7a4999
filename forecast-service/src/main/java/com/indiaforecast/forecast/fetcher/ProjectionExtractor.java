package com.indiaforecast.forecast.fetcher;

import com.indiaforecast.common.model.Measurement;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises two simple headline shapes:
 *
 * <pre>
 *   "GDP growth projected at 7.2% for 2025"
 *   "Renewable energy capacity reaches 118 GW against 450 GW target for 2030, set in 2019"
 * </pre>
 *
 * Anything else yields nothing. Values are taken as written; no scale words are converted.
 */
public final class ProjectionExtractor {

    private static final String NUMBER = "(\\d[\\d,]*(?:\\.\\d+)?)";
    private static final String UNIT   = "(%|[A-Za-z$]{1,12}(?:\\s+[A-Za-z]{1,12})?)";
    private static final String YEAR   = "((?:19|20)\\d{2})";
    private static final String METRIC = "([A-Za-z][A-Za-z' -]{1,60}?)";

    private static final Pattern PROJECTION = Pattern.compile(
        METRIC + "\\s+(?:is\\s+)?(?:projected|forecast|expected|estimated|targeted)\\s+"
            + "(?:to\\s+(?:reach|be|hit|touch)\\s+|at\\s+)"
            + NUMBER + "\\s*" + UNIT + "\\s+(?:by|for|in)\\s+(?:FY\\s?)?" + YEAR,
        Pattern.CASE_INSENSITIVE);

    private static final Pattern PROGRESS = Pattern.compile(
        METRIC + "\\s+(?:reaches|reached|stands\\s+at|touches|crosses)\\s+"
            + NUMBER + "\\s*" + UNIT + "\\s+(?:against|of|towards)\\s+(?:a\\s+|the\\s+)?"
            + NUMBER + "\\s*" + UNIT + "\\s+target\\s+(?:for|by)\\s+" + YEAR
            + "(?:\\s*,?\\s*(?:set|announced)\\s+in\\s+" + YEAR + ")?",
        Pattern.CASE_INSENSITIVE);

    /** A projected value for a target year. */
    public record Projection(String metric, Measurement value, int targetYear) {}

    /** Progress made so far against a stated target. */
    public record Progress(String metric, Measurement progress, Measurement target, int targetYear,
                           OptionalInt announcementYear) {}

    private ProjectionExtractor() {}

    public static Optional<Projection> projection(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = PROJECTION.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new Projection(
            cleanMetric(m.group(1)),
            Measurement.of(number(m.group(2)), m.group(3)),
            Integer.parseInt(m.group(4))));
    }

    public static Optional<Progress> progress(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = PROGRESS.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        OptionalInt announced = m.group(7) == null
            ? OptionalInt.empty() : OptionalInt.of(Integer.parseInt(m.group(7)));
        return Optional.of(new Progress(
            cleanMetric(m.group(1)),
            Measurement.of(number(m.group(2)), m.group(3)),
            Measurement.of(number(m.group(4)), m.group(5)),
            Integer.parseInt(m.group(6)),
            announced));
    }

    private static double number(String raw) {
        return Double.parseDouble(raw.replace(",", ""));
    }

    private static String cleanMetric(String raw) {
        String metric = raw.trim().replaceAll("\\s+", " ");
        if (metric.toLowerCase(java.util.Locale.ROOT).startsWith("india's ")) {
            metric = metric.substring("india's ".length());
        }
        return metric.isEmpty() ? metric : Character.toUpperCase(metric.charAt(0)) + metric.substring(1);
    }
}
