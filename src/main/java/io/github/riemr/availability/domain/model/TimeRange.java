package io.github.riemr.availability.domain.model;

/**
 * Half-open interval of minutes within a day, {@code [startMinute, endMinute)}.
 * Minute 1440 stands for 24:00.
 */
public record TimeRange(int startMinute, int endMinute) {

    public static final int DAY_START = 0;
    public static final int DAY_END = 24 * 60;

    public static TimeRange fullDay() {
        return new TimeRange(DAY_START, DAY_END);
    }

    public int length() {
        return endMinute - startMinute;
    }

    public boolean isValid() {
        return startMinute >= DAY_START && endMinute <= DAY_END && endMinute > startMinute;
    }

    public boolean isFullDay() {
        return startMinute == DAY_START && endMinute == DAY_END;
    }

    @Override
    public String toString() {
        return format(startMinute) + "-" + format(endMinute);
    }

    private static String format(int minute) {
        return String.format("%02d:%02d", minute / 60, minute % 60);
    }
}
