package com.roomallocator.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.Objects;

/**
 * A same-day interval [start, end) on a calendar date, minute precision.
 */
public final class TimeSlot {
    public static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    /** Orders slots by date, then start time, then end time. */
    public static final Comparator<TimeSlot> CHRONOLOGICAL = Comparator
            .comparing(TimeSlot::getDate)
            .thenComparing(TimeSlot::getStart)
            .thenComparing(TimeSlot::getEnd);

    private final LocalDate date;
    private final LocalTime start;
    private final LocalTime end;

    public TimeSlot(LocalDate date, LocalTime start, LocalTime end) {
        if (date == null) {
            throw new InvalidRequestException("Date is required");
        }
        if (start == null || end == null) {
            throw new InvalidRequestException("Start and end time are required");
        }
        LocalTime s = start.truncatedTo(ChronoUnit.MINUTES);
        LocalTime e = end.truncatedTo(ChronoUnit.MINUTES);
        if (!s.isBefore(e)) {
            throw new InvalidRequestException("End time must be after start time");
        }
        this.date = date;
        this.start = s;
        this.end = e;
    }

    /**
     * Builds a slot from wire strings: ISO date and {@code HH:mm} times.
     */
    public static TimeSlot parse(String date, String start, String end) {
        if (date == null || start == null || end == null) {
            throw new InvalidRequestException("Date, start time and end time are required");
        }
        try {
            return new TimeSlot(LocalDate.parse(date.trim()),
                    LocalTime.parse(start.trim()),
                    LocalTime.parse(end.trim()));
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("Malformed date or time: " + e.getParsedString(), e);
        }
    }

    public LocalDate getDate() {
        return date;
    }

    public LocalTime getStart() {
        return start;
    }

    public LocalTime getEnd() {
        return end;
    }

    /**
     * Minutes since midnight of the start time.
     */
    public int getStartMinute() {
        return start.getHour() * 60 + start.getMinute();
    }

    public int getEndMinute() {
        return end.getHour() * 60 + end.getMinute();
    }

    /**
     * Two slots overlap when they share the date and neither ends before the
     * other starts. Touching endpoints do not overlap.
     */
    public boolean overlaps(TimeSlot other) {
        if (!date.equals(other.date)) {
            return false;
        }
        return start.isBefore(other.end) && end.isAfter(other.start);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSlot)) return false;
        TimeSlot that = (TimeSlot) o;
        return date.equals(that.date) && start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, start, end);
    }

    @Override
    public String toString() {
        return date + " " + start.format(TIME_FORMAT) + "-" + end.format(TIME_FORMAT);
    }
}
