package com.telcobright.partman.core.partition;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/**
 * Maps calendar days to daily partition names ({@code p_YYYYMMDD}) and RANGE boundaries.
 * <p>
 * Boundaries use the engine's day ordinal, i.e. the value {@code TO_DAYS()} returns for the
 * day after the partition's date. The same encoding is used for live creation and for
 * migration so that one table never mixes two boundary schemes.
 */
public class PartitionNaming {

    public static final String PREFIX = "p_";
    public static final String FUTURE_PARTITION = "p_future";

    /** TO_DAYS('1970-01-01') */
    public static final long TO_DAYS_EPOCH_OFFSET = 719528L;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final Pattern DATED_PARTITION = Pattern.compile("^p_[0-9]{8}$");

    private final ZoneOffset zoneOffset;

    public PartitionNaming(ZoneOffset zoneOffset) {
        this.zoneOffset = zoneOffset;
    }

    public static PartitionNaming ofOffsetMillis(long timezoneOffsetMs) {
        return new PartitionNaming(ZoneOffset.ofTotalSeconds((int) (timezoneOffsetMs / 1000)));
    }

    public ZoneOffset getZoneOffset() {
        return zoneOffset;
    }

    /**
     * Calendar day of the instant at the configured offset.
     */
    public LocalDate toLocalDate(Instant instant) {
        return LocalDate.ofInstant(instant, zoneOffset);
    }

    public LocalDate today(Clock clock) {
        return toLocalDate(clock.instant());
    }

    public String partitionName(Instant instant) {
        return partitionName(toLocalDate(instant));
    }

    public String partitionName(LocalDate date) {
        return PREFIX + date.format(DATE_FORMAT);
    }

    /**
     * Exclusive upper bound for the partition holding {@code date}.
     */
    public long boundaryValue(LocalDate date) {
        return date.plusDays(1).toEpochDay() + TO_DAYS_EPOCH_OFFSET;
    }

    public static boolean isDatedPartition(String partitionName) {
        return partitionName != null && DATED_PARTITION.matcher(partitionName).matches();
    }

    /**
     * Recovers the logical date from a {@code p_YYYYMMDD} name by fixed-width slicing.
     *
     * @throws IllegalArgumentException if the name is not a dated partition name
     */
    public static LocalDate parsePartitionDate(String partitionName) {
        if (!isDatedPartition(partitionName)) {
            throw new IllegalArgumentException("Not a dated partition name: " + partitionName);
        }
        int year = Integer.parseInt(partitionName.substring(2, 6));
        int month = Integer.parseInt(partitionName.substring(6, 8));
        int day = Integer.parseInt(partitionName.substring(8, 10));
        return LocalDate.of(year, month, day);
    }
}
