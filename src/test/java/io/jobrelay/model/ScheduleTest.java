package io.jobrelay.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ScheduleTest {

    @Test
    void namedAndCompactCadencesResolveToMinutes() {
        Assertions.assertEquals(60, Schedule.parse("hourly", null).intervalMinutes());
        Assertions.assertEquals(24 * 60, Schedule.parse("daily", null).intervalMinutes());
        Assertions.assertEquals(7 * 24 * 60, Schedule.parse("WEEKLY", null).intervalMinutes());
        Assertions.assertEquals(10, Schedule.parse("10m", null).intervalMinutes());
        Assertions.assertEquals(360, Schedule.parse("6h", null).intervalMinutes());
        Assertions.assertEquals(2 * 24 * 60, Schedule.parse(" 2d ", null).intervalMinutes());

        Schedule hourly = Schedule.parse("hourly", null);
        Assertions.assertEquals(Schedule.Kind.CADENCE, hourly.kind());
        Assertions.assertNull(hourly.intervalColumn());
        Assertions.assertEquals(1_000L + 3_600_000L, hourly.nextRunAfter(1_000L));
    }

    @Test
    void explicitIntervalWinsOverDescriptor() {
        Schedule schedule = Schedule.parse("daily", 15);
        Assertions.assertEquals(Schedule.Kind.INTERVAL, schedule.kind());
        Assertions.assertEquals(15, schedule.intervalMinutes());
        Assertions.assertEquals(15, schedule.intervalColumn());
        Assertions.assertEquals(15 * 60_000L, schedule.nextRunAfter(0L));
    }

    @Test
    void onceHasNoNextRun() {
        Schedule once = Schedule.parse("once", null);
        Assertions.assertTrue(once.oneShot());
        Assertions.assertNull(once.nextRunAfter(42L));
        Assertions.assertNull(once.intervalColumn());
    }

    @Test
    void rejectsUnknownOrMissingSchedules() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Schedule.parse("fortnightly", null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Schedule.parse("0m", null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Schedule.parse("", null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Schedule.parse(null, 0));
    }
}
