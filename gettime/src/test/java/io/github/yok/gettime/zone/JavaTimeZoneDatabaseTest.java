package io.github.yok.gettime.zone;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

class JavaTimeZoneDatabaseTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    private final JavaTimeZoneDatabase database = new JavaTimeZoneDatabase();

    @Test
    void listIdentifiers_正常ケース_主要なタイムゾーンが含まれること() {
        assertTrue(database.listIdentifiers().contains("UTC"));
        assertTrue(database.listIdentifiers().contains("Asia/Tokyo"));
        assertTrue(database.listIdentifiers().contains("Europe/Paris"));
        assertFalse(database.listIdentifiers().contains("Invalid/Zone"));
    }

    @Test
    void listIdentifiers_異常ケース_変更を試みる_UnsupportedOperationExceptionが送出されること() {
        assertThrows(UnsupportedOperationException.class,
                () -> database.listIdentifiers().add("Mars/Olympus"));
    }

    @Test
    void anchor_正常ケース_通常の時刻を指定する_ゾーン付き日時が返ること() throws Exception {
        ZonedDateTime actual = database.anchor(LocalDateTime.of(2024, 1, 15, 14, 30), NEW_YORK);
        assertEquals(ZoneOffset.ofHours(-5), actual.getOffset());
        assertEquals(NEW_YORK, actual.getZone());
        assertEquals(LocalDateTime.of(2024, 1, 15, 14, 30), actual.toLocalDateTime());
    }

    @Test
    void anchor_異常ケース_夏時間開始の空白時刻を指定する_TimezoneDatabaseExceptionが送出されること() {
        TimezoneDatabaseException ex = assertThrows(TimezoneDatabaseException.class,
                () -> database.anchor(LocalDateTime.of(2024, 3, 10, 2, 30), NEW_YORK));
        assertTrue(ex.getMessage().startsWith("Nonexistent local time"));
    }

    @Test
    void anchor_異常ケース_夏時間終了の重複時刻を指定する_TimezoneDatabaseExceptionが送出されること() {
        TimezoneDatabaseException ex = assertThrows(TimezoneDatabaseException.class,
                () -> database.anchor(LocalDateTime.of(2024, 11, 3, 1, 30), NEW_YORK));
        assertTrue(ex.getMessage().startsWith("Ambiguous local time"));
    }

    @Test
    void shift_正常ケース_別ゾーンを指定する_同一時点の日時が返ること() throws Exception {
        ZonedDateTime utc = ZonedDateTime.of(2024, 1, 15, 14, 30, 0, 0, ZoneOffset.UTC);
        ZonedDateTime actual = database.shift(utc, ZoneId.of("Asia/Tokyo"));
        assertEquals(utc.toInstant(), actual.toInstant());
        assertEquals(LocalDateTime.of(2024, 1, 15, 23, 30), actual.toLocalDateTime());
    }

    @Test
    void shift_異常ケース_nullを指定する_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class, () -> database.shift(null, NEW_YORK));
    }
}
