package io.github.yok.gettime.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import io.github.yok.gettime.format.StrftimeRenderer;
import io.github.yok.gettime.format.TimestampRenderer;
import io.github.yok.gettime.model.ConversionErrorKind;
import io.github.yok.gettime.model.ConversionResult;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

class TimestampFormatterTest {

    private static final ZonedDateTime DT =
            ZonedDateTime.of(2024, 1, 15, 14, 30, 0, 0, ZoneOffset.UTC);

    @Test
    void render_正常ケース_有効な書式を指定する_文字列が返ること() {
        TimestampFormatter formatter = new TimestampFormatter(new StrftimeRenderer());
        assertEquals("2024-01-15 14:30", formatter.render(DT, "%Y-%m-%d %H:%M").getValue());
    }

    @Test
    void render_異常ケース_未知のディレクティブを指定する_FORMATTING_FAILEDが返ること() {
        TimestampFormatter formatter = new TimestampFormatter(new StrftimeRenderer());
        ConversionResult<String> actual = formatter.render(DT, "%Q");
        assertEquals(ConversionErrorKind.FORMATTING_FAILED, actual.getError().getKind());
        assertEquals("%Q", actual.getError().getValue());
        assertTrue(actual.getError().getDetail().contains("Invalid strftime format"));
    }

    @Test
    void render_異常ケース_レンダラが実行時例外を送出する_FORMATTING_FAILEDが返ること() {
        TimestampRenderer renderer = mock(TimestampRenderer.class);
        when(renderer.render(any(), anyString()))
                .thenThrow(new IllegalStateException("wrapped", new ArithmeticException("root")));
        TimestampFormatter formatter = new TimestampFormatter(renderer);

        ConversionResult<String> actual = formatter.render(DT, "%Y");
        assertEquals(ConversionErrorKind.FORMATTING_FAILED, actual.getError().getKind());
        assertEquals("ArithmeticException: root", actual.getError().getDetail());
    }
}
