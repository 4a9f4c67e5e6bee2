package io.github.yok.gettime.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class ConversionResultTest {

    @Test
    void ok_正常ケース_値を指定する_成功結果が返ること() {
        ConversionResult<String> result = ConversionResult.ok("value");
        assertTrue(result.isOk());
        assertEquals("value", result.getValue());
        assertThrows(NoSuchElementException.class, result::getError);
        assertEquals("Ok(value)", result.toString());
    }

    @Test
    void failure_正常ケース_エラーを指定する_失敗結果が返ること() {
        ConversionError error =
                ConversionError.withValue(ConversionErrorKind.INVALID_TIMEZONE, "Invalid/Zone");
        ConversionResult<String> result = ConversionResult.failure(error);
        assertFalse(result.isOk());
        assertSame(error, result.getError());
        assertThrows(NoSuchElementException.class, result::getValue);
        assertEquals("Err(INVALID_TIMEZONE value=Invalid/Zone)", result.toString());
    }

    @Test
    void flatMap_正常ケース_成功結果に適用する_次段の結果が返ること() {
        ConversionResult<Integer> result = ConversionResult.ok("abc").flatMap(
                s -> ConversionResult.ok(s.length()));
        assertEquals(3, result.getValue());
    }

    @Test
    void flatMap_正常ケース_失敗結果に適用する_次段が呼ばれずエラーが引き継がれること() {
        ConversionError error =
                ConversionError.of(ConversionErrorKind.UNSUPPORTED_TIMESTAMP_FORMAT);
        AtomicBoolean called = new AtomicBoolean();
        ConversionResult<Integer> result =
                ConversionResult.<String>failure(error).flatMap(s -> {
                    called.set(true);
                    return ConversionResult.ok(s.length());
                });
        assertFalse(called.get());
        assertSame(error, result.getError());
    }

    @Test
    void ok_異常ケース_nullを指定する_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class, () -> ConversionResult.ok(null));
        assertThrows(NullPointerException.class, () -> ConversionResult.failure(null));
    }

    @Test
    void toString_正常ケース_詳細付きエラー_種別と値と詳細が含まれること() {
        ConversionError error = ConversionError.withDetail(
                ConversionErrorKind.FORMATTING_FAILED, "%Q", "Invalid strftime format: %Q");
        assertEquals("FORMATTING_FAILED value=%Q detail=Invalid strftime format: %Q",
                error.toString());
    }
}
