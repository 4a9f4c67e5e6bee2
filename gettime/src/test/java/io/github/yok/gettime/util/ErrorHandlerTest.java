package io.github.yok.gettime.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.gettime.model.ConversionError;
import io.github.yok.gettime.model.ConversionErrorKind;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ErrorHandlerTest {

    @Test
    void errorAndExit_異常ケース_exit無効を指定する_IllegalStateExceptionが送出されること() {
        ErrorHandler.disableExitForCurrentThread();
        try {
            RuntimeException cause = new RuntimeException("root");
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("boom", cause));
            assertEquals("boom", ex.getMessage());
            assertSame(cause, ex.getCause());

            IllegalStateException ex2 = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit("boom2"));
            assertEquals("boom2", ex2.getMessage());

            IllegalStateException ex3 = assertThrows(IllegalStateException.class,
                    () -> ErrorHandler.errorAndExit(ConversionError.withValue(
                            ConversionErrorKind.INVALID_TIMEZONE, "Bad/Zone")));
            assertEquals("Unknown timezone: Bad/Zone", ex3.getMessage());
        } finally {
            ErrorHandler.restoreExitForCurrentThread();
        }
    }

    @Test
    void errorAndExit_正常ケース_exit有効でThrowableありを指定する_標準エラーへ出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            ErrorHandler.errorAndExit("boom", new RuntimeException("root"));
        } finally {
            System.setErr(originalErr);
        }
        String message = err.toString();
        Assertions.assertTrue(message.contains("ERROR: boom"));
        Assertions.assertTrue(message.contains("root"));
    }

    @Test
    void errorAndExit_正常ケース_exit有効で変換エラーを指定する_標準エラーへ出力されること() {
        PrintStream originalErr = System.err;
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setErr(new PrintStream(err));
            ErrorHandler.errorAndExit(
                    ConversionError.withValue(ConversionErrorKind.UNPARSEABLE_TIMESTAMP, "xyz"));
        } finally {
            System.setErr(originalErr);
        }
        Assertions.assertTrue(err.toString().contains("ERROR: Unparseable timestamp: xyz"));
    }

    @Test
    void errorAndExit_正常ケース_exit有効でメッセージのみを指定する_例外が送出されないこと() {
        ErrorHandler.errorAndExit("boom2");
    }

    @Test
    void describe_正常ケース_設定エラーを指定する_プロパティ名を含む文言になること() {
        assertEquals("gettime.default-db-timezone is not a valid timezone: Mars/Olympus",
                ErrorHandler.describe(ConversionError.withValue(
                        ConversionErrorKind.INVALID_DB_TIMEZONE_CONFIG, "Mars/Olympus")));
        assertEquals("gettime.default-user-timezone is not configured", ErrorHandler.describe(
                ConversionError.of(ConversionErrorKind.INVALID_USER_TIMEZONE_CONFIG)));
    }

    @Test
    void describe_正常ケース_入力エラーを指定する_入力値を含む文言になること() {
        assertEquals("Ambiguous timestamp (US or EU day/month order?): 03/04/2024",
                ErrorHandler.describe(ConversionError
                        .withValue(ConversionErrorKind.AMBIGUOUS_TIMESTAMP, "03/04/2024")));
        assertEquals("Unsupported timestamp type", ErrorHandler.describe(
                ConversionError.of(ConversionErrorKind.UNSUPPORTED_TIMESTAMP_FORMAT)));
    }

    @Test
    void describe_正常ケース_詳細付きの変換エラーを指定する_種別と詳細を含む文言になること() {
        assertEquals("Conversion failed (FORMATTING_FAILED): %Q - Invalid strftime format",
                ErrorHandler.describe(ConversionError.withDetail(
                        ConversionErrorKind.FORMATTING_FAILED, "%Q", "Invalid strftime format")));
    }
}
