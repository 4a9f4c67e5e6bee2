package io.github.yok.gettime.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.gettime.config.GettimeProperties;
import io.github.yok.gettime.config.GettimeProperties.CustomInputFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class CustomFormatRegistryTest {

    private static final TimestampParser NONE = (timestamp, pattern) -> Optional.empty();

    @Test
    void register_正常ケース_複数登録する_最後に登録したものが先頭になること() {
        CustomFormatRegistry registry = new CustomFormatRegistry();
        CustomFormat first = registry.register("^a$", NONE);
        CustomFormat second = registry.register("^b$", NONE);

        List<CustomFormat> snapshot = registry.snapshot();
        assertEquals(2, snapshot.size());
        assertSame(second, snapshot.get(0));
        assertSame(first, snapshot.get(1));
    }

    @Test
    void register_正常ケース_同一パターンを重複登録する_両方が保持されること() {
        CustomFormatRegistry registry = new CustomFormatRegistry();
        registry.register("^x$", NONE);
        registry.register("^x$", NONE);
        assertEquals(2, registry.matching("x").size());
    }

    @Test
    void register_異常ケース_不正な正規表現を指定する_IllegalArgumentExceptionが送出されること() {
        CustomFormatRegistry registry = new CustomFormatRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.register("([", NONE));
        assertTrue(registry.snapshot().isEmpty());
    }

    @Test
    void register_異常ケース_parserにnullを指定する_NullPointerExceptionが送出されること() {
        CustomFormatRegistry registry = new CustomFormatRegistry();
        assertThrows(NullPointerException.class, () -> registry.register("^x$", null));
        assertThrows(NullPointerException.class,
                () -> registry.register((Pattern) null, NONE));
    }

    @Test
    void matching_正常ケース_部分一致するパターン_一致したものだけが返ること() {
        CustomFormatRegistry registry = new CustomFormatRegistry();
        CustomFormat pipe = registry.register("\\|", NONE);
        registry.register("^\\d+$", NONE);

        List<CustomFormat> actual = registry.matching("2024|01|15");
        assertEquals(List.of(pipe), actual);
    }

    @Test
    void snapshot_異常ケース_変更を試みる_UnsupportedOperationExceptionが送出されること() {
        CustomFormatRegistry registry = new CustomFormatRegistry();
        registry.register("^x$", NONE);
        List<CustomFormat> snapshot = registry.snapshot();
        assertThrows(UnsupportedOperationException.class, () -> snapshot.clear());
    }

    @Test
    void snapshot_正常ケース_取得後に登録する_取得済みのスナップショットは変化しないこと() {
        CustomFormatRegistry registry = new CustomFormatRegistry();
        registry.register("^x$", NONE);
        List<CustomFormat> before = registry.snapshot();
        registry.register("^y$", NONE);
        assertEquals(1, before.size());
        assertEquals(2, registry.snapshot().size());
    }

    @Test
    void constructor_正常ケース_設定された書式を指定する_宣言順に先頭から並ぶこと() {
        GettimeProperties properties = new GettimeProperties();
        properties.getCustomInputFormats().add(entry("^first$", NamedFormatParser.DOT));
        properties.getCustomInputFormats().add(entry("^second$", NamedFormatParser.DMY));

        CustomFormatRegistry registry = new CustomFormatRegistry(properties);

        List<CustomFormat> snapshot = registry.snapshot();
        assertEquals("^first$", snapshot.get(0).getPattern().pattern());
        assertSame(NamedFormatParser.DOT, snapshot.get(0).getParser());
        assertEquals("^second$", snapshot.get(1).getPattern().pattern());
        assertSame(NamedFormatParser.DMY, snapshot.get(1).getParser());
    }

    @Test
    void constructor_異常ケース_パターンが空の設定を指定する_IllegalArgumentExceptionが送出されること() {
        GettimeProperties properties = new GettimeProperties();
        properties.getCustomInputFormats().add(entry(" ", NamedFormatParser.DOT));
        assertThrows(IllegalArgumentException.class, () -> new CustomFormatRegistry(properties));
    }

    @Test
    void constructor_異常ケース_parser未指定の設定を指定する_IllegalArgumentExceptionが送出されること() {
        GettimeProperties properties = new GettimeProperties();
        properties.getCustomInputFormats().add(entry("^x$", null));
        assertThrows(IllegalArgumentException.class, () -> new CustomFormatRegistry(properties));
    }

    @Test
    void register_正常ケース_複数スレッドから登録する_全件が保持されること() throws Exception {
        CustomFormatRegistry registry = new CustomFormatRegistry();
        int threads = 8;
        int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        registry.register("^x$", NONE);
                    }
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        assertEquals(threads * perThread, registry.snapshot().size());
    }

    private static CustomInputFormat entry(String pattern, NamedFormatParser parser) {
        CustomInputFormat entry = new CustomInputFormat();
        entry.setPattern(pattern);
        entry.setParser(parser);
        return entry;
    }
}
