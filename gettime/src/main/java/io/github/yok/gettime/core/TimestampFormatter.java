package io.github.yok.gettime.core;

import io.github.yok.gettime.format.TimestampRenderer;
import io.github.yok.gettime.model.ConversionError;
import io.github.yok.gettime.model.ConversionErrorKind;
import io.github.yok.gettime.model.ConversionResult;
import java.time.ZonedDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.stereotype.Component;

/**
 * Renders a converted date-time. Runtime failures of the {@link TimestampRenderer} are reported as
 * {@link ConversionErrorKind#FORMATTING_FAILED} and never escape this class.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimestampFormatter {

    private final TimestampRenderer renderer;

    /**
     * Renders the date-time.
     *
     * @param dateTime converted date-time
     * @param format strftime-style format
     * @return rendered text or {@link ConversionErrorKind#FORMATTING_FAILED}
     */
    public ConversionResult<String> render(ZonedDateTime dateTime, String format) {
        try {
            return ConversionResult.ok(renderer.render(dateTime, format));
        } catch (RuntimeException e) {
            log.debug("Rendering failed. format={}", format, e);
            return ConversionResult.failure(ConversionError.withDetail(
                    ConversionErrorKind.FORMATTING_FAILED, format,
                    ExceptionUtils.getRootCauseMessage(e)));
        }
    }
}
