package io.github.yok.gettime.parser;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.github.yok.gettime.config.GettimeProperties;
import io.github.yok.gettime.config.SlashDateOrder;
import io.github.yok.gettime.model.ConversionError;
import io.github.yok.gettime.model.ConversionErrorKind;
import io.github.yok.gettime.model.ConversionResult;
import io.github.yok.gettime.model.TimestampInput;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Ordered set of string parsers: matching custom formats first (most recent registration first),
 * then the {@link BuiltInParser}s.
 *
 * <p>
 * The first parser that yields a {@code ZONED}, {@code NAIVE} or {@code DATE} value wins. A parser
 * that throws, returns nothing, or returns another kind is skipped. For the same registry state
 * and input the same parser always wins.
 * </p>
 *
 * <p>
 * Slash-separated date-times are read according to {@link SlashDateOrder}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class TimestampParserChain {

    private static final Set<TimestampInput.Kind> PARSED_KINDS = ImmutableSet
            .of(TimestampInput.Kind.ZONED, TimestampInput.Kind.NAIVE, TimestampInput.Kind.DATE);

    private final CustomFormatRegistry registry;

    private final SlashDateOrder slashDateOrder;

    private final List<BuiltInParser> builtIns;

    /**
     * Creates a chain reading slash dates per {@code gettime.slash-date-order}.
     *
     * @param registry custom format registry
     * @param properties bound configuration
     */
    @Autowired
    public TimestampParserChain(CustomFormatRegistry registry, GettimeProperties properties) {
        this(registry, properties.getSlashDateOrder());
    }

    /**
     * Creates a chain.
     *
     * @param registry custom format registry
     * @param slashDateOrder how to read {@code NN/NN/NNNN} dates; {@code null} means
     *        {@link SlashDateOrder#STRICT}
     */
    public TimestampParserChain(CustomFormatRegistry registry, SlashDateOrder slashDateOrder) {
        this.registry = registry;
        this.slashDateOrder = slashDateOrder == null ? SlashDateOrder.STRICT : slashDateOrder;
        this.builtIns = builtInOrder(this.slashDateOrder);
    }

    /**
     * Runs the chain over a trimmed timestamp.
     *
     * @param timestamp trimmed timestamp string
     * @return parsed value, {@link ConversionErrorKind#AMBIGUOUS_TIMESTAMP} for a slash date that
     *         reads differently in US and EU order under {@link SlashDateOrder#STRICT}, or
     *         {@link ConversionErrorKind#UNPARSEABLE_TIMESTAMP} when nothing matched
     */
    public ConversionResult<TimestampInput> parse(String timestamp) {
        for (CustomFormat format : registry.matching(timestamp)) {
            Optional<TimestampInput> parsed = tryCustom(format, timestamp);
            if (parsed.isPresent()) {
                log.debug("Custom format matched. pattern={}, timestamp={}",
                        format.getPattern().pattern(), timestamp);
                return ConversionResult.ok(parsed.get());
            }
        }

        for (BuiltInParser parser : builtIns) {
            if (parser == BuiltInParser.US && slashDateOrder == SlashDateOrder.STRICT) {
                Optional<ConversionResult<TimestampInput>> resolved = resolveSlashDate(timestamp);
                if (resolved.isPresent()) {
                    return resolved.get();
                }
                continue;
            }
            Optional<TimestampInput> parsed = parser.parse(timestamp);
            if (parsed.isPresent()) {
                log.debug("Built-in parser matched. parser={}, timestamp={}", parser, timestamp);
                return ConversionResult.ok(parsed.get());
            }
        }

        log.debug("No parser matched. timestamp={}", timestamp);
        return ConversionResult.failure(
                ConversionError.withValue(ConversionErrorKind.UNPARSEABLE_TIMESTAMP, timestamp));
    }

    private Optional<TimestampInput> tryCustom(CustomFormat format, String timestamp) {
        Optional<TimestampInput> parsed;
        try {
            parsed = format.parse(timestamp);
        } catch (RuntimeException e) {
            log.debug("Custom parser failed; treating as no match. pattern={}, timestamp={}",
                    format.getPattern().pattern(), timestamp, e);
            return Optional.empty();
        }
        if (parsed.isPresent() && !PARSED_KINDS.contains(parsed.get().getKind())) {
            log.debug("Custom parser returned unsupported kind {}; treating as no match",
                    parsed.get().getKind());
            return Optional.empty();
        }
        return parsed;
    }

    private Optional<ConversionResult<TimestampInput>> resolveSlashDate(String timestamp) {
        Optional<TimestampInput> us = BuiltInParser.US.parse(timestamp);
        Optional<TimestampInput> eu = BuiltInParser.EU.parse(timestamp);
        if (us.isPresent() && eu.isPresent() && !us.equals(eu)) {
            log.warn("Ambiguous slash date; US reads {}, EU reads {}. timestamp={}",
                    us.get().getValue(), eu.get().getValue(), timestamp);
            return Optional.of(ConversionResult.failure(ConversionError.withDetail(
                    ConversionErrorKind.AMBIGUOUS_TIMESTAMP, timestamp,
                    "valid as both MM/dd/yyyy and dd/MM/yyyy")));
        }
        Optional<TimestampInput> chosen = us.isPresent() ? us : eu;
        return chosen.map(ConversionResult::ok);
    }

    private static List<BuiltInParser> builtInOrder(SlashDateOrder order) {
        switch (order) {
            case EU_FIRST:
                return ImmutableList.of(BuiltInParser.ISO8601, BuiltInParser.RFC3339,
                        BuiltInParser.DATE_ONLY, BuiltInParser.STANDARD, BuiltInParser.EU,
                        BuiltInParser.US, BuiltInParser.ISO_LOCAL);
            case STRICT:
                // US stands for the combined US/EU resolution
                return ImmutableList.of(BuiltInParser.ISO8601, BuiltInParser.RFC3339,
                        BuiltInParser.DATE_ONLY, BuiltInParser.STANDARD, BuiltInParser.US,
                        BuiltInParser.ISO_LOCAL);
            case US_FIRST:
            default:
                return ImmutableList.copyOf(BuiltInParser.values());
        }
    }
}
