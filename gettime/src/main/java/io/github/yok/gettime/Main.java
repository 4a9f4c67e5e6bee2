package io.github.yok.gettime;

import io.github.yok.gettime.config.GettimeProperties;
import io.github.yok.gettime.model.ConversionResult;
import io.github.yok.gettime.util.ErrorHandler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the command-line entry point.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --tz ZONE} or {@code -z ZONE}: target timezone. If omitted,
 * {@code gettime.default-user-timezone} in {@code application.yml} is used.</li>
 * <li>{@code --format FORMAT} or {@code -f FORMAT}: strftime-style output format. If omitted,
 * {@code gettime.default-format} is used.</li>
 * <li>{@code --epoch} or {@code -e}: read numeric arguments as Unix epoch seconds.</li>
 * <li>Any other argument is a timestamp. Several timestamps are converted as one batch: either all
 * are printed or none.</li>
 * </ul>
 *
 * <pre>
 * java -jar gettime.jar -z Asia/Tokyo "2024-01-15T14:30:00Z"
 * java -jar gettime.jar -e -f "%B %d, %Y" 1705330200 1705416600
 * </pre>
 *
 * <p>
 * Exit code is {@code 0} on success, {@code 1} when a conversion fails and {@code 2} on a usage
 * error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see Gettime
 * @see GettimeProperties
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(GettimeProperties.class)
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");

    private static final Pattern DECIMAL = Pattern.compile("^[+-]?\\d*\\.\\d+$");

    private final Gettime gettime;

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        if (context != null) {
            System.exit(SpringApplication.exit(context));
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String timezone = null;
        String format = null;
        boolean epoch = false;
        List<String> timestamps = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--tz":
                case "-z":
                    timezone = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--format":
                case "-f":
                    format = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--epoch":
                case "-e":
                    epoch = true;
                    break;
                default:
                    timestamps.add(args[i]);
            }
        }

        if (timestamps.isEmpty()) {
            exitCode = 2;
            ErrorHandler.errorAndExit("At least one timestamp is required.");
            return;
        }

        List<Object> inputs = new ArrayList<>(timestamps.size());
        for (String timestamp : timestamps) {
            inputs.add(epoch ? toEpochValue(timestamp) : timestamp);
        }
        log.info("Timezone: {}, Format: {}, Epoch: {}, Timestamps: {}", timezone, format, epoch,
                inputs.size());

        ConversionResult<List<String>> result;
        try {
            if (inputs.size() == 1) {
                ConversionResult<String> single = gettime.convert(inputs.get(0), timezone, format);
                result = single.isOk() ? ConversionResult.ok(List.of(single.getValue()))
                        : ConversionResult.failure(single.getError());
            } else {
                result = gettime.convertBatch(inputs, timezone, format);
            }
        } catch (RuntimeException e) {
            log.error("Fatal error occurred: {}", e.getMessage(), e);
            exitCode = 1;
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
            return;
        }

        if (!result.isOk()) {
            exitCode = 1;
            ErrorHandler.errorAndExit(result.getError());
            return;
        }
        result.getValue().forEach(System.out::println);
        log.info("Conversion completed. Count: {}", result.getValue().size());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static Object toEpochValue(String arg) {
        if (INTEGER.matcher(arg).matches()) {
            try {
                return Long.parseLong(arg);
            } catch (NumberFormatException e) {
                // too long for a long; let the string parsers reject it
                return arg;
            }
        }
        if (DECIMAL.matcher(arg).matches()) {
            return Double.parseDouble(arg);
        }
        return arg;
    }
}
