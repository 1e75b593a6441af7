package io.github.yok.roomlink.util;

import io.github.yok.roomlink.writer.ExportFormat;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports the failures that end a RoomLink run and maps them to the process exit code.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>Each failure is logged once at error level. A pipeline failure carries its stack trace.</li>
 * <li>A concise {@code ERROR: ...} line is written to {@code System.err}, followed by the usage
 * text for argument errors.</li>
 * <li>Every method returns the exit code {@code Main} hands to Spring on shutdown.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    /** Exit code of a successful run. */
    public static final int EXIT_OK = 0;

    /** Exit code of a run that ended with an argument error or a failure. */
    public static final int EXIT_FAILURE = 1;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: <studentsFile> <roomsFile> <format>",
            "       --students|-s <file> --rooms|-r <file> --format|-f <format>",
            "Formats: " + formatNames());

    @Generated
    private ErrorHandler() {}

    /**
     * Reports arguments that were not given.
     *
     * @param missing names of the missing arguments, in command-line order
     * @return {@link #EXIT_FAILURE}
     */
    public static int missingArguments(List<String> missing) {
        String message = "Missing argument(s): " + String.join(", ", missing);
        log.error(message);
        System.err.println("ERROR: " + message + System.lineSeparator() + USAGE);
        return EXIT_FAILURE;
    }

    /**
     * Reports a format name that matches no {@link ExportFormat}.
     *
     * @param name format name as given
     * @return {@link #EXIT_FAILURE}
     */
    public static int unknownFormat(String name) {
        String message = "Unknown file format: " + name;
        log.error(message);
        System.err.println("ERROR: " + message + System.lineSeparator() + USAGE);
        return EXIT_FAILURE;
    }

    /**
     * Reports a failure of the report pipeline.
     *
     * @param cause failure raised by the pipeline
     * @return {@link #EXIT_FAILURE}
     */
    public static int fatal(Throwable cause) {
        log.error("Fatal error: {}", cause.getMessage(), cause);
        System.err.println("ERROR: Fatal error: " + ExceptionUtils.getRootCauseMessage(cause));
        return EXIT_FAILURE;
    }

    private static String formatNames() {
        return Arrays.stream(ExportFormat.values())
                .map(f -> f.getNames().stream().sorted().collect(Collectors.joining("|")))
                .collect(Collectors.joining(", "));
    }
}
