package io.github.yok.roomlink;

import io.github.yok.roomlink.config.ConnectionConfig;
import io.github.yok.roomlink.config.ExportConfig;
import io.github.yok.roomlink.config.LoadConfig;
import io.github.yok.roomlink.config.PathsConfig;
import io.github.yok.roomlink.core.ReportPipeline;
import io.github.yok.roomlink.util.ErrorHandler;
import io.github.yok.roomlink.writer.ExportFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point of RoomLink.
 *
 * <p>
 * <strong>Usage:</strong>
 * </p>
 *
 * <pre>
 * java -jar roomlink.jar students.json rooms.json json
 * java -jar roomlink.jar --students students.json --rooms rooms.json --format xml
 * </pre>
 *
 * <ul>
 * <li>{@code --students}, {@code -s}: JSON file of student records</li>
 * <li>{@code --rooms}, {@code -r}: JSON file of room records</li>
 * <li>{@code --format}, {@code -f}: {@code json} (records) or {@code xml} (markup)</li>
 * </ul>
 *
 * <p>
 * Values without an option name are taken positionally in the order students, rooms, format. A
 * missing argument, an unknown format or a failed run ends the process with exit code {@code 1}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ConnectionConfig.class, PathsConfig.class, LoadConfig.class,
        ExportConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final ConnectionConfig connectionConfig;
    private final PathsConfig pathsConfig;
    private final LoadConfig loadConfig;
    private final ExportConfig exportConfig;

    // Exit code reported to Spring on shutdown
    private int exitCode = ErrorHandler.EXIT_OK;

    /**
     * Starts the Spring Boot application and exits with the run's exit code.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext ctx = app.run(args);
        if (ctx != null) {
            System.exit(SpringApplication.exit(ctx));
        }
    }

    /**
     * Parses the arguments and runs the report.
     *
     * @param args command-line arguments
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String students = null;
        String rooms = null;
        String formatName = null;
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--students":
                case "-s":
                    students = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--rooms":
                case "-r":
                    rooms = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--format":
                case "-f":
                    formatName = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    if (args[i].startsWith("-")) {
                        log.warn("Unknown argument: {}", args[i]);
                    } else {
                        positional.add(args[i]);
                    }
            }
        }

        // Positional values fill the options that were not given, in order
        int next = 0;
        if (students == null && next < positional.size()) {
            students = positional.get(next++);
        }
        if (rooms == null && next < positional.size()) {
            rooms = positional.get(next++);
        }
        if (formatName == null && next < positional.size()) {
            formatName = positional.get(next++);
        }
        if (next < positional.size()) {
            log.warn("Ignoring extra arguments: {}", positional.subList(next, positional.size()));
        }

        List<String> missing = new ArrayList<>();
        if (StringUtils.isBlank(students)) {
            missing.add("students");
        }
        if (StringUtils.isBlank(rooms)) {
            missing.add("rooms");
        }
        if (StringUtils.isBlank(formatName)) {
            missing.add("format");
        }
        if (!missing.isEmpty()) {
            exitCode = ErrorHandler.missingArguments(missing);
            return;
        }
        Optional<ExportFormat> format = ExportFormat.fromName(formatName);
        if (format.isEmpty()) {
            exitCode = ErrorHandler.unknownFormat(formatName);
            return;
        }

        log.info("Students: {}, Rooms: {}, Format: {}", students, rooms, format.get());
        try {
            List<Path> written = createPipeline().execute(Path.of(students), Path.of(rooms),
                    format.get());
            log.info("Report written: {} file(s)", written.size());
        } catch (Exception e) {
            exitCode = ErrorHandler.fatal(e);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int getExitCode() {
        return exitCode;
    }

    ReportPipeline createPipeline() {
        return new ReportPipeline(connectionConfig, pathsConfig, loadConfig, exportConfig);
    }
}
