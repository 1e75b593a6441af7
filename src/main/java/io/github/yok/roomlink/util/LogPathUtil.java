package io.github.yok.roomlink.util;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Generated;
import org.apache.commons.io.FilenameUtils;

/**
 * Utility for rendering file paths in log messages.
 *
 * <p>
 * Paths under the working directory are rendered relative to it; anything else is rendered as an
 * absolute normalized path. Separators are always UNIX style so log lines look the same on every
 * platform.
 * </p>
 */
public final class LogPathUtil {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private LogPathUtil() {
        throw new AssertionError("No io.github.yok.roomlink.util.LogPathUtil instances for you!");
    }

    /**
     * Renders a path for logs.
     *
     * @param path file or directory path
     * @return path string rendered for logs
     * @throws NullPointerException if {@code path} is {@code null}
     */
    public static String render(Path path) {
        Preconditions.checkNotNull(path, "path must not be null");

        Path base = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();
        Path abs = path.toAbsolutePath().normalize();

        String rendered = abs.startsWith(base) && !abs.equals(base)
                ? base.relativize(abs).toString()
                : abs.toString();
        return FilenameUtils.separatorsToUnix(rendered);
    }
}
