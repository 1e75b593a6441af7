/**
 * Configuration model package for RoomLink.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} (or equivalent
 * sources), such as connection settings, SQL artifact paths, load settings, and output naming.
 * </p>
 *
 * <p>
 * This package primarily holds configuration data; execution logic is implemented in {@code core}.
 * </p>
 */
package io.github.yok.roomlink.config;
