/**
 * Root package of RoomLink.
 *
 * <p>
 * Provides a CLI that loads room and student records from JSON files into PostgreSQL and exports
 * the results of report queries as JSON or XML files.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.roomlink.config}: configuration models</li>
 * <li>{@code io.github.yok.roomlink.core}: connection handling, provisioning, load and export
 * workflow</li>
 * <li>{@code io.github.yok.roomlink.model}: entity kinds and query results</li>
 * <li>{@code io.github.yok.roomlink.writer}: output formats for query results</li>
 * </ul>
 */
package io.github.yok.roomlink;
