/**
 * Utility package for RoomLink.
 *
 * <p>
 * Provides stateless helpers used across the project: SQL script splitting, timestamp parsing,
 * log rendering of paths and credentials, and fatal error reporting.
 * </p>
 */
package io.github.yok.roomlink.util;
