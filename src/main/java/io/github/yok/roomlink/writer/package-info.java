/**
 * Writers for the records (JSON) and markup (XML) report formats.
 */
package io.github.yok.roomlink.writer;
