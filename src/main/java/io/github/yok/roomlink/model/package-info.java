/**
 * Entity kinds, column bindings and query results.
 */
package io.github.yok.roomlink.model;
