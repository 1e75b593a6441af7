/**
 * Core workflow of RoomLink.
 *
 * <p>
 * {@link io.github.yok.roomlink.core.ConnectionManager} owns the database session,
 * {@link io.github.yok.roomlink.core.SchemaProvisioner} creates the database and tables,
 * {@link io.github.yok.roomlink.core.DataLoader} loads JSON records and
 * {@link io.github.yok.roomlink.core.QueryExporter} builds indexes and exports query results.
 * {@link io.github.yok.roomlink.core.ReportPipeline} runs them in order.
 * </p>
 */
package io.github.yok.roomlink.core;
