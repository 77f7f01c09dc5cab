/**
 * MongoDB integration for the query cost engine.
 *
 * <p>{@link com.ormcost.adapter.mongodb.MongoQueryListener} is a driver {@code CommandListener}
 * that turns each command round-trip into a query event. Register it on the client settings:
 *
 * <pre>{@code
 * MongoClientSettings settings = MongoClientSettings.builder()
 *         .applyConnectionString(new ConnectionString(uri))
 *         .addCommandListener(new MongoQueryListener(engine, ExecutionContextResolver.perThread()))
 *         .build();
 * }</pre>
 *
 * <h2>Declared Fields</h2>
 *
 * <ul>
 *   <li>{@code find} with an inclusion projection - the projected fields, plus {@code _id} unless excluded</li>
 *   <li>{@code find} without projection or with an exclusion projection - unknown</li>
 *   <li>every other command - unknown</li>
 * </ul>
 *
 * <h2>Cursor Batches</h2>
 *
 * <p>Large results arrive in several batches. Each {@code getMore} adds its time to the
 * {@code find} or {@code aggregate} that opened the cursor, so one logical read stays one query.
 */
package com.ormcost.adapter.mongodb;
