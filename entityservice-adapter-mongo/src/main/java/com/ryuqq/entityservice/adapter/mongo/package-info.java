/**
 * MongoDB document store adapter.
 *
 * <p>{@link com.ryuqq.entityservice.adapter.mongo.MongoConfig} reads the DB_* connection settings,
 * {@link com.ryuqq.entityservice.adapter.mongo.MongoConnection} owns the client and
 * {@link com.ryuqq.entityservice.adapter.mongo.MongoEntityStore} implements the store SPI per collection.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.entityservice.adapter.mongo;
