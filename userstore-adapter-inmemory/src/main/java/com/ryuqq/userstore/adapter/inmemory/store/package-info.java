/**
 * In-memory UserRepository adapter package.
 *
 * <p>This package provides the reference implementation of the
 * {@link com.ryuqq.userstore.core.spi.UserRepository} SPI.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.userstore.adapter.inmemory.store.InMemoryUserRepository}:
 *       Map-backed user storage with delayed asynchronous lookup</li>
 *   <li>{@link com.ryuqq.userstore.adapter.inmemory.store.InMemoryUserRepositoryConfig}:
 *       Lookup delay setting</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>No transactions</li>
 * </ul>
 *
 * @see com.ryuqq.userstore.core.spi.UserRepository
 * @author User Store Team
 * @since 1.0.0
 */
package com.ryuqq.userstore.adapter.inmemory.store;
