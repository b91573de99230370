/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the storage interfaces that infrastructure adapters
 * implement for the application layer.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.userstore.core.spi.Repository} - Generic keyed lookup and insertion</li>
 *   <li>{@link com.ryuqq.userstore.core.spi.UserRepository} - User storage with count, delayed lookup and name search</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author User Store Team
 */
package com.ryuqq.userstore.core.spi;
