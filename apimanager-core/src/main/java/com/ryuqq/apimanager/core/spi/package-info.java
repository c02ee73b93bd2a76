/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators that integrators plug into the API Manager.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.apimanager.core.spi.ApiClient} - Live calls and cache-value shaping</li>
 *   <li>{@link com.ryuqq.apimanager.core.spi.ResponseCache} - Fingerprint → response storage</li>
 *   <li>{@link com.ryuqq.apimanager.core.spi.QuotaSynchronizer} - Quota resync from the remote service</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., apimanager-adapter-inmemory) and integrators provide concrete
 * implementations. {@code noop} holds the default {@code QuotaSynchronizer}.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any HTTP library or cache store</li>
 * </ul>
 *
 * @since 1.0.0
 * @author API Manager Team
 */
package com.ryuqq.apimanager.core.spi;
