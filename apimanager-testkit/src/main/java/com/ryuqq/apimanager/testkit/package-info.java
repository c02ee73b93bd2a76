/**
 * Test support for API Manager adapters and integrations.
 *
 * <ul>
 *   <li>{@code clock} - {@link com.ryuqq.apimanager.testkit.clock.ManualQuotaClock} for deterministic window tests</li>
 *   <li>{@code client} - {@link com.ryuqq.apimanager.testkit.client.StubApiClient}, a recording client with failure injection</li>
 *   <li>{@code cache} - {@link com.ryuqq.apimanager.testkit.cache.FaultyResponseCache}, a reference cache with fault injection</li>
 *   <li>{@code contract} - {@link com.ryuqq.apimanager.testkit.contract.AbstractResponseCacheContractTest}</li>
 * </ul>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
package com.ryuqq.apimanager.testkit;
