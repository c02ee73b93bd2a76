/**
 * ApiManager 실행 보조 컴포넌트.
 *
 * <ul>
 *   <li>{@link com.ryuqq.apimanager.adapter.runner.DeferringApiManager} - quota 거부 시 대기 후 재시도</li>
 *   <li>{@link com.ryuqq.apimanager.adapter.runner.QuotaResyncScheduler} - 주기적 quota 재동기화</li>
 * </ul>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
package com.ryuqq.apimanager.adapter.runner;
