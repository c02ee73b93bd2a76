package com.ryuqq.apimanager.testkit.client;

import com.ryuqq.apimanager.core.model.ApiRequest;
import com.ryuqq.apimanager.core.spi.ApiClient;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * 테스트용 {@link ApiClient}.
 *
 * <p>호출된 요청을 기록하고, responder 함수로 응답을 생성합니다.
 * {@link #failNext(RuntimeException)}로 다음 호출들의 실패를 예약할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * StubApiClient<String> client = new StubApiClient<>(request -> "OK " + request.endpoint());
 * client.failNext(new TransportFailureException("boom", 503));
 * }</pre>
 *
 * @param <T> 응답 타입
 * @author API Manager Team
 * @since 1.0.0
 */
public class StubApiClient<T> implements ApiClient<T> {

    private final Function<ApiRequest, T> responder;
    private final List<ApiRequest> requests = new CopyOnWriteArrayList<>();
    private final Deque<RuntimeException> scheduledFailures = new ArrayDeque<>();
    private volatile UnaryOperator<T> cacheMapper = UnaryOperator.identity();
    private volatile T failureCacheValue;

    public StubApiClient(Function<ApiRequest, T> responder) {
        if (responder == null) {
            throw new IllegalArgumentException("responder cannot be null");
        }
        this.responder = responder;
    }

    /**
     * endpoint를 그대로 응답하는 문자열 클라이언트.
     *
     * @return StubApiClient
     */
    public static StubApiClient<String> echo() {
        return new StubApiClient<>(request -> request.method() + " " + request.endpoint() + " " + request.params());
    }

    @Override
    public T request(ApiRequest request) {
        requests.add(request);
        RuntimeException failure;
        synchronized (scheduledFailures) {
            failure = scheduledFailures.poll();
        }
        if (failure != null) {
            throw failure;
        }
        return responder.apply(request);
    }

    @Override
    public T processResponseForCache(T response) {
        if (response == null) {
            return failureCacheValue;
        }
        return cacheMapper.apply(response);
    }

    /**
     * 다음 호출의 실패를 예약 (여러 번 호출 시 순서대로 소비).
     *
     * @param failure 던질 예외
     * @return this
     */
    public StubApiClient<T> failNext(RuntimeException failure) {
        synchronized (scheduledFailures) {
            scheduledFailures.add(failure);
        }
        return this;
    }

    /**
     * 성공 응답의 캐시 값 변환 함수 지정 (null 반환 시 캐시하지 않음).
     *
     * @param mapper 변환 함수
     * @return this
     */
    public StubApiClient<T> cacheMapper(UnaryOperator<T> mapper) {
        this.cacheMapper = mapper;
        return this;
    }

    /**
     * 실패한 호출에 대해 캐시할 값 지정.
     *
     * @param value 캐시 값 (null이면 캐시하지 않음)
     * @return this
     */
    public StubApiClient<T> failureCacheValue(T value) {
        this.failureCacheValue = value;
        return this;
    }

    public int callCount() {
        return requests.size();
    }

    public List<ApiRequest> requests() {
        return List.copyOf(requests);
    }
}
