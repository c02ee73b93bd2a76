package com.ryuqq.apimanager.core.fingerprint;

import com.ryuqq.apimanager.core.model.ApiRequest;
import com.ryuqq.apimanager.core.model.Fingerprint;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * SHA-256 기반 {@link Fingerprinter} 기본 구현.
 *
 * <p>method, endpoint, params, body (및 명시적으로 포함된 헤더)의 정규형을 하나의 문자열로 결합한 뒤
 * SHA-256 다이제스트를 소문자 16진수로 반환합니다. 다이제스트를 사용하므로 키 길이가 64자로 고정되고,
 * 캐시 저장소를 조회할 수 있는 경우에도 민감한 파라미터 값이 키에 노출되지 않습니다.</p>
 *
 * <p><strong>정규화:</strong></p>
 * <ul>
 *   <li>Map: 키 기준 정렬 (삽입 순서 무관)</li>
 *   <li>List / 배열: 순서 유지</li>
 *   <li>스칼라: 타입 태그 포함 ({@code "1"}과 {@code 1}은 다른 키)</li>
 *   <li>헤더: includedHeaders에 속한 이름만 포함, 이름은 대소문자 무시</li>
 * </ul>
 *
 * <p>Thread-safe: 상태를 갖지 않으며 호출마다 새 MessageDigest를 사용합니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
public final class CanonicalFingerprinter implements Fingerprinter {

    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final Set<String> includedHeaders;

    /**
     * 헤더를 포함하지 않는 Fingerprinter 생성.
     */
    public CanonicalFingerprinter() {
        this(Collections.emptySet());
    }

    /**
     * 지정한 헤더를 포함하는 Fingerprinter 생성.
     *
     * @param includedHeaders Fingerprint에 포함할 헤더 이름 (대소문자 무시)
     * @throws IllegalArgumentException includedHeaders가 null인 경우
     */
    public CanonicalFingerprinter(Set<String> includedHeaders) {
        if (includedHeaders == null) {
            throw new IllegalArgumentException("includedHeaders cannot be null");
        }
        this.includedHeaders = includedHeaders.stream()
            .map(name -> name.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Fingerprint fingerprint(ApiRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return Fingerprint.of(digest(canonicalize(request)));
    }

    /**
     * 요청의 정규 문자열 표현.
     *
     * @param request 논리 요청
     * @return 정규 문자열
     */
    String canonicalize(ApiRequest request) {
        StringBuilder out = new StringBuilder();
        CanonicalForm.append(out, request.method().name());
        CanonicalForm.append(out, request.endpoint());
        CanonicalForm.append(out, request.params());
        CanonicalForm.append(out, request.body());
        if (!includedHeaders.isEmpty()) {
            CanonicalForm.append(out, selectHeaders(request.headers()));
        }
        return out.toString();
    }

    /**
     * 포함 대상 헤더 이름 조회.
     *
     * @return 소문자 헤더 이름 집합
     */
    public Set<String> getIncludedHeaders() {
        return includedHeaders;
    }

    private Map<String, String> selectHeaders(Map<String, String> headers) {
        Map<String, String> selected = new TreeMap<>();
        for (Map.Entry<String, String> header : headers.entrySet()) {
            String name = header.getKey() == null ? "" : header.getKey().toLowerCase(Locale.ROOT);
            if (includedHeaders.contains(name)) {
                selected.put(name, header.getValue());
            }
        }
        return selected;
    }

    private static String digest(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance(DIGEST_ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // 모든 JRE는 SHA-256을 제공해야 함
            throw new IllegalStateException(DIGEST_ALGORITHM + " is not available", e);
        }
    }
}
