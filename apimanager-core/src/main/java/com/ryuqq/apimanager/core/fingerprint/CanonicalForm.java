package com.ryuqq.apimanager.core.fingerprint;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 요청 값의 정규 문자열 표현.
 *
 * <p>모든 값은 타입 태그와 길이 접두사를 가진 토큰으로 인코딩되어,
 * 서로 다른 구조가 같은 문자열로 인코딩되지 않습니다.</p>
 *
 * <p><strong>인코딩 규칙:</strong></p>
 * <pre>
 * null              → n
 * CharSequence      → s{len}:{value}
 * Boolean           → b{len}:{value}
 * 정수 (Byte~BigInteger) → i{len}:{value}
 * 실수 (Float, Double, BigDecimal) → d{len}:{value}
 * Enum              → e{len}:{class}.{name}
 * Map               → m{size}{ (key value)* }   (key value) 쌍의 정규형 기준 정렬
 * Set               → u{size}[ value* ]          원소의 정규형 기준 정렬
 * List / 배열       → l{size}[ value* ]          순서 유지
 * 자기 참조          → o{len}:cycle:{class}
 * 기타              → o{len}:{class}:{toString}
 * </pre>
 *
 * <p>정수 폭은 무시되므로 {@code 1}과 {@code 1L} 키가 한 Map에 함께 있으면 정규형이 같은
 * 쌍이 둘 생깁니다. 쌍 단위로 정렬하므로 두 항목 모두 삽입 순서와 무관하게 인코딩됩니다.</p>
 *
 * @author API Manager Team
 * @since 1.0.0
 */
final class CanonicalForm {

    // Utility class - prevent instantiation
    private CanonicalForm() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 값의 정규형을 out에 추가.
     *
     * @param out 출력 버퍼
     * @param value 임의의 값 (null 허용)
     */
    static void append(StringBuilder out, Object value) {
        append(out, value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static String of(Object value, Set<Object> path) {
        StringBuilder out = new StringBuilder();
        append(out, value, path);
        return out.toString();
    }

    private static void append(StringBuilder out, Object value, Set<Object> path) {
        if (value == null) {
            out.append('n');
        } else if (value instanceof CharSequence) {
            token(out, 's', value.toString());
        } else if (value instanceof Boolean) {
            token(out, 'b', value.toString());
        } else if (isIntegral(value)) {
            token(out, 'i', value.toString());
        } else if (value instanceof BigDecimal decimal) {
            token(out, 'd', decimal.stripTrailingZeros().toPlainString());
        } else if (value instanceof Float || value instanceof Double) {
            token(out, 'd', value.toString());
        } else if (value instanceof Enum<?> constant) {
            token(out, 'e', constant.getDeclaringClass().getName() + "." + constant.name());
        } else if (isContainer(value)) {
            appendContainer(out, value, path);
        } else {
            // 정렬 불가능한 타입: 타입 태그 + toString 으로 대체
            token(out, 'o', value.getClass().getName() + ":" + value);
        }
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Byte
            || value instanceof Short
            || value instanceof Integer
            || value instanceof Long
            || value instanceof BigInteger;
    }

    private static boolean isContainer(Object value) {
        return value instanceof Map || value instanceof Collection || value.getClass().isArray();
    }

    private static void appendContainer(StringBuilder out, Object container, Set<Object> path) {
        // 현재 경로에 이미 있는 컨테이너는 다시 펼치지 않음
        if (!path.add(container)) {
            token(out, 'o', "cycle:" + container.getClass().getName());
            return;
        }
        try {
            if (container instanceof Map<?, ?> map) {
                appendMap(out, map, path);
            } else if (container instanceof Set<?> set) {
                appendSet(out, set, path);
            } else if (container instanceof Collection<?> collection) {
                appendSequence(out, new ArrayList<>(collection), path);
            } else {
                appendSequence(out, arrayToList(container), path);
            }
        } finally {
            path.remove(container);
        }
    }

    private static void token(StringBuilder out, char tag, String text) {
        out.append(tag).append(text.length()).append(':').append(text);
    }

    private static void appendMap(StringBuilder out, Map<?, ?> map, Set<Object> path) {
        List<String> entries = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            entries.add(of(entry.getKey(), path) + of(entry.getValue(), path));
        }
        Collections.sort(entries);
        out.append('m').append(entries.size()).append('{');
        entries.forEach(out::append);
        out.append('}');
    }

    private static void appendSet(StringBuilder out, Set<?> set, Set<Object> path) {
        List<String> elements = new ArrayList<>(set.size());
        for (Object element : set) {
            elements.add(of(element, path));
        }
        Collections.sort(elements);
        out.append('u').append(elements.size()).append('[');
        elements.forEach(out::append);
        out.append(']');
    }

    private static void appendSequence(StringBuilder out, List<?> elements, Set<Object> path) {
        out.append('l').append(elements.size()).append('[');
        for (Object element : elements) {
            append(out, element, path);
        }
        out.append(']');
    }

    private static List<Object> arrayToList(Object array) {
        int length = Array.getLength(array);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(array, i));
        }
        return elements;
    }
}
