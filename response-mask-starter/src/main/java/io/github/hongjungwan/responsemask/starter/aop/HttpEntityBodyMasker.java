package io.github.hongjungwan.responsemask.starter.aop;

import org.springframework.http.HttpEntity;
import org.springframework.http.ResponseEntity;

import java.util.function.UnaryOperator;

/**
 * HttpEntity 반환값 처리. 엔티티 자체가 아닌 본문만 마스킹하고 상태 코드와 헤더는 유지.
 *
 * spring-web이 클래스패스에 있을 때만 로드됨.
 */
final class HttpEntityBodyMasker {

    private HttpEntityBodyMasker() {}

    /** ResponseEntity 또는 HttpEntity 자체인지 여부 (RequestEntity 등 다른 하위 타입 제외) */
    static boolean supports(Object value) {
        return value instanceof ResponseEntity<?> || (value != null && value.getClass() == HttpEntity.class);
    }

    static Object maskBody(Object value, UnaryOperator<Object> bodyMasker) {
        HttpEntity<?> entity = (HttpEntity<?>) value;
        if (!entity.hasBody()) {
            return entity;
        }

        Object body = bodyMasker.apply(entity.getBody());
        if (entity instanceof ResponseEntity<?> response) {
            return new ResponseEntity<>(body, response.getHeaders(), response.getStatusCode());
        }
        return new HttpEntity<>(body, entity.getHeaders());
    }
}
