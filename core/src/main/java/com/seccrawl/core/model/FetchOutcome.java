package com.seccrawl.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** RequestExecutor 결과: Success 또는 Failure 중 정확히 하나. */
public interface FetchOutcome {

    int attempts();

    default boolean isSuccess() { return this instanceof Success; }

    /**
     * @param finalUrl 리다이렉트 이후 실제 응답 URL(상대 링크 해석 기준)
     */
    record Success(int status, Map<String, List<String>> headers, String body, URI finalUrl, int attempts)
            implements FetchOutcome {
        public Success {
            headers = (headers == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
            body = (body == null) ? "" : body;
            Objects.requireNonNull(finalUrl, "finalUrl");
        }
    }

    /** @param lastError 마지막 시도의 실패 사유(로그용) */
    record Failure(FailureKind kind, int attempts, String lastError) implements FetchOutcome {
        public Failure {
            Objects.requireNonNull(kind, "kind");
        }
    }
}
