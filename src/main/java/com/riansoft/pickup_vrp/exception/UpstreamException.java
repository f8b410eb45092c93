package com.riansoft.pickup_vrp.exception;

/**
 * 행렬 제공자(Routes API) 호출 실패. 요청 거부, 읽을 수 없는 응답, 연결 불가를 모두 포함합니다.
 */
public class UpstreamException extends RoutingException {

    private final boolean retryable;

    public UpstreamException(String message, boolean retryable) {
        super("UPSTREAM_FAILED", message);
        this.retryable = retryable;
    }

    public UpstreamException(String message, boolean retryable, Throwable cause) {
        super("UPSTREAM_FAILED", message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
