package com.riansoft.pickup_vrp.exception;

/**
 * 행렬 생성과 경로 최적화에서 호출자에게 알리는 오류의 공통 부모. {@code code}는 응답 본문에 그대로 실립니다.
 */
public abstract class RoutingException extends RuntimeException {

    private final String code;

    protected RoutingException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected RoutingException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
