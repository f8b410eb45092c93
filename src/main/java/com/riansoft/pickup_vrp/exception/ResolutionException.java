package com.riansoft.pickup_vrp.exception;

/**
 * 주소를 좌표로 바꾸지 못함
 */
public class ResolutionException extends RoutingException {

    private final String address;
    private final String providerStatus;
    private final boolean retryable;

    public ResolutionException(String address, String providerStatus, boolean retryable, String message) {
        super("RESOLUTION_FAILED", message);
        this.address = address;
        this.providerStatus = providerStatus;
        this.retryable = retryable;
    }

    public ResolutionException(String address, String providerStatus, boolean retryable, String message, Throwable cause) {
        super("RESOLUTION_FAILED", message, cause);
        this.address = address;
        this.providerStatus = providerStatus;
        this.retryable = retryable;
    }

    public String getAddress() { return address; }
    public String getProviderStatus() { return providerStatus; }
    public boolean isRetryable() { return retryable; }
}
