package in.indicatorhub.infrastructure.provider;

/**
 * Exception thrown when the indicator provider answers with an error status.
 */
public class ProviderException extends RuntimeException {

    private final int statusCode;
    private final String providerMessage;
    private final String responseBody;

    public ProviderException(int statusCode, String providerMessage, String responseBody) {
        super(String.format("[HTTP %d] %s", statusCode, providerMessage));
        this.statusCode = statusCode;
        this.providerMessage = providerMessage;
        this.responseBody = responseBody;
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.providerMessage = message;
        this.responseBody = null;
    }

    /**
     * @return HTTP status, or 0 when the failure was not an HTTP response
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getProviderMessage() {
        return providerMessage;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
