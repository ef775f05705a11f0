package sbhackathon.koala.goldenPath.provision;

/**
 * A GitHub REST call failed. {@code statusCode} is 0 when no HTTP response was received.
 */
public class GitHubApiException extends RuntimeException {

    private static final int UNPROCESSABLE_ENTITY = 422;

    private final int statusCode;
    private final String responseBody;

    public GitHubApiException(int statusCode, String message, String responseBody, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody == null ? "" : responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    /**
     * GitHub answers 422 for several validation errors; only the "name already exists" one means
     * the repository is there.
     */
    public boolean isAlreadyExists() {
        return statusCode == UNPROCESSABLE_ENTITY && responseBody.contains("already exists");
    }
}
