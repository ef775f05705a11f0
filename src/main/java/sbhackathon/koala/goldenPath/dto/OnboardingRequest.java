package sbhackathon.koala.goldenPath.dto;

public class OnboardingRequest {
    private String request;

    public OnboardingRequest() {
    }

    public OnboardingRequest(String request) {
        this.request = request;
    }

    public String getRequest() {
        return request;
    }

    public void setRequest(String request) {
        this.request = request;
    }
}
