package sbhackathon.koala.goldenPath.dto;

import sbhackathon.koala.goldenPath.pipeline.OnboardingReport;

public class OnboardingResponse {
    private String message;
    private String status;
    private OnboardingReport report;

    public OnboardingResponse() {
    }

    public OnboardingResponse(String message, String status, OnboardingReport report) {
        this.message = message;
        this.status = status;
        this.report = report;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public OnboardingReport getReport() {
        return report;
    }

    public void setReport(OnboardingReport report) {
        this.report = report;
    }
}
