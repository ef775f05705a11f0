package sbhackathon.koala.goldenPath.common;

public enum ErrorType {
    PRECONDITION("Missing credential, template root or cluster access"),
    PROVISION("Repository could not be created or resolved"),
    RENDER("Template missing or placeholder unresolved"),
    PUBLISH("Rendered tree could not be committed or pushed"),
    REGISTRATION("Deployment descriptor could not be applied");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
