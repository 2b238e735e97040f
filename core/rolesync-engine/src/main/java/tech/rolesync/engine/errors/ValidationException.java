package tech.rolesync.engine.errors;

import java.util.List;

/**
 * The desired state is invalid. Thrown before any network access.
 */
public class ValidationException extends EngineException {

    private final List<Violation> violations;

    public ValidationException(List<Violation> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of();
    }

    public List<Violation> getViolations() {
        return violations;
    }

    private static String buildMessage(List<Violation> violations) {
        StringBuilder sb = new StringBuilder("Desired state has ")
            .append(violations.size())
            .append(violations.size() == 1 ? " violation" : " violations");
        for (Violation v : violations) {
            sb.append("\n  - ").append(v);
        }
        return sb.toString();
    }
}
