package tech.rolesync.engine.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import tech.rolesync.engine.errors.EngineException;
import tech.rolesync.engine.exec.OperationResult;
import tech.rolesync.engine.exec.OperationStatus;
import tech.rolesync.engine.plan.EntityType;

import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link RunReport} as text, JSON or YAML.
 */
@ApplicationScoped
public class ReportRenderer {

    private final ObjectMapper json;
    private final ObjectMapper yaml;

    public ReportRenderer() {
        this.json = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
        this.yaml = new YAMLMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String render(RunReport report, OutputFormat format) {
        return switch (format) {
            case TEXT -> text(report);
            case JSON -> write(json, report);
            case YAML -> write(yaml, report);
        };
    }

    private String write(ObjectMapper mapper, RunReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new EngineException("Failed to render report " + report.runId(), e);
        }
    }

    private String text(RunReport report) {
        StringBuilder out = new StringBuilder();
        out.append("Reconciliation Results\n");
        out.append("======================\n\n");
        out.append("Run: ").append(report.runId()).append('\n');
        out.append("Status: ").append(report.success() ? "SUCCESS" : "FAILED");
        if (report.cancelled()) {
            out.append(" (cancelled)");
        } else if (report.abortReason() != null) {
            out.append(" (aborted: ").append(report.abortReason()).append(')');
        }
        out.append('\n');
        out.append("Duration: ").append(report.durationMillis()).append(" ms\n");
        out.append("Dry Run: ").append(report.dryRun()).append('\n');
        out.append("Cleanup: ").append(report.cleanup()).append("\n\n");

        out.append("Summary:\n");
        for (EntityType type : EntityType.values()) {
            EntityCounts c = report.countsFor(type);
            out.append(String.format(Locale.ROOT,
                "  %s: %d created, %d updated, %d deleted, %d unchanged",
                capitalize(type.label()), c.created(), c.updated(), c.deleted(), c.unchanged()));
            appendIfPositive(out, c.protectedCount(), "protected");
            appendIfPositive(out, c.wouldRemove(), "would remove");
            appendIfPositive(out, c.skipped(), "skipped");
            appendIfPositive(out, c.failed(), "failed");
            appendIfPositive(out, c.blocked(), "blocked");
            out.append('\n');
        }
        out.append('\n');

        if (!report.failures().isEmpty()) {
            out.append("Errors:\n");
            for (OperationResult r : report.failures()) {
                out.append("  - ").append(r.ref()).append(": ").append(r.errorMessage());
                if (r.errorKind() != null) {
                    out.append(" [").append(r.errorKind()).append(']');
                }
                out.append('\n');
            }
            out.append('\n');
        }

        appendItems(out, "Protected", report.protectedItems());
        appendItems(out, "Would remove (cleanup disabled)", report.wouldRemove());
        appendItems(out, "Skipped", report.skipped());

        if (!report.operations().isEmpty()) {
            out.append("Operations:\n");
            for (OperationResult r : report.operations()) {
                String mark = r.isFailure() ? "✗" : "✓";
                out.append("  ").append(mark).append(' ')
                    .append(r.entityType().label()).append(' ')
                    .append(r.kind().name().toLowerCase(Locale.ROOT)).append(' ')
                    .append(r.ref().key()).append(" - ").append(r.summary());
                if (r.status() == OperationStatus.SIMULATED) {
                    out.append(" (dry run)");
                } else if (r.status() == OperationStatus.BLOCKED) {
                    out.append(" (blocked)");
                }
                out.append('\n');
            }
        }
        return out.toString();
    }

    private static void appendItems(StringBuilder out, String title, List<ReportItem> items) {
        if (items.isEmpty()) {
            return;
        }
        out.append(title).append(":\n");
        for (ReportItem item : items) {
            out.append("  - ").append(item.entityType().label()).append(' ').append(item.key())
                .append(": ").append(item.reason()).append('\n');
        }
        out.append('\n');
    }

    private static void appendIfPositive(StringBuilder out, int count, String label) {
        if (count > 0) {
            out.append(", ").append(count).append(' ').append(label);
        }
    }

    private static String capitalize(String label) {
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }
}
