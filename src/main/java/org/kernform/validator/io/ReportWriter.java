package org.kernform.validator.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.kernform.validator.api.BoundCall;
import org.kernform.validator.api.ValidationReport;
import org.kernform.validator.binding.BoundArgument;
import org.kernform.validator.diagnostics.Diagnostic;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a {@link ValidationReport} for the reporting layer, as plain text or as JSON.
 */
public class ReportWriter {

    /**
     * The supported output formats.
     */
    public enum Format {
        TEXT,
        JSON
    }

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    /**
     * Writes the report.
     * @param report The report.
     * @param format The output format.
     * @param out Where to write to.
     */
    public void write(ValidationReport report, Format format, PrintWriter out) {
        if (format == Format.JSON) {
            out.println(gson.toJson(toJsonTree(report)));
        } else {
            writeText(report, out);
        }
        out.flush();
    }

    private void writeText(ValidationReport report, PrintWriter out) {
        for (Diagnostic diagnostic : report.diagnostics()) {
            out.println(diagnostic);
        }
        for (BoundCall call : report.boundCalls()) {
            String mapping = call.binding().mapping().stream()
                    .map(b -> b.actual().name() + "->" + b.formal().signature())
                    .collect(Collectors.joining(", "));
            out.printf("[BOUND] %s#%d: %s(%s)%n", call.invokeName(), call.callIndex(),
                    call.binding().contract().name(), mapping);
        }
        out.printf("Unit '%s': %d error(s), %d warning(s), %d call(s) bound.%n",
                report.unitName(), report.errorCount(), report.warningCount(), report.boundCalls().size());
    }

    private Map<String, Object> toJsonTree(ValidationReport report) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("unit", report.unitName());
        root.put("errors", report.errorCount());
        root.put("warnings", report.warningCount());

        List<Map<String, Object>> diagnostics = new ArrayList<>();
        for (Diagnostic d : report.diagnostics()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("severity", d.type().name());
            entry.put("code", d.code().name());
            entry.put("subject", d.subject());
            if (d.hasArgumentIndex()) {
                entry.put("argumentIndex", d.argumentIndex());
            }
            if (d.expected() != null) {
                entry.put("expected", d.expected());
            }
            if (d.actual() != null) {
                entry.put("actual", d.actual());
            }
            if (!d.candidates().isEmpty()) {
                entry.put("candidates", d.candidates());
            }
            entry.put("message", d.message());
            diagnostics.add(entry);
        }
        root.put("diagnostics", diagnostics);

        List<Map<String, Object>> bound = new ArrayList<>();
        for (BoundCall call : report.boundCalls()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("invoke", call.invokeName());
            entry.put("call", call.callIndex());
            entry.put("kernel", call.binding().contract().name());
            List<Map<String, Object>> mapping = new ArrayList<>();
            for (BoundArgument arg : call.binding().mapping()) {
                Map<String, Object> pair = new LinkedHashMap<>();
                pair.put("index", arg.index());
                pair.put("formal", arg.formal().signature());
                pair.put("actual", arg.actual().name());
                mapping.add(pair);
            }
            entry.put("mapping", mapping);
            bound.add(entry);
        }
        root.put("boundCalls", bound);
        root.put("rejectedContracts", new ArrayList<>(report.rejectedContracts()));
        return root;
    }
}
