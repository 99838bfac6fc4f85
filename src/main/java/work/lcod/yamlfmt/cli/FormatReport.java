package work.lcod.yamlfmt.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-file outcome of a {@code yamlfmt} run, printable as JSON.
 */
record FormatReport(List<FileResult> files, boolean check) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    FormatReport {
        files = List.copyOf(files);
    }

    int exitCode() {
        int code = 0;
        for (var file : files) {
            if (file.status() == Status.FAILED) {
                return Status.FAILED.exitCode();
            }
            if (check && file.status() == Status.CHANGED) {
                code = Status.CHANGED.exitCode();
            }
        }
        return code;
    }

    Map<String, Object> toSerializableMap() {
        var entries = new ArrayList<Map<String, Object>>();
        for (var file : files) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("file", file.file());
            entry.put("status", file.status().name().toLowerCase(Locale.ROOT));
            if (file.message() != null) {
                entry.put("message", file.message());
            }
            entries.add(entry);
        }
        var serializable = new LinkedHashMap<String, Object>();
        serializable.put("check", check);
        serializable.put("files", entries);
        serializable.put("exitCode", exitCode());
        return serializable;
    }

    String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    record FileResult(String file, Status status, String message) {
        static FileResult of(String file, Status status) {
            return new FileResult(file, status, null);
        }
    }

    enum Status {
        UNCHANGED(0),
        CHANGED(1),
        FAILED(2);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        int exitCode() {
            return exitCode;
        }
    }
}
