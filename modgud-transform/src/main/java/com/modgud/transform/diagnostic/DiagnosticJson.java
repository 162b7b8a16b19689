package com.modgud.transform.diagnostic;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.modgud.ast.SourceLocation;

import java.util.List;

/**
 * 把改写诊断序列化为 LSP 风格的 JSON（range / severity / source / code / message），
 * 供编辑器或构建工具展示出错位置。
 */
public final class DiagnosticJson {

    public static final int SEVERITY_ERROR = 1;
    public static final String SOURCE = "modgud";

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private DiagnosticJson() {
    }

    public static JsonObject toJsonObject(RewriteDiagnostic diagnostic) {
        JsonObject diag = new JsonObject();
        int line = 0, col = 0;
        SourceLocation location = diagnostic.getLocation();
        if (location != null) {
            line = Math.max(location.getLine() - 1, 0);
            col = Math.max(location.getColumn() - 1, 0);
            diag.addProperty("file", location.getFile());
        }
        diag.add("range", createRange(line, col, line, col + 1));
        diag.addProperty("severity", SEVERITY_ERROR);
        diag.addProperty("source", SOURCE);
        diag.addProperty("code", diagnostic.getKind().name());
        diag.addProperty("message", diagnostic.getMessage());
        if (diagnostic.getFunctionName() != null) {
            diag.addProperty("function", diagnostic.getFunctionName());
        }
        return diag;
    }

    public static String toJson(RewriteDiagnostic diagnostic) {
        return GSON.toJson(toJsonObject(diagnostic));
    }

    public static String toJson(List<RewriteDiagnostic> diagnostics) {
        JsonArray array = new JsonArray();
        for (RewriteDiagnostic diagnostic : diagnostics) {
            array.add(toJsonObject(diagnostic));
        }
        return GSON.toJson(array);
    }

    private static JsonObject createRange(int startLine, int startChar, int endLine, int endChar) {
        JsonObject range = new JsonObject();
        JsonObject start = new JsonObject();
        start.addProperty("line", startLine);
        start.addProperty("character", startChar);
        range.add("start", start);
        JsonObject end = new JsonObject();
        end.addProperty("line", endLine);
        end.addProperty("character", endChar);
        range.add("end", end);
        return range;
    }
}
