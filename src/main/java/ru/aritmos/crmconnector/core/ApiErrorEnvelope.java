package ru.aritmos.crmconnector.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Конверт ошибки CRM: {@code {"title": "...", "errors": [{"detail": "...", "field": "..."}]}}.
 * <p>
 * Используется только для построения сообщения; сырое тело ответа передаётся вызывающему отдельно.
 */
public record ApiErrorEnvelope(String title, List<FieldError> errors) {

    public ApiErrorEnvelope {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public record FieldError(String field, String detail) {
    }

    /**
     * Разобрать тело ответа. Для не-JSON тела возвращается конверт с текстом в {@code title}.
     */
    public static ApiErrorEnvelope parse(ObjectMapper objectMapper, String body) {
        if (body == null || body.isBlank()) {
            return new ApiErrorEnvelope(null, List.of());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            return new ApiErrorEnvelope(body.trim(), List.of());
        }
        if (root == null || !root.isObject()) {
            return new ApiErrorEnvelope(body.trim(), List.of());
        }
        String title = text(root, "title");
        if (title == null) {
            title = text(root, "errorMessage");
        }
        if (title == null) {
            title = text(root, "message");
        }
        List<FieldError> errors = new ArrayList<>();
        JsonNode arr = root.path("errors");
        if (arr.isArray()) {
            for (JsonNode e : arr) {
                if (e.isTextual()) {
                    errors.add(new FieldError(null, e.asText()));
                } else if (e.isObject()) {
                    String detail = text(e, "detail");
                    if (detail == null) {
                        detail = text(e, "message");
                    }
                    errors.add(new FieldError(text(e, "field"), detail == null ? e.toString() : detail));
                }
            }
        }
        return new ApiErrorEnvelope(title, errors);
    }

    /**
     * Сообщение вида {@code title: detail1, detail2}.
     */
    public String message(int httpStatus) {
        StringBuilder sb = new StringBuilder();
        if (title != null && !title.isBlank()) {
            sb.append(title.trim());
        }
        if (!errors.isEmpty()) {
            List<String> details = new ArrayList<>();
            for (FieldError e : errors) {
                details.add(e.field() == null ? e.detail() : e.field() + ": " + e.detail());
            }
            if (sb.length() > 0) {
                sb.append(": ");
            }
            sb.append(String.join(", ", details));
        }
        if (sb.length() == 0) {
            return "HTTP вызов завершился неуспешно: статус=" + httpStatus;
        }
        return sb.toString();
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || !v.isValueNode()) {
            return null;
        }
        String s = v.asText();
        return s.isBlank() ? null : s;
    }
}
