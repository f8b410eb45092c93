package com.riansoft.pickup_vrp.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.riansoft.pickup_vrp.exception.UpstreamException;
import com.riansoft.pickup_vrp.model.RouteMatrixElement;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Routes API 행렬 응답 본문 파서.
 *
 * <p>응답은 JSON 배열 하나로 오기도 하고, 한 줄에 객체 하나씩 스트림으로 오기도 합니다.
 * 스트림은 대괄호/쉼표 줄이 섞여 있거나 XSSI 가드가 앞에 붙어 있을 수 있습니다.
 * 어느 형태든 같은 원소 목록으로 돌려줍니다.</p>
 */
public class RouteMatrixResponseParser {

    private static final String XSSI_GUARD = ")]}'";
    private static final int SNIPPET_LENGTH = 400;

    private final ObjectMapper objectMapper;

    public RouteMatrixResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<RouteMatrixElement> parse(String body) {
        String text = body == null ? "" : body.strip();
        if (text.isEmpty()) {
            return List.of();
        }
        if (text.startsWith("[")) {
            JsonNode array = readArrayOrNull(text);
            if (array != null) {
                return fromArray(array, text);
            }
        }
        if (text.startsWith("{")) {
            List<RouteMatrixElement> stream = readObjectStreamOrNull(text);
            if (stream != null) {
                return stream;
            }
        }
        return fromLines(text);
    }

    private JsonNode readArrayOrNull(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isArray() ? node : null;
        } catch (JsonProcessingException e) {
            // 온전한 배열이 아니면 줄 단위로 다시 읽음
            return null;
        }
    }

    private List<RouteMatrixElement> fromArray(JsonNode array, String text) {
        List<RouteMatrixElement> elements = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            failOnError(node, text);
            elements.add(toElement(node));
        }
        return elements;
    }

    private List<RouteMatrixElement> readObjectStreamOrNull(String text) {
        List<RouteMatrixElement> elements = new ArrayList<>();
        try (MappingIterator<JsonNode> values = objectMapper.readerFor(JsonNode.class).readValues(text)) {
            while (values.hasNextValue()) {
                JsonNode node = values.nextValue();
                if (!node.isObject()) {
                    return null;
                }
                failOnError(node, text);
                elements.add(toElement(node));
            }
        } catch (IOException e) {
            return null;
        }
        return elements;
    }

    private List<RouteMatrixElement> fromLines(String text) {
        List<RouteMatrixElement> elements = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String t = line.strip();
            if (t.isEmpty() || t.equals("[") || t.equals("]") || t.equals(",") || t.startsWith(XSSI_GUARD)) {
                continue;
            }
            if (t.endsWith(",")) {
                t = t.substring(0, t.length() - 1);
            }
            if (t.startsWith("[") && t.endsWith("]")) {
                elements.addAll(fromArray(readLine(t), t));
                continue;
            }
            if (t.startsWith("[")) {
                t = t.substring(1).strip();
            }
            if (t.endsWith("]")) {
                t = t.substring(0, t.length() - 1).strip();
            }
            JsonNode node = readLine(t);
            failOnError(node, t);
            elements.add(toElement(node));
        }
        return elements;
    }

    private JsonNode readLine(String line) {
        try {
            return objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Bad JSON line from Routes API: " + snippet(line, 160), false, e);
        }
    }

    private void failOnError(JsonNode node, String text) {
        if (node.has("error")) {
            throw new UpstreamException("Routes API error: " + snippet(text), false);
        }
    }

    private RouteMatrixElement toElement(JsonNode node) {
        // protobuf JSON은 0 값을 생략하므로 인덱스가 없으면 0
        int originIndex = node.path("originIndex").asInt(0);
        int destinationIndex = node.path("destinationIndex").asInt(0);
        String condition = node.hasNonNull("condition") ? node.get("condition").asText() : null;
        Double durationSeconds = node.hasNonNull("duration") ? parseDuration(node.get("duration")) : null;
        Long distanceMeters = node.hasNonNull("distanceMeters") ? node.get("distanceMeters").asLong() : null;
        return new RouteMatrixElement(originIndex, destinationIndex, condition, durationSeconds, distanceMeters);
    }

    private Double parseDuration(JsonNode duration) {
        if (duration.isNumber()) {
            return duration.asDouble();
        }
        String raw = duration.asText().strip();
        if (raw.endsWith("s")) {
            raw = raw.substring(0, raw.length() - 1);
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new UpstreamException("Unreadable duration from Routes API: " + duration.asText(), false, e);
        }
    }

    private static String snippet(String text) {
        return snippet(text, SNIPPET_LENGTH);
    }

    private static String snippet(String text, int length) {
        return text.length() <= length ? text : text.substring(0, length);
    }
}
