package com.yunhwan.loglens.domain.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 이벤트 트래킹 서비스가 준 이벤트 한 건에 대한 읽기 전용 뷰.
 * <p>
 * 원본 레코드는 필드 구성이 이벤트마다 다르다. 실제로 쓰는 필드만 Optional 로 꺼내고,
 * 나머지는 검증하지 않는다. 생성 시 deep copy 하므로 이후 원본이 바뀌어도 영향이 없다.
 */
public final class RawEvent {

    private final JsonNode node;

    private RawEvent(JsonNode node) {
        this.node = node;
    }

    public static RawEvent of(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new RawEvent(JsonNodeFactory.instance.objectNode());
        }
        return new RawEvent(node.deepCopy());
    }

    public Optional<String> id() {
        return text(node, "id");
    }

    /**
     * dateCreated 우선, 없으면 datetime.
     */
    public Optional<String> timestamp() {
        return text(node, "dateCreated").or(() -> text(node, "datetime"));
    }

    public Optional<String> type() {
        return text(node, "type");
    }

    public Optional<String> title() {
        return text(node, "title");
    }

    public Optional<String> message() {
        return text(node, "message");
    }

    public Optional<String> metadataType() {
        return text(node.path("metadata"), "type");
    }

    public Optional<String> metadataValue() {
        return text(node.path("metadata"), "value");
    }

    /**
     * entries[] 중 type 이 일치하는 항목들의 data.values 를 순서대로 이어 붙여 돌려준다.
     */
    public List<JsonNode> entryValues(String entryType) {
        JsonNode entries = node.path("entries");
        if (!entries.isArray()) return List.of();

        List<JsonNode> out = new ArrayList<>();
        for (JsonNode entry : entries) {
            if (!entryType.equals(entry.path("type").asText(null))) continue;
            JsonNode values = entry.path("data").path("values");
            if (!values.isArray()) continue;
            values.forEach(out::add);
        }
        return Collections.unmodifiableList(out);
    }

    public List<Tag> tags() {
        JsonNode tags = node.path("tags");
        if (!tags.isArray()) return List.of();

        List<Tag> out = new ArrayList<>();
        for (JsonNode t : tags) {
            Optional<String> key = text(t, "key");
            if (key.isEmpty()) continue;
            out.add(new Tag(key.get(), text(t, "value").orElse("")));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * 식별 가능한 정보가 하나라도 있는지.
     */
    public boolean hasIdentifyingData() {
        return id().isPresent() || timestamp().isPresent() || type().isPresent()
                || title().isPresent() || message().isPresent()
                || metadataType().isPresent() || metadataValue().isPresent();
    }

    /**
     * 문자열/숫자/불리언 값만 텍스트로 인정한다. 빈 문자열은 없는 것으로 본다.
     */
    public static Optional<String> text(JsonNode parent, String field) {
        if (parent == null) return Optional.empty();
        JsonNode v = parent.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) return Optional.empty();
        String s = v.asText();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    @Override
    public String toString() {
        return "RawEvent{id=" + id().orElse("-") + "}";
    }

    public record Tag(String key, String value) {}
}
