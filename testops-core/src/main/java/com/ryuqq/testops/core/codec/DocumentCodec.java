package com.ryuqq.testops.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.testops.core.model.Project;
import com.ryuqq.testops.core.model.ProjectDocument;

import java.io.IOException;
import java.util.List;

/**
 * 프로젝트 문서 JSON 코덱.
 *
 * <p>모든 저장소 어댑터가 같은 직렬화 규칙을 공유하도록 Jackson 설정을 한곳에 둡니다.</p>
 *
 * <ul>
 *   <li>시각은 ISO-8601 문자열</li>
 *   <li>알 수 없는 필드는 무시 (문서 최상위는 별도로 보존)</li>
 *   <li>알 수 없는 enum 값은 {@code @JsonEnumDefaultValue}로 대체</li>
 * </ul>
 *
 * <p>thread-safe 합니다.</p>
 *
 * @author TestOps Team
 * @since 1.0.0
 */
public final class DocumentCodec {

    private static final TypeReference<List<Project>> PROJECT_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public DocumentCodec() {
        this(true);
    }

    public DocumentCodec(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE)
            .build();
    }

    /**
     * 문서를 바이트로 직렬화.
     *
     * @param document 직렬화할 문서
     * @return UTF-8 JSON 바이트
     * @throws IllegalArgumentException document가 null이거나 직렬화에 실패한 경우
     */
    public byte[] encode(ProjectDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        return writeBytes(document);
    }

    /**
     * 바이트를 문서로 역직렬화.
     *
     * <p>빈 입력(공백만 있는 경우 포함)은 빈 문서로 취급합니다.</p>
     *
     * @param bytes JSON 바이트
     * @return 역직렬화된 문서
     * @throws IOException JSON 파싱에 실패한 경우 (손상된 문서)
     */
    public ProjectDocument decode(byte[] bytes) throws IOException {
        if (bytes == null || new String(bytes, java.nio.charset.StandardCharsets.UTF_8).isBlank()) {
            return ProjectDocument.empty();
        }
        ProjectDocument document = mapper.readValue(bytes, ProjectDocument.class);
        return document != null ? document : ProjectDocument.empty();
    }

    public byte[] encodeProjects(List<Project> projects) {
        return writeBytes(projects);
    }

    public List<Project> decodeProjects(byte[] bytes) throws IOException {
        if (bytes == null || bytes.length == 0) {
            return List.of();
        }
        JsonNode root = mapper.readTree(bytes);
        JsonNode projects = root.isArray() ? root : root.path("projects");
        if (projects.isMissingNode() || projects.isNull()) {
            return List.of();
        }
        return mapper.convertValue(projects, PROJECT_LIST);
    }

    /**
     * 깊은 복사. 직렬화 왕복으로 수행합니다.
     */
    public ProjectDocument copy(ProjectDocument document) {
        try {
            return decode(encode(document));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to copy document", e);
        }
    }

    /**
     * 임의 객체를 JSON 트리로 변환 (Run meta, Suite config 등).
     */
    public ObjectNode toObjectNode(Object value) {
        return mapper.valueToTree(value);
    }

    public <T> T fromObjectNode(ObjectNode node, Class<T> type) {
        return mapper.convertValue(node, type);
    }

    public JsonNode toTree(Object value) {
        return mapper.valueToTree(value);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    private byte[] writeBytes(Object value) {
        try {
            return prettyPrint
                ? mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value)
                : mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
