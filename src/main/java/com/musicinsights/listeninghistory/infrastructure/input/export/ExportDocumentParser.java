package com.musicinsights.listeninghistory.infrastructure.input.export;

import com.musicinsights.listeninghistory.application.common.error.ExportParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * 내보내기 JSON 문서 하나를 {@link StreamingHistoryRaw} 목록으로 변환합니다.
 * <p>
 * 허용하는 최상위 구조는 항목 배열, 또는 {@code data} 배열을 가진 객체입니다.
 * 그 외 구조는 오류가 아니라 "기여분 0건"으로 취급합니다.
 */
@Component
public class ExportDocumentParser {

    private static final Logger log = LoggerFactory.getLogger(ExportDocumentParser.class);

    /** JSON → 트리/DTO 변환용 ObjectMapper */
    private final ObjectMapper mapper;

    public ExportDocumentParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 문서를 파싱합니다.
     *
     * @param name  파일 이름(로그/예외 메시지용)
     * @param bytes 문서 내용(UTF-8 JSON)
     * @return 원본 항목 목록(인식할 수 없는 구조이면 빈 목록)
     * @throws ExportParseException JSON 자체를 읽을 수 없는 경우
     */
    public List<StreamingHistoryRaw> parse(String name, byte[] bytes) {
        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (RuntimeException e) {
            throw new ExportParseException(name, e);
        }

        JsonNode items = itemsOf(root);
        if (items == null) {
            log.warn("Skipping {}: unrecognized document shape", name);
            return List.of();
        }

        List<StreamingHistoryRaw> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            JsonNode item = items.get(i);
            if (item == null || !item.isObject()) continue;
            try {
                out.add(mapper.treeToValue(item, StreamingHistoryRaw.class));
            } catch (RuntimeException e) {
                throw new ExportParseException(name, e);
            }
        }
        return out;
    }

    private static JsonNode itemsOf(JsonNode root) {
        if (root == null) return null;
        if (root.isArray()) return root;
        if (root.isObject()) {
            JsonNode data = root.get("data");
            if (data != null && data.isArray()) return data;
        }
        return null;
    }
}
