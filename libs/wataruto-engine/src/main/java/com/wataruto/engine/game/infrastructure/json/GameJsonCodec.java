package com.wataruto.engine.game.infrastructure.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wataruto.engine.game.domain.dto.GameRecord;
import com.wataruto.engine.game.domain.dto.GameSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 棋谱与快照的 JSON 读写。
 * <p>
 * 容器里有 ObjectMapper 就用它，没有就用自己的一份。
 * 格式错误统一抛 IllegalArgumentException，cause 为 Jackson 原始异常。
 */
@Slf4j
@Component
public class GameJsonCodec {

    private final ObjectMapper objectMapper;

    @Autowired
    public GameJsonCodec(ObjectProvider<ObjectMapper> objectMapperProvider) {
        this(objectMapperProvider.getIfAvailable(GameJsonCodec::defaultMapper));
    }

    public GameJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String writeRecord(GameRecord record) {
        return write(record);
    }

    public GameRecord readRecord(String json) {
        return read(json, GameRecord.class);
    }

    public String writeSnapshot(GameSnapshot snapshot) {
        return write(snapshot);
    }

    public GameSnapshot readSnapshot(String json) {
        return read(json, GameSnapshot.class);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("empty " + type.getSimpleName() + " json");
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable {} json: {}", type.getSimpleName(), e.getOriginalMessage());
            throw new IllegalArgumentException("malformed " + type.getSimpleName() + " json", e);
        }
    }
}
