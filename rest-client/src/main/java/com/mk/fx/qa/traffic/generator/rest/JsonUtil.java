package com.mk.fx.qa.traffic.generator.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared Jackson mapper: lenient on read, compact on write. */
public final class JsonUtil {

  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
          .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS.mappedFeature())
          .enable(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature())
          .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES.mappedFeature())
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
          .serializationInclusion(JsonInclude.Include.ALWAYS)
          .addModule(new JavaTimeModule())
          .build();

  private JsonUtil() {
    throw new UnsupportedOperationException("JsonUtil cannot be instantiated");
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static String toJson(Object value) throws JsonProcessingException {
    return MAPPER.writeValueAsString(value);
  }
}
