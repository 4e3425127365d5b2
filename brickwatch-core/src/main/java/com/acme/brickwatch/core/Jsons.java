package com.acme.brickwatch.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;

public final class Jsons {
  private static final ObjectMapper M = new ObjectMapper().registerModule(new JavaTimeModule());
  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  /** Reads a JSON array of strings; null or blank input yields an empty list. */
  public static List<String> toStringList(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return M.readValue(json, STRING_LIST);
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }
}
