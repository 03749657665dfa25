/*
 * どこで: iTop 通知サービス層
 * 何を: core/get レスポンスの objects から fields を取り出す
 * なぜ: {objects:{<key>:{fields:{...}}}} の走査を各クエリで重複させないため
 */
package com.example.itop_notification.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

final class ItopObjects {

  private ItopObjects() {}

  static List<JsonNode> fields(JsonNode response) {
    final JsonNode objects = response == null ? null : response.get("objects");
    if (objects == null || !objects.isObject()) {
      // iTop は該当 0 件のとき objects を null で返す
      return List.of();
    }
    final List<JsonNode> result = new ArrayList<>();
    final Iterator<Map.Entry<String, JsonNode>> entries = objects.fields();
    while (entries.hasNext()) {
      final Map.Entry<String, JsonNode> entry = entries.next();
      final JsonNode fields = entry.getValue().get("fields");
      if (fields != null && fields.isObject()) {
        result.add(withKey(fields, entry.getValue()));
      }
    }
    return result;
  }

  static String text(JsonNode fields, String name) {
    final JsonNode value = fields.get(name);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.asText();
  }

  static boolean isEmptyReference(String value) {
    return value == null || value.isBlank() || "0".equals(value);
  }

  private static JsonNode withKey(JsonNode fields, JsonNode object) {
    // fields に id が含まれない場合は object の key を補う
    if (fields.hasNonNull("id") || !object.hasNonNull("key")) {
      return fields;
    }
    final ObjectNode copy = ((ObjectNode) fields).deepCopy();
    copy.put("id", object.get("key").asText());
    return copy;
  }
}
