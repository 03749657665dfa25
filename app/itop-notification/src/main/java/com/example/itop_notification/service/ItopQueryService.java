/*
 * どこで: iTop 通知サービス層
 * 何を: 通知検出が使う固定の OQL 問い合わせ(チケット ID/チーム/人名/プロファイル/変更ログ)をまとめる
 * なぜ: クエリ語彙を 1 か所に閉じ込め、読み取り頻度の高い結果を TTL キャッシュで共有するため
 */
package com.example.itop_notification.service;

import com.example.itop_notification.config.ItopCacheProperties;
import com.example.itop_notification.model.DeadlineKind;
import com.example.itop_notification.model.Team;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ItopQueryService {

  private static final Logger logger = LoggerFactory.getLogger(ItopQueryService.class);

  static final List<String> TICKET_CLASSES = List.of("UserRequest", "Incident");
  static final String SCALAR_CHANGE_CLASS = "CMDBChangeOpSetAttributeScalar";
  static final String CASE_LOG_CHANGE_CLASS = "CMDBChangeOpSetAttributeCaseLog";
  private static final String SCALAR_CHANGE_FIELDS =
      "objkey,objclass,attcode,oldvalue,newvalue,date,userinfo,user_id";
  private static final String CASE_LOG_CHANGE_FIELDS =
      "objkey,objclass,attcode,lastentry,date,userinfo,user_id";
  private static final String OPEN_TICKET = "status NOT IN ('resolved','closed')";

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final TypeReference<List<Team>> TEAM_LIST = new TypeReference<>() {};

  private final ItopClient itopClient;
  private final TtlCache cache;
  private final ItopCacheProperties cacheProperties;

  /** Open tickets (any class) the person is the assigned agent of. */
  public List<String> agentTicketIds(String userId, String personId) {
    final String cacheKey = "ticket_ids:agent:" + userId;
    final Optional<List<String>> cached = cache.get(cacheKey, STRING_LIST);
    if (cached.isPresent()) {
      return cached.get();
    }
    final List<String> ids =
        ticketIds("agent_id = " + requireNumeric(personId) + " AND " + OPEN_TICKET);
    cache.set(cacheKey, ids, cacheProperties.ticketIdsTtl());
    return ids;
  }

  /** Tickets the person submitted; resolved ones stay visible so the transition itself is seen. */
  public List<String> callerTicketIds(String userId, String personId) {
    final String cacheKey = "ticket_ids:caller:" + userId;
    final Optional<List<String>> cached = cache.get(cacheKey, STRING_LIST);
    if (cached.isPresent()) {
      return cached.get();
    }
    final List<String> ids =
        ticketIds("caller_id = " + requireNumeric(personId) + " AND status != 'closed'");
    cache.set(cacheKey, ids, cacheProperties.ticketIdsTtl());
    return ids;
  }

  public List<Team> userTeams(String userId, String personId) {
    final String cacheKey = "teams:" + userId;
    final Optional<List<Team>> cached = cache.get(cacheKey, TEAM_LIST);
    if (cached.isPresent()) {
      return cached.get();
    }
    final JsonNode response =
        itopClient.request(
            coreGet(
                "lnkPersonToTeam",
                "SELECT lnkPersonToTeam WHERE person_id = " + requireNumeric(personId),
                "team_id,team_name"));
    final Map<String, Team> teams = new LinkedHashMap<>();
    for (JsonNode fields : ItopObjects.fields(response)) {
      final String teamId = ItopObjects.text(fields, "team_id");
      if (ItopObjects.isEmptyReference(teamId)) {
        continue;
      }
      final String name = ItopObjects.text(fields, "team_name");
      teams.putIfAbsent(teamId, new Team(teamId, name == null ? "Team #" + teamId : name));
    }
    final List<Team> result = List.copyOf(teams.values());
    cache.set(cacheKey, result, cacheProperties.teamsTtl());
    return result;
  }

  /** Resolves person ids to display names; unknown ids are absent from the result. */
  public Map<String, String> personNames(Collection<String> personIds) {
    final Map<String, String> names = new LinkedHashMap<>();
    final Set<String> missing = new LinkedHashSet<>();
    for (String personId : personIds) {
      if (ItopObjects.isEmptyReference(personId) || names.containsKey(personId)) {
        continue;
      }
      final Optional<String> cached = cache.get("person_name:" + personId, String.class);
      if (cached.isPresent()) {
        names.put(personId, cached.get());
      } else {
        missing.add(personId);
      }
    }
    if (missing.isEmpty()) {
      return names;
    }
    final String idList = numericList(missing);
    final JsonNode response =
        itopClient.request(
            coreGet("Person", "SELECT Person WHERE id IN (" + idList + ")", "id,friendlyname"));
    for (JsonNode fields : ItopObjects.fields(response)) {
      final String id = ItopObjects.text(fields, "id");
      final String name = ItopObjects.text(fields, "friendlyname");
      if (id != null && name != null) {
        names.put(id, name);
        cache.set("person_name:" + id, name, cacheProperties.personNamesTtl());
      }
    }
    return names;
  }

  public Optional<String> findItopUserIdByPerson(String personId) {
    final JsonNode response =
        itopClient.request(
            coreGet(
                "User", "SELECT User WHERE contactid = " + requireNumeric(personId), "id,login"));
    return ItopObjects.fields(response).stream()
        .map(fields -> ItopObjects.text(fields, "id"))
        .filter(id -> !ItopObjects.isEmptyReference(id))
        .findFirst();
  }

  /**
   * profile_list を名前の一覧として返す。
   *
   * <p>iTop はリンクオブジェクトの配列で返すが、カンマ区切り文字列で返す構成にも対応する。
   */
  public List<String> userProfiles(String itopUserId) {
    final Map<String, Object> params = new LinkedHashMap<>();
    params.put("operation", "core/get");
    params.put("class", "User");
    params.put("key", requireNumeric(itopUserId));
    params.put("output_fields", "id,login,profile_list");
    final List<JsonNode> users = ItopObjects.fields(itopClient.request(params));
    if (users.isEmpty()) {
      throw new ItopIntegrationException(
          ItopIntegrationException.Reason.NOT_FOUND, "itop user not found id=" + itopUserId);
    }
    return parseProfileList(users.get(0).get("profile_list"));
  }

  /** Raw change-log rows of one CMDBChangeOp class for the objects, attributes and lower bound. */
  public List<JsonNode> changeOps(
      String changeClass,
      Collection<String> objectIds,
      Collection<String> attributeCodes,
      String since) {
    final String oql =
        "SELECT "
            + changeClass
            + " WHERE objkey IN ("
            + numericList(objectIds)
            + ") AND objclass IN ("
            + quoted(TICKET_CLASSES)
            + ") AND attcode IN ("
            + quoted(attributeCodes)
            + ") AND date >= '"
            + since
            + "'";
    final String outputFields =
        CASE_LOG_CHANGE_CLASS.equals(changeClass) ? CASE_LOG_CHANGE_FIELDS : SCALAR_CHANGE_FIELDS;
    return ItopObjects.fields(itopClient.request(coreGet(changeClass, oql, outputFields)));
  }

  /** Open tickets of the teams that no agent owns yet, with their team and creation date. */
  public List<JsonNode> unassignedTeamTickets(Collection<String> teamIds) {
    if (teamIds.isEmpty()) {
      return List.of();
    }
    final String condition =
        "team_id IN ("
            + numericList(teamIds)
            + ") AND agent_id = 0 AND "
            + OPEN_TICKET;
    return tickets(condition, "id,team_id,start_date");
  }

  /** Open tickets with the deadline field set, unowned in the teams or assigned to the person. */
  public List<JsonNode> deadlineCandidates(
      DeadlineKind kind, Collection<String> teamIds, String personId) {
    final String condition;
    if (teamIds != null) {
      if (teamIds.isEmpty()) {
        return List.of();
      }
      condition =
          "team_id IN ("
              + numericList(teamIds)
              + ") AND agent_id = 0";
    } else {
      condition = "agent_id = " + requireNumeric(personId);
    }
    return tickets(
        condition + " AND " + OPEN_TICKET + " AND " + kind.deadlineField() + " != ''",
        "id,ref," + kind.deadlineField());
  }

  private List<String> ticketIds(String condition) {
    return tickets(condition, "id").stream()
        .map(fields -> ItopObjects.text(fields, "id"))
        .filter(id -> !ItopObjects.isEmptyReference(id))
        .distinct()
        .toList();
  }

  private List<JsonNode> tickets(String condition, String outputFields) {
    final List<JsonNode> result = new ArrayList<>();
    for (String ticketClass : TICKET_CLASSES) {
      final JsonNode response =
          itopClient.request(
              coreGet(ticketClass, "SELECT " + ticketClass + " WHERE " + condition, outputFields));
      for (JsonNode fields : ItopObjects.fields(response)) {
        result.add(withClass(fields, ticketClass));
      }
    }
    logger.debug("itop ticket query condition={} found={}", condition, result.size());
    return result;
  }

  private static JsonNode withClass(JsonNode fields, String ticketClass) {
    if (fields.hasNonNull("finalclass") || !fields.isObject()) {
      return fields;
    }
    final ObjectNode copy = ((ObjectNode) fields).deepCopy();
    copy.put("finalclass", ticketClass);
    return copy;
  }

  private static Map<String, Object> coreGet(String itopClass, String key, String outputFields) {
    final Map<String, Object> params = new LinkedHashMap<>();
    params.put("operation", "core/get");
    params.put("class", itopClass);
    params.put("key", key);
    params.put("output_fields", outputFields);
    return params;
  }

  @VisibleForTesting
  static List<String> parseProfileList(JsonNode profileList) {
    if (profileList == null || profileList.isNull()) {
      return List.of();
    }
    final List<String> profiles = new ArrayList<>();
    if (profileList.isArray()) {
      for (JsonNode item : profileList) {
        final String name = item.isObject() ? item.path("profile").asText("") : item.asText("");
        if (!name.isBlank()) {
          profiles.add(name.trim());
        }
      }
      return profiles;
    }
    final String raw = profileList.asText("");
    for (String part : raw.split(",")) {
      if (!part.isBlank()) {
        profiles.add(part.trim());
      }
    }
    return profiles;
  }

  private static String numericList(Collection<String> ids) {
    return ids.stream().map(ItopQueryService::requireNumeric).collect(Collectors.joining(","));
  }

  private static String quoted(Collection<String> values) {
    return values.stream()
        .map(value -> "'" + value.replace("'", "") + "'")
        .collect(Collectors.joining(","));
  }

  // OQL へ埋め込む識別子は数値のみ許可する
  static String requireNumeric(String id) {
    if (id == null || id.isBlank() || !id.trim().chars().allMatch(Character::isDigit)) {
      throw new IllegalArgumentException("itop id must be numeric: " + id);
    }
    return id.trim();
  }
}
