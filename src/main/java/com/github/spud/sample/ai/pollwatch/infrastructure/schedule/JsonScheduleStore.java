package com.github.spud.sample.ai.pollwatch.infrastructure.schedule;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.pollwatch.application.config.PollWatchProperties;
import com.github.spud.sample.ai.pollwatch.domain.schedule.ClassSchedule;
import com.github.spud.sample.ai.pollwatch.domain.schedule.ConfigException;
import com.github.spud.sample.ai.pollwatch.domain.schedule.ScheduleStore;
import com.github.spud.sample.ai.pollwatch.infrastructure.util.JsonUtils;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.json.JsonParseException;
import org.springframework.stereotype.Component;

/**
 * 从 JSON 文件加载课程表
 * <pre>
 * {
 *   "CS 101": { "section": "abc", "start_time": "09:00:00", "end_time": "10:15:00" }
 * }
 * </pre>
 * start_time / end_time 之外的字段都作为连接参数保留；无法解析的时间视为未设置。
 */
@Slf4j
@Component
public class JsonScheduleStore implements ScheduleStore {

  static final String START_TIME = "start_time";
  static final String END_TIME = "end_time";

  private final PollWatchProperties properties;

  public JsonScheduleStore(PollWatchProperties properties) {
    this.properties = properties;
  }

  @Override
  public Map<String, ClassSchedule> loadSchedules() {
    Path path = Path.of(properties.getSchedulesFile());
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Schedule file not found: " + path.toAbsolutePath());
    }

    JsonNode root;
    try {
      root = JsonUtils.readTree(path.toFile());
    } catch (JsonParseException e) {
      throw new ConfigException("Malformed schedule file " + path + ": " + e.getMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new ConfigException("Schedule file must contain a JSON object: " + path);
    }

    Map<String, ClassSchedule> schedules = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> entry = fields.next();
      schedules.put(entry.getKey(), toSchedule(entry.getKey(), entry.getValue()));
    }

    log.info("Loaded {} class(es) from {}", schedules.size(), path);
    return Collections.unmodifiableMap(schedules);
  }

  private ClassSchedule toSchedule(String name, JsonNode node) {
    if (!node.isObject()) {
      throw new ConfigException("Class '" + name + "' must be a JSON object");
    }

    ClassSchedule.ClassScheduleBuilder builder = ClassSchedule.builder()
      .name(name)
      .startTime(parseTime(name, node.get(START_TIME)))
      .endTime(parseTime(name, node.get(END_TIME)));

    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (START_TIME.equals(field.getKey()) || END_TIME.equals(field.getKey())) {
        continue;
      }
      Object value = JsonUtils.objectMapper().convertValue(field.getValue(), Object.class);
      if (value != null) {
        builder.connection(field.getKey(), value);
      }
    }
    return builder.build();
  }

  private LocalTime parseTime(String name, JsonNode node) {
    if (node == null || node.isNull() || !node.isTextual() || node.asText().isBlank()) {
      return null;
    }
    try {
      return LocalTime.parse(node.asText().trim());
    } catch (DateTimeParseException e) {
      log.warn("[{}] Ignoring invalid time '{}': {}", name, node.asText(), e.getMessage());
      return null;
    }
  }
}
