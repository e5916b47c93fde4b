package com.github.spud.sample.ai.pollwatch.domain.session;

import com.github.spud.sample.ai.pollwatch.domain.schedule.ClassSchedule;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Future;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * 课程名 -> 监控状态 的注册表，"某课程是否正在被监控" 的唯一数据源
 * <p>
 * 同一课程最多只有一个 SessionState：注册通过 putIfAbsent 原子完成，watcher 退出时按实例注销。
 */
@Slf4j
public class SessionRegistry {

  private final ConcurrentMap<String, SessionState> sessions = new ConcurrentHashMap<>();

  /**
   * 若课程尚未注册，则注册并通过 launcher 启动 watcher
   *
   * @param launcher 接收新建的 SessionState，返回 watcher 的句柄
   * @return 新注册的状态；课程已在监控中时返回 empty
   */
  public Optional<SessionState> register(ClassSchedule schedule,
    Function<SessionState, Future<?>> launcher) {
    SessionState state = new SessionState(schedule);
    SessionState existing = sessions.putIfAbsent(schedule.getName(), state);
    if (existing != null) {
      log.debug("Session already registered: class={}", schedule.getName());
      return Optional.empty();
    }

    try {
      state.attach(launcher.apply(state));
    } catch (RuntimeException e) {
      sessions.remove(schedule.getName(), state);
      throw e;
    }
    return Optional.of(state);
  }

  /**
   * 注销指定实例；若注册表中已是另一实例则不做任何事
   */
  public boolean deregister(SessionState state) {
    return sessions.remove(state.getClassName(), state);
  }

  public boolean isRegistered(String className) {
    return sessions.containsKey(className);
  }

  public Optional<SessionState> find(String className) {
    return Optional.ofNullable(sessions.get(className));
  }

  public List<SessionState> snapshot() {
    return List.copyOf(sessions.values());
  }

  public int size() {
    return sessions.size();
  }
}
