package com.github.spud.sample.ai.pollwatch.domain.session;

import com.github.spud.sample.ai.pollwatch.domain.schedule.ClassSchedule;
import java.util.concurrent.Future;
import lombok.Getter;
import lombok.Setter;

/**
 * 单个课程的监控状态
 * <p>
 * fingerprint 与 lastCommittedQuestion 只由所属 watcher 线程读写；handle 由调度器写入。
 */
@Getter
public class SessionState {

  private final ClassSchedule schedule;

  @Setter
  private String currentFingerprint;

  /**
   * 最近一次已提交答案的题干，用于避免重复作答
   */
  private String lastCommittedQuestion;

  private volatile Future<?> handle;

  public SessionState(ClassSchedule schedule) {
    this.schedule = schedule;
  }

  public String getClassName() {
    return schedule.getName();
  }

  public boolean isAlreadyCommitted(QuestionSnapshot snapshot) {
    return snapshot.getQuestion().equals(lastCommittedQuestion);
  }

  public void markCommitted(QuestionSnapshot snapshot) {
    this.lastCommittedQuestion = snapshot.getQuestion();
  }

  public void clearLastCommitted() {
    this.lastCommittedQuestion = null;
  }

  void attach(Future<?> handle) {
    this.handle = handle;
  }

  public boolean isAlive() {
    Future<?> h = handle;
    return h == null || !h.isDone();
  }
}
