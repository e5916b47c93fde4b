package com.github.spud.sample.ai.pollwatch.domain.detect;

import org.springframework.util.StringUtils;

/**
 * 将页面摘要序列转换为边沿触发的 "内容已变化" 事件
 * <p>
 * 空摘要视为瞬时读取失败：不触发变化，也不覆盖上一次的有效摘要。每个会话一个实例，非线程安全。
 */
public class ChangeDetector {

  private String lastFingerprint;
  private String lastLocation;

  public ChangeDetector(String initialFingerprint, String initialLocation) {
    this.lastFingerprint = StringUtils.hasLength(initialFingerprint) ? initialFingerprint : null;
    this.lastLocation = initialLocation;
  }

  /**
   * 观察一个新摘要
   *
   * @return 相对上一次有效摘要是否发生变化（每次跳变只返回一次 true）
   */
  public boolean observe(String fingerprint) {
    if (!StringUtils.hasLength(fingerprint)) {
      return false;
    }
    if (fingerprint.equals(lastFingerprint)) {
      return false;
    }
    lastFingerprint = fingerprint;
    return true;
  }

  /**
   * 观察当前页面地址；地址变化总是视为内容变化
   */
  public boolean observeLocation(String location) {
    if (location == null || location.equals(lastLocation)) {
      return false;
    }
    lastLocation = location;
    return true;
  }

  /**
   * 在导航后以新页面的摘要作为基线，不产生事件
   */
  public void rebase(String fingerprint) {
    if (StringUtils.hasLength(fingerprint)) {
      lastFingerprint = fingerprint;
    }
  }

  public String lastFingerprint() {
    return lastFingerprint;
  }

  public String lastLocation() {
    return lastLocation;
  }
}
