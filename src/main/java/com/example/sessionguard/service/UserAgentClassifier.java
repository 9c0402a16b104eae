package com.example.sessionguard.service;

import com.example.sessionguard.domain.entity.DeviceInfo;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Best-effort user-agent classification driven by ordered rule tables. The first matching rule
 * wins, so more specific tokens come first: Edge and Opera user agents also carry "Chrome", Chrome
 * carries "Safari", Android carries "Linux" and iOS carries "Mac OS X".
 */
@Component
public class UserAgentClassifier {

  record Rule(Pattern pattern, String label) {
    static Rule of(String regex, String label) {
      return new Rule(Pattern.compile(regex), label);
    }

    boolean matches(String userAgent) {
      return pattern.matcher(userAgent).find();
    }
  }

  static final List<Rule> BROWSER_RULES = List.of(
      Rule.of("Edg(e|A|iOS)?/", "Edge"),
      Rule.of("OPR/|Opera", "Opera"),
      Rule.of("Chrome/|CriOS/", "Chrome"),
      Rule.of("Firefox/|FxiOS/", "Firefox"),
      Rule.of("Safari/", "Safari"));

  static final List<Rule> OS_RULES = List.of(
      Rule.of("Android", "Android"),
      Rule.of("iPhone|iPad|iPod", "iOS"),
      Rule.of("Windows", "Windows"),
      Rule.of("Mac OS X|Macintosh", "macOS"),
      Rule.of("CrOS", "ChromeOS"),
      Rule.of("Linux", "Linux"));

  static final List<Rule> DEVICE_CLASS_RULES = List.of(
      Rule.of("iPad|Tablet|Android(?!.*Mobile)", "Tablet"),
      Rule.of("Mobile|iPhone|iPod|Android", "Mobile"));

  private static final String DESKTOP = "Desktop";

  public DeviceInfo classify(String userAgent) {
    if (userAgent == null || userAgent.isBlank()) {
      return DeviceInfo.unknown();
    }

    String browser = firstMatch(BROWSER_RULES, userAgent, DeviceInfo.UNKNOWN);
    String os = firstMatch(OS_RULES, userAgent, DeviceInfo.UNKNOWN);
    String deviceClass = firstMatch(DEVICE_CLASS_RULES, userAgent, DESKTOP);
    return new DeviceInfo(browser, os, deviceClass, !DESKTOP.equals(deviceClass));
  }

  private String firstMatch(List<Rule> rules, String userAgent, String fallback) {
    for (Rule rule : rules) {
      if (rule.matches(userAgent)) {
        return rule.label();
      }
    }
    return fallback;
  }
}
