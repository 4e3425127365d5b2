package com.acme.brickwatch.web.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import org.slf4j.MDC;
import org.slf4j.Marker;

/**
 * Puts the current thread id and the Brick Watch component running on it into the MDC, so log
 * lines from the deadline loop and notification workers stand out from request handling.
 */
public class ThreadIdTurboFilter extends TurboFilter {
  static final String THREAD_ID_KEY = "threadId";
  static final String COMPONENT_KEY = "component";

  // Thread name prefix -> component
  private static final Map<String, String> COMPONENTS =
      Map.of(
          "deadline-scheduler", "scheduler",
          "notification-", "notifier",
          "scheduled-executor", "sweeper",
          "default-nioEventLoopGroup", "http",
          "io-executor", "http");

  @Override
  public FilterReply decide(
      Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
    Thread current = Thread.currentThread();
    MDC.put(THREAD_ID_KEY, String.valueOf(current.getId()));
    MDC.put(COMPONENT_KEY, componentOf(current.getName()));
    return FilterReply.NEUTRAL;
  }

  static String componentOf(String threadName) {
    for (Map.Entry<String, String> entry : COMPONENTS.entrySet()) {
      if (threadName.startsWith(entry.getKey())) {
        return entry.getValue();
      }
    }
    return "main";
  }
}
