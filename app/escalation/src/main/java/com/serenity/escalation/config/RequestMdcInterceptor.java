/*
 * Where: escalation web layer
 * What: puts request_id, trace_id and crisis_alert_id into the MDC for each API call
 * Why: JSON logs of one alert can be correlated across API, queue and timer threads
 */
package com.serenity.escalation.config;

import com.serenity.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  public static final String MDC_REQUEST_ID = "request_id";
  public static final String MDC_TRACE_ID = "trace_id";
  public static final String MDC_CRISIS_ALERT_ID = "crisis_alert_id";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";
  private static final String PATH_VARIABLE_ALERT_ID = "crisisAlertId";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    put(keys, MDC_REQUEST_ID, resolveRequestId(request));
    put(keys, MDC_TRACE_ID, TraceIds.orNew(request.getHeader("X-Trace-Id")));
    put(keys, MDC_CRISIS_ALERT_ID, resolveCrisisAlertId(request));
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    final Object attribute = request.getAttribute(ATTRIBUTE_KEYS);
    if (!(attribute instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader("X-Request-Id");
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return UUID.randomUUID().toString();
  }

  private String resolveCrisisAlertId(HttpServletRequest request) {
    final Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    if (!(attribute instanceof Map<?, ?> variables)) {
      return null;
    }
    final Object value = variables.get(PATH_VARIABLE_ALERT_ID);
    return value == null ? null : value.toString();
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
