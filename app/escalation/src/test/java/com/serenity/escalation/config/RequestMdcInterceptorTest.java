package com.serenity.escalation.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.servlet.HandlerMapping;

class RequestMdcInterceptorTest {

  private final RequestMdcInterceptor interceptor = new RequestMdcInterceptor();

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void putsAndRemovesMdcValuesAroundRequest() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/v1/crisis/alerts/alert-1/responses");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Trace-Id", "trace-1");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("crisisAlertId", "alert-1"));
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get(RequestMdcInterceptor.MDC_REQUEST_ID)).isEqualTo("req-1");
    assertThat(MDC.get(RequestMdcInterceptor.MDC_TRACE_ID)).isEqualTo("trace-1");
    assertThat(MDC.get(RequestMdcInterceptor.MDC_CRISIS_ALERT_ID)).isEqualTo("alert-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get(RequestMdcInterceptor.MDC_REQUEST_ID)).isNull();
    assertThat(MDC.get(RequestMdcInterceptor.MDC_CRISIS_ALERT_ID)).isNull();
  }

  @Test
  void generatesIdsWhenHeadersAreMissing() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/v1/crisis/system/health");

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get(RequestMdcInterceptor.MDC_REQUEST_ID)).isNotBlank();
    assertThat(MDC.get(RequestMdcInterceptor.MDC_TRACE_ID)).isNotBlank();
    assertThat(MDC.get(RequestMdcInterceptor.MDC_CRISIS_ALERT_ID)).isNull();
  }
}
