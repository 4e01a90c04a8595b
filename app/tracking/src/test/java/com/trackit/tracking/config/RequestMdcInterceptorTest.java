package com.trackit.tracking.config;

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
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void putsRequestKeysAndRemovesThemAfterCompletion() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/v1/packages/pkg-1:sync");
    request.addHeader("X-Request-Id", "req-1");
    request.addHeader("X-Forwarded-For", "203.0.113.9, 10.0.0.1");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("packageId", "pkg-1"));
    final MockHttpServletResponse response = new MockHttpServletResponse();

    interceptor.preHandle(request, response, new Object());

    assertThat(MDC.get("request_id")).isEqualTo("req-1");
    assertThat(MDC.get("http_method")).isEqualTo("POST");
    assertThat(MDC.get("client_ip")).isEqualTo("203.0.113.9");
    assertThat(MDC.get("package_id")).isEqualTo("pkg-1");
    assertThat(MDC.get("location_key")).isNull();

    interceptor.afterCompletion(request, response, new Object(), null);

    assertThat(MDC.get("request_id")).isNull();
    assertThat(MDC.get("package_id")).isNull();
  }

  @Test
  void generatesRequestIdAndKeepsActor() {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("PUT", "/admin/locations/hub-44/alias");
    request.addHeader("X-Actor-User-Id", "admin-1");
    request.setAttribute(
        HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE, Map.of("locationKey", "hub-44"));

    interceptor.preHandle(request, new MockHttpServletResponse(), new Object());

    assertThat(MDC.get("request_id")).isNotBlank();
    assertThat(MDC.get("actor_user_id")).isEqualTo("admin-1");
    assertThat(MDC.get("location_key")).isEqualTo("hub-44");
  }
}
