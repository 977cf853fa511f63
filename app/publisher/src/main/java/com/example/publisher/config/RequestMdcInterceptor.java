/*
 * どこで: Publisher Web 層
 * 何を: リクエスト ID/呼び出し元/対象リソース(provider, 口座, ジョブ, コンテンツハッシュ)を MDC へ載せる
 * なぜ: 口座の不正指定や webhook 再送を JSON ログから追跡できるようにするため
 */
package com.example.publisher.config;

import com.example.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String USER_ID_HEADER = "X-User-Id";

  /** パス変数名をそのまま MDC キーとして使う。 */
  static final List<String> RESOURCE_PATH_VARIABLES =
      List.of("provider", "account_id", "job_id", "content_hash");

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> pushed = new ArrayList<>();
    final String requestId = TraceIds.orNew(request.getHeader(REQUEST_ID_HEADER));
    push(pushed, "request_id", requestId);
    // 下流ログと突き合わせられるよう採番した ID を返す
    response.setHeader(REQUEST_ID_HEADER, requestId);
    push(pushed, "http_method", request.getMethod());
    push(pushed, "http_path", request.getRequestURI());
    push(pushed, "client_ip", firstForwardedAddress(request));
    push(pushed, "user_id", request.getHeader(USER_ID_HEADER));
    final Map<?, ?> pathVariables = pathVariables(request);
    for (String name : RESOURCE_PATH_VARIABLES) {
      if (pathVariables.get(name) instanceof String value) {
        push(pushed, name, value);
      }
    }
    request.setAttribute(ATTRIBUTE_KEYS, pushed);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> pushed) {
      pushed.stream().filter(String.class::isInstance).map(String.class::cast).forEach(MDC::remove);
    }
  }

  private static String firstForwardedAddress(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }

  private static Map<?, ?> pathVariables(HttpServletRequest request) {
    if (request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE)
        instanceof Map<?, ?> variables) {
      return variables;
    }
    return Map.of();
  }

  private static void push(List<String> pushed, String key, @Nullable String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
      pushed.add(key);
    }
  }
}
