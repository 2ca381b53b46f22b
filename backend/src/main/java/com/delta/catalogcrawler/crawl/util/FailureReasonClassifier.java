package com.delta.catalogcrawler.crawl.util;

import com.delta.catalogcrawler.crawl.model.CrawlErrorKind;
import com.delta.catalogcrawler.crawl.model.RenderResult;

import java.util.Locale;

public final class FailureReasonClassifier {
  public static final String TIMEOUT = "timeout";
  public static final String RENDER_TIMEOUT = "render_timeout";
  public static final String DNS_FAILURE = "dns_failure";
  public static final String TLS_FAILURE = "tls_failure";
  public static final String IO_ERROR = "io_error";
  public static final String HTTP_401_403 = "http_401_403";
  public static final String HTTP_404 = "http_404";
  public static final String HTTP_410 = "http_410";
  public static final String HTTP_429_RATE_LIMIT = "http_429";
  public static final String HTTP_5XX = "http_5xx";
  public static final String HTTP_4XX = "http_4xx";
  public static final String ROBOTS_BLOCKED = "robots_blocked";
  public static final String DISALLOWED_CONTENT_TYPE = "disallowed_content_type";
  public static final String TOO_LARGE = "too_large";
  public static final String INVALID_URL = "invalid_url";
  public static final String INTERRUPTED = "interrupted";
  public static final String MEMORY_PRESSURE = "memory_pressure";
  public static final String UNKNOWN = "unknown";

  private FailureReasonClassifier() {}

  public static String classify(RenderResult result) {
    if (result == null) {
      return UNKNOWN;
    }
    if (result.errorCode() != null && !result.errorCode().isBlank()) {
      return fromErrorCode(result.errorCode(), result.errorMessage());
    }
    return fromHttpStatus(result.statusCode());
  }

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 410) {
      return HTTP_410;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    if (status >= 400 && status < 500) {
      return HTTP_4XX;
    }
    return UNKNOWN;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("render_timeout")) {
      return RENDER_TIMEOUT;
    }
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.equals(DISALLOWED_CONTENT_TYPE)) {
      return DISALLOWED_CONTENT_TYPE;
    }
    if (code.equals(TOO_LARGE)) {
      return TOO_LARGE;
    }
    if (code.equals(INVALID_URL)) {
      return INVALID_URL;
    }
    if (code.equals(INTERRUPTED)) {
      return INTERRUPTED;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      return IO_ERROR;
    }
    return UNKNOWN;
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, RENDER_TIMEOUT, IO_ERROR, TLS_FAILURE, HTTP_429_RATE_LIMIT, HTTP_5XX, INTERRUPTED -> true;
      default -> false;
    };
  }

  public static CrawlErrorKind kindOf(String reasonCode) {
    if (MEMORY_PRESSURE.equals(reasonCode)) {
      return CrawlErrorKind.RESOURCE_EXHAUSTION;
    }
    return isRetryable(reasonCode) ? CrawlErrorKind.TRANSIENT_FETCH : CrawlErrorKind.TERMINAL_FETCH;
  }
}
