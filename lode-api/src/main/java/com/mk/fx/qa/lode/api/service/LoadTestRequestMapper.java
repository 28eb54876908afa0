package com.mk.fx.qa.lode.api.service;

import com.mk.fx.qa.lode.api.dto.LoadTestRequest;
import com.mk.fx.qa.lode.core.config.Header;
import com.mk.fx.qa.lode.core.config.HttpMethod;
import com.mk.fx.qa.lode.core.config.InvalidConfigException;
import com.mk.fx.qa.lode.core.config.LoadTestConfig;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * Maps the REST request onto the engine's {@link LoadTestConfig}. Field-level failures are
 * rethrown as {@link InvalidRequestException} so the error response can name the offending field;
 * range checks on counts and timeout are left to the config itself.
 */
@Mapper(componentModel = "spring")
public interface LoadTestRequestMapper {

  String INVALID_URL = "Invalid URL";
  String INVALID_METHOD = "Invalid HTTP method";
  String INVALID_HEADER = "Invalid header name";

  /** Per-request timeout applied when the request omits {@code timeout_ms}. */
  Duration DEFAULT_TIMEOUT = Duration.ofMillis(5000);

  @Mapping(target = "url", source = "url", qualifiedByName = "toUri")
  @Mapping(target = "method", source = "method", qualifiedByName = "toMethod")
  @Mapping(target = "timeout", source = "timeoutMs", qualifiedByName = "toTimeout")
  @Mapping(target = "headers", source = "headers", qualifiedByName = "toHeaders")
  LoadTestConfig toConfig(LoadTestRequest request);

  @Named("toUri")
  default URI toUri(String url) {
    try {
      return LoadTestConfig.parseUrl(url);
    } catch (InvalidConfigException e) {
      throw new InvalidRequestException(INVALID_URL, e);
    }
  }

  @Named("toMethod")
  default HttpMethod toMethod(String method) {
    try {
      return HttpMethod.fromValue(method);
    } catch (InvalidConfigException e) {
      throw new InvalidRequestException(INVALID_METHOD, e);
    }
  }

  @Named("toTimeout")
  default Duration toTimeout(Long timeoutMs) {
    return timeoutMs == null ? DEFAULT_TIMEOUT : Duration.ofMillis(timeoutMs);
  }

  @Named("toHeaders")
  default List<Header> toHeaders(Map<String, String> headers) {
    if (headers == null) {
      return List.of();
    }
    List<Header> result = new ArrayList<>(headers.size());
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      try {
        result.add(new Header(entry.getKey(), entry.getValue()));
      } catch (InvalidConfigException e) {
        throw new InvalidRequestException(INVALID_HEADER, e);
      }
    }
    return result;
  }
}
