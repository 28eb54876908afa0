package com.mk.fx.qa.lode.core.config;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LoadTestConfigTest {

  private static LoadTestConfig.LoadTestConfigBuilder valid() {
    return LoadTestConfig.builder()
        .url(URI.create("http://localhost:8080/ping"))
        .method(HttpMethod.GET)
        .requests(10)
        .concurrency(2);
  }

  @Test
  void build_appliesDefaults() {
    LoadTestConfig config = valid().build();
    assertEquals(LoadTestConfig.DEFAULT_TIMEOUT, config.timeout());
    assertEquals(Duration.ofSeconds(30), config.timeout());
    assertTrue(config.headers().isEmpty());
    assertNull(config.body());
  }

  @Test
  void build_rejectsNonPositiveCounts() {
    var requests = assertThrows(InvalidConfigException.class, () -> valid().requests(0).build());
    assertEquals("Invalid number of requests: 0", requests.getMessage());
    var concurrency =
        assertThrows(InvalidConfigException.class, () -> valid().concurrency(-1).build());
    assertEquals("Invalid concurrency: -1", concurrency.getMessage());
  }

  @Test
  void build_rejectsMissingFieldsAndBadTimeout() {
    assertThrows(InvalidConfigException.class, () -> valid().url(null).build());
    assertThrows(InvalidConfigException.class, () -> valid().method(null).build());
    assertThrows(InvalidConfigException.class, () -> valid().timeout(Duration.ZERO).build());
    assertThrows(
        InvalidConfigException.class, () -> valid().timeout(Duration.ofMillis(-5)).build());
  }

  @Test
  void build_rejectsNonHttpUrls() {
    assertThrows(
        InvalidConfigException.class, () -> valid().url(URI.create("ftp://host/file")).build());
    assertThrows(InvalidConfigException.class, () -> valid().url(URI.create("/relative")).build());
  }

  @Test
  void parseUrl_acceptsHttpAndHttps_rejectsGarbage() {
    assertEquals("https", LoadTestConfig.parseUrl("https://example.com/a?b=c").getScheme());
    assertEquals(9000, LoadTestConfig.parseUrl(" http://127.0.0.1:9000 ").getPort());

    var ex = assertThrows(InvalidConfigException.class, () -> LoadTestConfig.parseUrl("not a url"));
    assertTrue(ex.getMessage().startsWith("Invalid URL"));
    assertThrows(InvalidConfigException.class, () -> LoadTestConfig.parseUrl("mailto:a@b.c"));
    assertThrows(InvalidConfigException.class, () -> LoadTestConfig.parseUrl("http://"));
    assertThrows(InvalidConfigException.class, () -> LoadTestConfig.parseUrl(""));
  }

  @Test
  void effectiveConcurrency_isCappedByRequests() {
    assertEquals(3, valid().requests(3).concurrency(50).build().effectiveConcurrency());
    assertEquals(2, valid().requests(100).concurrency(2).build().effectiveConcurrency());
  }

  @Test
  void sendsBody_onlyWhenMethodAcceptsOne() {
    assertTrue(valid().method(HttpMethod.POST).body("{}").build().sendsBody());
    assertFalse(valid().method(HttpMethod.GET).body("{}").build().sendsBody());
    assertFalse(valid().method(HttpMethod.PUT).build().sendsBody());
  }

  @Test
  void headers_areCopiedAndKeepOrderAndDuplicates() {
    List<Header> headers = new ArrayList<>();
    headers.add(new Header("X-A", "1"));
    headers.add(new Header("X-A", "2"));
    LoadTestConfig config = valid().headers(headers).build();
    headers.clear();

    assertEquals(2, config.headers().size());
    assertEquals("1", config.headers().get(0).value());
    assertEquals("2", config.headers().get(1).value());
    assertThrows(UnsupportedOperationException.class, () -> config.headers().add(null));
  }
}
