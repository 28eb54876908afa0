package com.mk.fx.qa.lode.core.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class HttpMethodTest {

  @Test
  void fromValue_isCaseInsensitive() {
    assertEquals(HttpMethod.GET, HttpMethod.fromValue("get"));
    assertEquals(HttpMethod.PATCH, HttpMethod.fromValue(" Patch "));
    assertEquals(HttpMethod.DELETE, HttpMethod.fromValue("DELETE"));
  }

  @Test
  void fromValue_unknownOrBlank_throws() {
    var ex = assertThrows(InvalidConfigException.class, () -> HttpMethod.fromValue("TRACE"));
    assertTrue(ex.getMessage().startsWith("Unsupported HTTP method: TRACE"));
    assertThrows(InvalidConfigException.class, () -> HttpMethod.fromValue(""));
    assertThrows(InvalidConfigException.class, () -> HttpMethod.fromValue(null));
  }

  @Test
  void acceptsBody_onlyForPayloadMethods() {
    assertTrue(HttpMethod.POST.acceptsBody());
    assertTrue(HttpMethod.PUT.acceptsBody());
    assertTrue(HttpMethod.PATCH.acceptsBody());
    assertFalse(HttpMethod.GET.acceptsBody());
    assertFalse(HttpMethod.DELETE.acceptsBody());
  }
}
