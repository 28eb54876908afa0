package com.mk.fx.qa.lode.api;

import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import com.sun.net.httpserver.HttpServer;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest(properties = {"lode.api.worker-threads=2", "lode.api.version=1.2.3"})
@AutoConfigureMockMvc
class LodeApiIntegrationTest {

  @Autowired MockMvc mvc;

  private HttpServer server;
  private ExecutorService handlers;
  private final AtomicInteger hits = new AtomicInteger();
  private String baseUrl;

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/ping",
        exchange -> {
          int status = hits.getAndIncrement() % 5 == 4 ? 503 : 200;
          byte[] body = "pong".getBytes();
          exchange.sendResponseHeaders(status, body.length);
          try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
          }
        });
    handlers = Executors.newCachedThreadPool();
    server.setExecutor(handlers);
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
    if (handlers != null) handlers.shutdownNow();
  }

  @Test
  void health_reportsVersion() throws Exception {
    mvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"))
        .andExpect(jsonPath("$.version").value("1.2.3"));
  }

  @Test
  void loadTest_runsAgainstRealTarget() throws Exception {
    String body =
        "{\"url\":\"" + baseUrl + "/ping\",\"method\":\"GET\",\"requests\":25,\"concurrency\":5}";

    mvc.perform(post("/load-test").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("completed"))
        .andExpect(jsonPath("$.total_requests").value(25))
        .andExpect(jsonPath("$.successful_requests").value(20))
        .andExpect(jsonPath("$.failed_requests").value(5))
        .andExpect(jsonPath("$.error_stats['503_service_unavailable']").value(5))
        .andExpect(jsonPath("$.requests_per_second").value(greaterThan(0.0)));
  }

  @Test
  void loadTest_invalidMethod_isRejectedBeforeDispatch() throws Exception {
    String body =
        "{\"url\":\"" + baseUrl + "/ping\",\"method\":\"TRACE\",\"requests\":5,\"concurrency\":1}";

    mvc.perform(post("/load-test").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid HTTP method"));
    assertEquals(0, hits.get());
  }

  @Test
  void loadTest_invalidHeaderName_isRejected() throws Exception {
    String body =
        "{\"url\":\""
            + baseUrl
            + "/ping\",\"method\":\"GET\",\"requests\":1,\"concurrency\":1,"
            + "\"headers\":{\"Bad Header\":\"x\"}}";

    mvc.perform(post("/load-test").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid header name"))
        .andExpect(
            jsonPath("$.details").value("Header name 'Bad Header' contains invalid characters"));
  }
}
