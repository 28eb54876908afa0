package com.mk.fx.qa.lode.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.mk.fx.qa.lode.core.config.Header;
import com.mk.fx.qa.lode.core.config.HttpMethod;
import com.mk.fx.qa.lode.core.config.InvalidConfigException;
import com.mk.fx.qa.lode.core.config.LoadTestConfig;
import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class LodeArgumentsTest {

  private static LodeArguments parse(String... args) {
    var arguments = new LodeArguments();
    JCommander.newBuilder().addObject(arguments).build().parse(args);
    return arguments;
  }

  @Test
  void defaultsApplyWhenOnlyUrlIsGiven() {
    LodeArguments arguments = parse("--url", "http://localhost:8080/ping");
    LoadTestConfig config = arguments.toConfig();

    assertThat(config.url()).isEqualTo(URI.create("http://localhost:8080/ping"));
    assertThat(config.method()).isEqualTo(HttpMethod.GET);
    assertThat(config.requests()).isEqualTo(100);
    assertThat(config.concurrency()).isEqualTo(Runtime.getRuntime().availableProcessors());
    assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.headers()).isEmpty();
    assertThat(config.body()).isNull();
    assertThat(arguments.getFormat()).isEqualTo(OutputFormat.TEXT);
    assertThat(arguments.isVerbose()).isFalse();
  }

  @Test
  void shortOptionsPopulateConfig() {
    LoadTestConfig config =
        parse(
                "--url", "https://api.example.com/items",
                "-n", "250",
                "-c", "12",
                "-m", "post",
                "-t", "5",
                "-b", "{\"a\":1}")
            .toConfig();

    assertThat(config.method()).isEqualTo(HttpMethod.POST);
    assertThat(config.requests()).isEqualTo(250);
    assertThat(config.concurrency()).isEqualTo(12);
    assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(config.body()).isEqualTo("{\"a\":1}");
  }

  @Test
  void headersAreCommaSeparatedAndRepeatable() {
    LoadTestConfig config =
        parse(
                "--url", "http://localhost/",
                "-H", "Accept:application/json,X-Trace:abc",
                "--headers", "Authorization: Bearer t0ken")
            .toConfig();

    assertThat(config.headers())
        .containsExactly(
            new Header("Accept", "application/json"),
            new Header("X-Trace", "abc"),
            new Header("Authorization", "Bearer t0ken"));
  }

  @Test
  void headerValueKeepsEverythingAfterFirstColon() {
    LoadTestConfig config =
        parse("--url", "http://localhost/", "-H", "X-Url:http://a:1").toConfig();

    assertThat(config.headers()).containsExactly(new Header("X-Url", "http://a:1"));
  }

  @Test
  void formatParsesEnumName() {
    assertThat(parse("--url", "http://localhost/", "-f", "JSON").getFormat())
        .isEqualTo(OutputFormat.JSON);
  }

  @Test
  void nonNumericRequestsFailParsing() {
    assertThatThrownBy(() -> parse("--url", "http://localhost/", "-n", "lots"))
        .isInstanceOf(ParameterException.class);
  }

  @Test
  void zeroRequestsFailValidation() {
    LodeArguments arguments = parse("--url", "http://localhost/", "-n", "0");

    assertThatThrownBy(arguments::toConfig)
        .isInstanceOf(InvalidConfigException.class)
        .hasMessageContaining("Invalid number of requests");
  }

  @Test
  void zeroConcurrencyFailsValidation() {
    LodeArguments arguments = parse("--url", "http://localhost/", "-c", "0");

    assertThatThrownBy(arguments::toConfig)
        .isInstanceOf(InvalidConfigException.class)
        .hasMessageContaining("Invalid concurrency");
  }

  @Test
  void restrictedHeaderIsRejected() {
    LodeArguments arguments = parse("--url", "http://localhost/", "-H", "Host:evil");

    assertThatThrownBy(arguments::toConfig).isInstanceOf(InvalidConfigException.class);
  }
}
