package com.firefly.kbagent.retry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class RetryControllerTest {

    private RecordingSleeper sleeper;
    private RetryController controller;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        RetryProperties.Policy policy = new RetryProperties().getProvisioning();
        controller = new RetryController("test", policy, new ServiceErrorClassifier(true, true), sleeper);
    }

    @Test
    void shouldReturnResultAfterTransientFailures() {
        AtomicInteger calls = new AtomicInteger();

        String result = controller.execute("Create kb", () -> {
            if (calls.incrementAndGet() < 3) {
                throw serverError();
            }
            return "ok";
        }, () -> "satisfied");

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeper.getDelays()).containsExactly(15_000L, 30_000L);
    }

    @Test
    void shouldSurfaceLastErrorUnchangedAfterEightAttempts() {
        AtomicInteger calls = new AtomicInteger();
        HttpServerErrorException[] last = new HttpServerErrorException[1];

        Throwable thrown = catchThrowable(() -> controller.execute("Create kb", () -> {
            calls.incrementAndGet();
            last[0] = serverError();
            throw last[0];
        }));

        assertThat(thrown).isSameAs(last[0]);

        assertThat(calls.get()).isEqualTo(8);
        assertThat(sleeper.getDelays())
                .containsExactly(15_000L, 30_000L, 60_000L, 120_000L, 240_000L, 480_000L, 960_000L);
    }

    @Test
    void shouldCollapseAlreadyExistsIntoSuccess() {
        AtomicInteger calls = new AtomicInteger();

        Boolean created = controller.execute("Create kb", () -> {
            calls.incrementAndGet();
            throw HttpClientErrorException.create(HttpStatus.BAD_REQUEST, "Bad Request", HttpHeaders.EMPTY,
                    "resource_already_exists_exception".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
        }, () -> Boolean.FALSE);

        assertThat(created).isFalse();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeper.getDelays()).isEmpty();
    }

    @Test
    void shouldNotRetryFatalErrors() {
        AtomicInteger calls = new AtomicInteger();
        IllegalArgumentException fatal = new IllegalArgumentException("bad mapping");

        assertThatThrownBy(() -> controller.execute("Create kb", () -> {
            calls.incrementAndGet();
            throw fatal;
        })).isSameAs(fatal);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeper.getDelays()).isEmpty();
    }

    @Test
    void shouldCapBackoffAtConfiguredMaximum() {
        RetryProperties.Policy policy = new RetryProperties.Policy(4, Duration.ofSeconds(1), 2.0,
                Duration.ofMillis(2500), false, false);
        RetryController capped = new RetryController("runtime", policy, new ServiceErrorClassifier(false, false), sleeper);

        assertThatThrownBy(() -> capped.execute("Invoke", () -> {
            throw serverError();
        })).isInstanceOf(HttpServerErrorException.class);

        assertThat(sleeper.getDelays()).containsExactly(1_000L, 2_000L, 2_500L);
    }

    private static HttpServerErrorException serverError() {
        return HttpServerErrorException.create(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                HttpHeaders.EMPTY, "{\"error\":\"internal\"}".getBytes(StandardCharsets.UTF_8),
                StandardCharsets.UTF_8);
    }
}
