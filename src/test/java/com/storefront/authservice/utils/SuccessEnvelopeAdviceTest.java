package com.storefront.authservice.utils;

import com.storefront.authservice.model.ApiResponse;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SuccessEnvelopeAdviceTest {

    private final SuccessEnvelopeAdvice advice = new SuccessEnvelopeAdvice();
    private final MockHttpServletRequest servletRequest = new MockHttpServletRequest("GET", "/any");
    private final MockHttpServletResponse servletResponse = new MockHttpServletResponse();

    @ResponseMessage("Fetched")
    Map<String, String> annotated() {
        return Map.of();
    }

    Map<String, String> plain() {
        return Map.of();
    }

    private MethodParameter returnOf(String method) throws NoSuchMethodException {
        return new MethodParameter(SuccessEnvelopeAdviceTest.class.getDeclaredMethod(method), -1);
    }

    private Object write(Object body, String method, MediaType type) throws NoSuchMethodException {
        return advice.beforeBodyWrite(body, returnOf(method), type, MappingJackson2HttpMessageConverter.class,
                new ServletServerHttpRequest(servletRequest), new ServletServerHttpResponse(servletResponse));
    }

    @Test
    void plainBodyIsWrappedWithMessageAndRequestId() throws Exception {
        servletRequest.addHeader("X-Request-Id", "req-42");

        Object out = write(Map.of("k", "v"), "annotated", MediaType.APPLICATION_JSON);

        assertThat(out).isInstanceOf(ApiResponse.class);
        ApiResponse<?> envelope = (ApiResponse<?>) out;
        assertThat(envelope.message()).isEqualTo("Fetched");
        assertThat(envelope.requestId()).isEqualTo("req-42");
        assertThat(envelope.data()).isEqualTo(Map.of("k", "v"));
        assertThat(envelope.meta()).isNull();
    }

    @Test
    void messageDefaultsToOk() throws Exception {
        ApiResponse<?> envelope = (ApiResponse<?>) write("x", "plain", MediaType.APPLICATION_JSON);

        assertThat(envelope.message()).isEqualTo("OK");
        assertThat(envelope.requestId()).isNull();
    }

    @Test
    void pageIsSplitIntoContentAndPaging() throws Exception {
        PageImpl<String> page = new PageImpl<>(List.of("a", "b"),
                PageRequest.of(1, 2, Sort.by("createdAt")), 7);

        ApiResponse<?> envelope = (ApiResponse<?>) write(page, "plain", MediaType.APPLICATION_JSON);

        assertThat(envelope.data()).isEqualTo(List.of("a", "b"));
        assertThat(envelope.meta()).isInstanceOf(Map.class);
        assertThat((Map<String, Object>) envelope.meta())
                .containsEntry("page", 1)
                .containsEntry("size", 2)
                .containsEntry("totalItems", 7L)
                .containsEntry("totalPages", 4)
                .containsKey("sort");
    }

    @Test
    void problemsAndErrorStatusesPassThrough() throws Exception {
        ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
        assertThat(write(problem, "plain", MediaType.APPLICATION_PROBLEM_JSON)).isSameAs(problem);

        servletResponse.setStatus(409);
        Map<String, String> body = Map.of("k", "v");
        assertThat(write(body, "plain", MediaType.APPLICATION_JSON)).isSameAs(body);
    }

    @Test
    void nonJsonBodiesAreLeftAlone() throws Exception {
        assertThat(write("text", "plain", MediaType.TEXT_PLAIN)).isEqualTo("text");
    }
}
