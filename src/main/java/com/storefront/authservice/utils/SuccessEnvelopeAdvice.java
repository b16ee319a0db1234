package com.storefront.authservice.utils;

import com.storefront.authservice.model.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.data.domain.Page;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Puts 2xx JSON bodies into {@link ApiResponse}. A {@link Page} is split into {@code data}
 * (its content) and {@code meta} (paging). Problem bodies and non-2xx answers pass through.
 */
@RestControllerAdvice
public class SuccessEnvelopeAdvice implements ResponseBodyAdvice<Object> {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    @Override
    public boolean supports(@NonNull MethodParameter returnType,
                            @NonNull Class<? extends HttpMessageConverter<?>> converterType) {
        return true;
    }

    @Override
    public Object beforeBodyWrite(@Nullable Object body,
                                  @NonNull MethodParameter returnType,
                                  @NonNull MediaType contentType,
                                  @NonNull Class<? extends HttpMessageConverter<?>> converterType,
                                  @NonNull ServerHttpRequest request,
                                  @NonNull ServerHttpResponse response) {
        if (body == null || body instanceof ProblemDetail || body instanceof ApiResponse<?>) {
            return body;
        }
        if (!isJson(contentType) || !isSuccess(response)) {
            return body;
        }

        String requestId = request.getHeaders().getFirst(REQUEST_ID_HEADER);
        if (body instanceof Page<?> page) {
            return ApiResponse.of(requestId, messageOf(returnType), page.getContent(), paging(page));
        }
        return ApiResponse.of(requestId, messageOf(returnType), body, null);
    }

    private static boolean isJson(MediaType contentType) {
        return !MediaType.APPLICATION_PROBLEM_JSON.includes(contentType)
                && (MediaType.APPLICATION_JSON.includes(contentType) || contentType.getSubtype().endsWith("+json"));
    }

    private static boolean isSuccess(ServerHttpResponse response) {
        if (response instanceof ServletServerHttpResponse servlet) {
            int status = servlet.getServletResponse().getStatus();
            return status >= 200 && status < 300;
        }
        return true;
    }

    private static String messageOf(MethodParameter returnType) {
        ResponseMessage ann = returnType.getMethodAnnotation(ResponseMessage.class);
        if (ann == null) {
            ann = returnType.getContainingClass().getAnnotation(ResponseMessage.class);
        }
        return ann != null && StringUtils.hasText(ann.value()) ? ann.value() : "OK";
    }

    private static Map<String, Object> paging(Page<?> page) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("page", page.getNumber());
        meta.put("size", page.getSize());
        meta.put("totalItems", page.getTotalElements());
        meta.put("totalPages", page.getTotalPages());
        if (page.getSort().isSorted()) {
            meta.put("sort", page.getSort().toString());
        }
        return meta;
    }
}
