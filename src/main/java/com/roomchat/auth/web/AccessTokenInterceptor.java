package com.roomchat.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomchat.auth.service.JwtService;
import com.roomchat.common.api.ApiCodes;
import com.roomchat.common.api.Result;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * /api/** 的 Bearer 鉴权：解析 userId 写入 request attribute 与 AuthContext；缺失或无效一律 401。
 */
@Slf4j
@Component
public class AccessTokenInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_USER_ID = "X-Auth-UserId";

    private final JwtService jwtService;
    private final ObjectMapper objectMapper;

    public AccessTokenInterceptor(JwtService jwtService, ObjectMapper objectMapper) {
        this.jwtService = jwtService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            writeUnauthorized(request, response, "missing_access_token");
            return false;
        }

        String token = header.substring("Bearer ".length()).trim();
        try {
            long userId = jwtService.verify(token);
            request.setAttribute(REQ_ATTR_USER_ID, userId);
            AuthContext.setUserId(userId);
            return true;
        } catch (Exception e) {
            log.debug("rest token rejected: path={}, err={}", request.getRequestURI(), e.toString());
            writeUnauthorized(request, response, "invalid_access_token");
            return false;
        }
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }

    private void writeUnauthorized(HttpServletRequest request, HttpServletResponse response, String reason) {
        response.setStatus(401);
        response.setCharacterEncoding("UTF-8");
        response.setContentType("application/json;charset=UTF-8");
        try {
            String json = objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, reason));
            response.getWriter().write(json);
        } catch (Exception writeErr) {
            log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
        }
    }
}
