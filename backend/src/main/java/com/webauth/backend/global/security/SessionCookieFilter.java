package com.webauth.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.webauth.backend.global.error.ProblemResponse;
import com.webauth.backend.modules.auth.application.SessionResolver;
import com.webauth.backend.modules.auth.application.SessionResolver.Resolution;
import com.webauth.backend.modules.auth.domain.UserProfile;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the session cookie once per request and exposes the user as a request attribute
 * and as the security principal.
 */
@Component
public class SessionCookieFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SessionCookieFilter.class);

    private final SessionResolver sessionResolver;
    private final SessionCookies sessionCookies;
    private final ProblemResponseWriter problemResponseWriter;

    public SessionCookieFilter(
            SessionResolver sessionResolver,
            SessionCookies sessionCookies,
            ProblemResponseWriter problemResponseWriter
    ) {
        this.sessionResolver = sessionResolver;
        this.sessionCookies = sessionCookies;
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Resolution resolution;
        try {
            resolution = sessionResolver.resolve(sessionCookies.read(request));
        } catch (RuntimeException ex) {
            log.error("failed to resolve session path={}", request.getRequestURI(), ex);
            SecurityContextHolder.clearContext();
            problemResponseWriter.write(response, ProblemResponse.internalError(request.getRequestURI()));
            return;
        }

        if (resolution.clearCookie()) {
            response.addHeader(HttpHeaders.SET_COOKIE, sessionCookies.clear().toString());
        }
        UserProfile user = resolution.user();
        request.setAttribute(SessionResolver.CURRENT_USER_ATTRIBUTE, user);
        if (!user.isEmpty()) {
            List<SimpleGrantedAuthority> authorities = new ArrayList<>();
            authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
            if (user.admin()) {
                authorities.add(new SimpleGrantedAuthority("ROLE_ADMIN"));
            }
            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    new SessionPrincipal(user.username(), user.admin()), null, authorities);
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.equals("/event");
    }
}
