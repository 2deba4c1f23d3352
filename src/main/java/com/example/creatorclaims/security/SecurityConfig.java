package com.example.creatorclaims.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {
    private final AuthenticationFilter authenticationFilter;
    private final ServiceSecretFilter serviceSecretFilter;
    private final AuthEntryPoint exceptionHandler;

    public SecurityConfig(AuthenticationFilter authenticationFilter,
                          ServiceSecretFilter serviceSecretFilter,
                          AuthEntryPoint exceptionHandler) {
        this.authenticationFilter = authenticationFilter;
        this.serviceSecretFilter = serviceSecretFilter;
        this.exceptionHandler = exceptionHandler;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
                // Stateless bearer tokens, no cookies to protect
                .csrf(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(authorize -> authorize
                        .requestMatchers(HttpMethod.POST, ServiceSecretFilter.PROVIDER_PATH_PREFIX + "**").hasRole("PROVIDER")
                        .requestMatchers(HttpMethod.POST, ServiceSecretFilter.WORKER_PATH_PREFIX + "**").hasRole("WORKER")
                        .anyRequest().authenticated()
                )
                .addFilterBefore(authenticationFilter, UsernamePasswordAuthenticationFilter.class)
                .addFilterBefore(serviceSecretFilter, UsernamePasswordAuthenticationFilter.class)
                .exceptionHandling(exceptionHandling ->
                        exceptionHandling.authenticationEntryPoint(exceptionHandler)
                );

        return http.build();
    }
}
