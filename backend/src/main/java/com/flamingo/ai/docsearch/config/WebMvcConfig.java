package com.flamingo.ai.docsearch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration.
 *
 * <p>The document proxy is read by third-party viewers (PDF.js, office viewers) that issue range
 * requests from other origins, so it exposes the range headers to them.
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

  @Value("${docsearch.cors.allowed-origins:*}")
  private String[] allowedOrigins;

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/api/**")
        .allowedOrigins(allowedOrigins)
        .allowedMethods("GET", "POST", "OPTIONS")
        .allowedHeaders("Range", "Content-Type", "Authorization")
        .exposedHeaders("Content-Length", "Content-Range", "Accept-Ranges", "Content-Disposition")
        .maxAge(3600);
  }
}
