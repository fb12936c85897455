package com.sentimento.controller.rest;

import com.sentimento.controller.rest.security.PrincipalFilter;
import com.sentimento.service.core.access.PrincipalResolver;
import com.sentimento.service.core.config.SentimentoProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class RestConfiguration implements WebMvcConfigurer {

    private final SentimentoProperties properties;

    public RestConfiguration(SentimentoProperties properties) {
        this.properties = properties;
    }

    @Bean
    public FilterRegistrationBean<PrincipalFilter> sentimentoPrincipalFilter(PrincipalResolver resolver) {
        FilterRegistrationBean<PrincipalFilter> registration = new FilterRegistrationBean<>(new PrincipalFilter(resolver));
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOriginPatterns(properties.getCors().getAllowOrigin())
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("Authorization", "Content-Type", "X-User-Email");
    }
}
