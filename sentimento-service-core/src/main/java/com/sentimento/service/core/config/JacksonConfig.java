package com.sentimento.service.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Omits null properties from every response and live frame. Null values inside event metadata are kept. */
@Configuration
public class JacksonConfig {

    @Bean
    public static BeanPostProcessor objectMapperNullOmittingCustomizer() {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (bean instanceof ObjectMapper om) {
                    om.setSerializationInclusion(JsonInclude.Include.NON_NULL);
                }
                return bean;
            }
        };
    }
}
