package com.example.resourceapi.config;

import com.example.resourceapi.security.resolver.TokenArgumentResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.result.method.annotation.ArgumentResolverConfigurer;

/**
 * WebFlux configuration for custom argument resolvers.
 *
 * <p>Registers the {@link TokenArgumentResolver} to enable injection of
 * {@link com.example.resourceapi.security.context.Token} into controller methods.</p>
 */
@Configuration
@RequiredArgsConstructor
public class WebFluxConfig implements WebFluxConfigurer {

    private final TokenArgumentResolver tokenArgumentResolver;

    @Override
    public void configureArgumentResolvers(ArgumentResolverConfigurer configurer) {
        configurer.addCustomResolver(tokenArgumentResolver);
    }
}
