package ch.so.arp.pdfrag.web;

import java.util.Objects;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import ch.so.arp.pdfrag.config.RagProperties;

/**
 * Allows the configured frontend origins to call the API.
 */
@Configuration(proxyBeanMethods = false)
public class WebConfiguration implements WebMvcConfigurer {

    private final RagProperties properties;

    public WebConfiguration(RagProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(properties.getWeb().getAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*");
    }
}
