package com.misrhr.API;

import com.misrhr.resample.Downsampler;
import com.misrhr.resample.Upsampler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@ComponentScan(basePackageClasses = MisrHrConfig.class)
public class MisrHrConfig {

    // Both transforms are stateless, one shared instance is enough
    @Bean
    public Upsampler upsampler() {
        return new Upsampler();
    }

    @Bean
    public Downsampler downsampler() {
        return new Downsampler();
    }
}
