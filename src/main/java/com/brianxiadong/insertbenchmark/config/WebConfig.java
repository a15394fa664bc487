package com.brianxiadong.insertbenchmark.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web配置类
 * 根路径跳转到概览接口，测试接口允许跨域调用
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    /**
     * 将根路径映射到 /api/index
     */
    @Override
    public void addViewControllers(ViewControllerRegistry registry) {
        registry.addViewController("/").setViewName("forward:/api/index");
    }

    /**
     * 配置CORS跨域，测试接口只需要 GET 和 POST
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "POST")
                .allowedHeaders("*")
                .maxAge(3600);
    }
}
