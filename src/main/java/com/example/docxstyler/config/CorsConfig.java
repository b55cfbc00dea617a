package com.example.docxstyler.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

@Configuration
public class CorsConfig {

    @Value("${styler.cors.allowed-origins:*}")
    private List<String> allowedOrigins;

    @Value("${styler.report-header:X-Delta-Report}")
    private String reportHeader;

    @Bean
    public CorsFilter corsFilter() {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        CorsConfiguration config = new CorsConfiguration();

        // 允许的来源（生产环境应该指定具体域名）
        allowedOrigins.forEach(config::addAllowedOrigin);

        config.addAllowedMethod("GET");
        config.addAllowedMethod("POST");
        config.addAllowedMethod("OPTIONS");

        config.addAllowedHeader("*");

        // 浏览器端需要读取样式统计响应头和下载文件名
        config.addExposedHeader(reportHeader);
        config.addExposedHeader("Content-Disposition");

        config.setAllowCredentials(false);

        // 预检请求的缓存时间（秒）
        config.setMaxAge(3600L);

        source.registerCorsConfiguration("/**", config);
        return new CorsFilter(source);
    }
}
