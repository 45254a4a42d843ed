package com.mandarinpal.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

/**
 * OpenAI HTTP 客户端配置
 *
 * <p>文本生成是一次有界等待的请求/响应，超时即作为本轮错误返回。
 * 重试次数在 application.yml 中通过 spring.ai.retry 关闭。</p>
 */
@Configuration
@RequiredArgsConstructor
public class OpenAIConfig {

    private final RoleplayProperties roleplayProperties;

    /**
     * 配置 RestClient 自定义器,设置超时时间
     * 这个自定义器会被 Spring AI 的自动配置使用
     */
    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> restClientBuilder.requestFactory(clientHttpRequestFactory());
    }

    private ClientHttpRequestFactory clientHttpRequestFactory() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(roleplayProperties.getConnectTimeout());
        factory.setReadTimeout(roleplayProperties.getReadTimeout());
        return factory;
    }
}
