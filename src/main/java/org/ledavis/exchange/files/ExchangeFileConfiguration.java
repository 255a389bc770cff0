package org.ledavis.exchange.files;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.ledavis.exchange.graph.GraphBuilder;
import org.ledavis.exchange.graph.NodeStyler;
import org.ledavis.exchange.render.GraphRenderer;
import org.ledavis.exchange.render.VisNetworkHtmlRenderer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 交换文件服务的 Bean 装配：路径白名单、文件读取、建图与渲染。全部基于本地文件系统。
 */
@Configuration(proxyBeanMethods = false)
public class ExchangeFileConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(ExchangeFileProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public ExchangeFileReader exchangeFileReader(ExchangeFileProperties properties) {
        return new ExchangeFileReader(properties.getReadMaxBytes().toBytes());
    }

    @Bean
    public GraphBuilder graphBuilder(ExchangeFileProperties properties) {
        return new GraphBuilder(new NodeStyler(properties.getTitleWidth()));
    }

    @Bean
    public GraphRenderer graphRenderer(ObjectMapper objectMapper) {
        return new VisNetworkHtmlRenderer(objectMapper);
    }
}
